package org.javai.latexast.expr;

import java.util.List;
import java.util.Objects;

/**
 * A node of a semantic expression tree.
 * <p>
 * The tree is immutable. Every node is one of the record variants below; code that
 * needs to handle each kind goes through {@link #accept(ExpressionVisitor)} so that a
 * new kind cannot be added without every visitor being updated.
 */
public sealed interface Expression {

	<R> R accept(ExpressionVisitor<R> visitor);

	record Number(double value) implements Expression {
		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitNumber(this);
		}
	}

	record Symbol(String name) implements Expression {
		public Symbol {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitSymbol(this);
		}
	}

	/**
	 * Sum of its arguments. Argument order is kept as parsed.
	 */
	record Add(List<Expression> args) implements Expression {
		public Add {
			args = List.copyOf(args);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitAdd(this);
		}
	}

	/**
	 * Product of its arguments. Argument order is kept as parsed.
	 */
	record Mul(List<Expression> args) implements Expression {
		public Mul {
			args = List.copyOf(args);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitMul(this);
		}
	}

	record Pow(Expression base, Expression exponent) implements Expression {
		public Pow {
			Objects.requireNonNull(base, "base must not be null");
			Objects.requireNonNull(exponent, "exponent must not be null");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitPow(this);
		}
	}

	record FunctionCall(String name, List<Expression> args) implements Expression {
		public FunctionCall {
			Objects.requireNonNull(name, "name must not be null");
			args = List.copyOf(args);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitFunctionCall(this);
		}
	}

	/**
	 * Opaque node carrying only its display text. Never recursed into.
	 */
	record Unknown(String text) implements Expression {
		public Unknown {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitUnknown(this);
		}
	}

	static Number number(double value) {
		return new Number(value);
	}

	static Symbol symbol(String name) {
		return new Symbol(name);
	}

	static Add add(Expression... args) {
		return new Add(List.of(args));
	}

	static Mul mul(Expression... args) {
		return new Mul(List.of(args));
	}

	static Pow pow(Expression base, Expression exponent) {
		return new Pow(base, exponent);
	}

	static FunctionCall call(String name, Expression... args) {
		return new FunctionCall(name, List.of(args));
	}
}
