package org.javai.latexast.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One-level simplifier.
 * <p>
 * Only the root node is rewritten: numeric arguments of a sum or product are folded
 * together, numeric powers and built-in functions of numbers are evaluated, and the
 * identities {@code x**1 = x} and {@code x**0 = 1} are applied. Children are never
 * simplified, which is what lets the step evaluator surface one reduction per step.
 * <p>
 * The simplifier never produces a non-finite number; such a result is reported as a
 * {@link SimplificationException} and the expression is left for the caller to keep
 * as it is.
 */
public class Simplifier implements ExpressionVisitor<Expression> {

	/**
	 * @return the simplified expression, or the same instance when nothing applies
	 * @throws SimplificationException if a numeric evaluation has no finite result
	 */
	public Expression simplify(Expression expression) {
		return expression.accept(this);
	}

	@Override
	public Expression visitNumber(Expression.Number number) {
		return number;
	}

	@Override
	public Expression visitSymbol(Expression.Symbol symbol) {
		return symbol;
	}

	@Override
	public Expression visitAdd(Expression.Add add) {
		if (add.args().isEmpty()) {
			return new Expression.Number(0.0);
		}
		return fold(add, add.args(), 0.0, false);
	}

	@Override
	public Expression visitMul(Expression.Mul mul) {
		if (mul.args().isEmpty()) {
			return new Expression.Number(1.0);
		}
		return fold(mul, mul.args(), 1.0, true);
	}

	@Override
	public Expression visitPow(Expression.Pow pow) {
		if (pow.exponent() instanceof Expression.Number e) {
			if (pow.base() instanceof Expression.Number b) {
				return finite(Math.pow(b.value(), e.value()), pow);
			}
			if (e.value() == 1.0) {
				return pow.base();
			}
			if (e.value() == 0.0) {
				return new Expression.Number(1.0);
			}
		}
		return pow;
	}

	@Override
	public Expression visitFunctionCall(Expression.FunctionCall call) {
		Optional<BuiltinFunction> function = BuiltinFunction.forName(call.name());
		if (function.isEmpty() || !call.args().stream().allMatch(Expression.Number.class::isInstance)) {
			return call;
		}
		double[] values = call.args().stream()
				.mapToDouble(arg -> ((Expression.Number) arg).value())
				.toArray();
		return new Expression.Number(function.get().apply(values));
	}

	@Override
	public Expression visitUnknown(Expression.Unknown unknown) {
		return unknown;
	}

	private Expression fold(Expression original, List<Expression> args, double identity, boolean product) {
		int numericCount = 0;
		int firstNumeric = -1;
		double accumulated = identity;
		for (int i = 0; i < args.size(); i++) {
			if (args.get(i) instanceof Expression.Number n) {
				accumulated = product ? accumulated * n.value() : accumulated + n.value();
				numericCount++;
				if (firstNumeric < 0) {
					firstNumeric = i;
				}
			}
		}
		if (numericCount == 0) {
			return args.size() == 1 ? args.get(0) : original;
		}
		Expression.Number folded = finite(accumulated, original);
		if (numericCount == args.size() || (product && accumulated == 0.0)) {
			return folded;
		}

		List<Expression> rest = new ArrayList<>(args.size() - numericCount + 1);
		for (int i = 0; i < args.size(); i++) {
			Expression arg = args.get(i);
			if (i == firstNumeric && accumulated != identity) {
				rest.add(folded);
			}
			else if (!(arg instanceof Expression.Number)) {
				rest.add(arg);
			}
		}
		if (rest.size() == 1) {
			return rest.get(0);
		}
		if (numericCount == 1 && rest.size() == args.size()) {
			return original;
		}
		return product ? new Expression.Mul(rest) : new Expression.Add(rest);
	}

	private static Expression.Number finite(double value, Expression source) {
		if (!Double.isFinite(value)) {
			throw new SimplificationException(ExpressionPrinter.print(source) + " does not evaluate to a finite number");
		}
		return new Expression.Number(value);
	}
}
