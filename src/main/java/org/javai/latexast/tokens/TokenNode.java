package org.javai.latexast.tokens;

import java.util.List;
import java.util.Objects;

/**
 * A node of the syntactic token tree.
 * <p>
 * The tree is immutable and its traversal order is the left-to-right source order.
 * Whitespace never appears in it.
 */
public sealed interface TokenNode {

	<R> R accept(TokenNodeVisitor<R> visitor);

	/**
	 * A control sequence. The nodes of all its arguments are concatenated into
	 * {@code args}; where one argument ends and the next begins is not recorded.
	 */
	record Macro(String name, List<TokenNode> args) implements TokenNode {
		public Macro {
			Objects.requireNonNull(name, "name must not be null");
			args = List.copyOf(args);
		}

		@Override
		public <R> R accept(TokenNodeVisitor<R> visitor) {
			return visitor.visitMacro(this);
		}
	}

	record Group(List<TokenNode> children) implements TokenNode {
		public Group {
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(TokenNodeVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	record MathRegion(List<TokenNode> children) implements TokenNode {
		public MathRegion {
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(TokenNodeVisitor<R> visitor) {
			return visitor.visitMathRegion(this);
		}
	}

	/**
	 * A single non-whitespace character (one code point).
	 */
	record Char(String value) implements TokenNode {
		public Char {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R> R accept(TokenNodeVisitor<R> visitor) {
			return visitor.visitChar(this);
		}
	}
}
