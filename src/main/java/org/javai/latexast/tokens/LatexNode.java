package org.javai.latexast.tokens;

import java.util.List;
import java.util.Objects;

/**
 * A node of the raw LaTeX tree produced by {@link LatexWalker}.
 * <p>
 * This tree keeps everything the walker saw, including macro argument boundaries,
 * whitespace inside character runs, comments and environments. {@link TokenTreeBuilder}
 * reduces it to the public {@link TokenNode} tree.
 */
public sealed interface LatexNode {

	int position();

	<R> R accept(LatexNodeVisitor<R> visitor);

	/**
	 * @param arguments one node list per argument that was present; absent optional
	 * arguments are left out
	 */
	record MacroNode(String name, List<List<LatexNode>> arguments, int position) implements LatexNode {
		public MacroNode {
			Objects.requireNonNull(name, "name must not be null");
			arguments = arguments.stream().map(List::copyOf).toList();
		}

		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitMacro(this);
		}
	}

	record GroupNode(List<LatexNode> children, int position) implements LatexNode {
		public GroupNode {
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	/**
	 * @param delimiter the opening delimiter: {@code $}, {@code $$}, {@code \(} or {@code \[}
	 */
	record MathNode(String delimiter, List<LatexNode> children, int position) implements LatexNode {
		public MathNode {
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitMath(this);
		}
	}

	/**
	 * A run of ordinary characters, whitespace included.
	 */
	record CharsNode(String chars, int position) implements LatexNode {
		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitChars(this);
		}
	}

	record EnvironmentNode(String name, List<LatexNode> children, int position) implements LatexNode {
		public EnvironmentNode {
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitEnvironment(this);
		}
	}

	/**
	 * One of the special characters {@code &}, {@code ~} or {@code #}.
	 */
	record SpecialsNode(String chars, int position) implements LatexNode {
		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitSpecials(this);
		}
	}

	record CommentNode(String text, int position) implements LatexNode {
		@Override
		public <R> R accept(LatexNodeVisitor<R> visitor) {
			return visitor.visitComment(this);
		}
	}
}
