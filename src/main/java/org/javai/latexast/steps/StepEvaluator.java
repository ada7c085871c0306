package org.javai.latexast.steps;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.javai.latexast.ProcessorSettings;
import org.javai.latexast.ResourceLimitExceededException;
import org.javai.latexast.expr.Expression;
import org.javai.latexast.expr.ExpressionPrinter;
import org.javai.latexast.expr.ExpressionReadException;
import org.javai.latexast.expr.ExpressionReader;
import org.javai.latexast.expr.ExpressionVisitor;
import org.javai.latexast.expr.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the sequence of intermediate forms an expression passes through on its way to
 * a value.
 * <p>
 * Evaluation is bottom-up. A leaf has a single step, its own text. For an operator node
 * the step sequences of all children are computed first and then walked in lock step:
 * at step {@code i} each child contributes its {@code i}-th step, or its last one if it
 * has fewer, so a child that is already fully reduced holds steady while its siblings
 * keep reducing. The chosen step texts are read back into expressions, the node is
 * rebuilt from them, and the rebuilt candidate is recorded. When the one-level
 * {@link Simplifier} changes the candidate, the simplified form is recorded after it.
 * Consecutive duplicates are not recorded.
 * <p>
 * Simplification failures are absorbed: the candidate is kept as it is.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class StepEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(StepEvaluator.class);

	private final Simplifier simplifier;
	private final int maxDepth;

	public StepEvaluator() {
		this(new Simplifier(), ProcessorSettings.DEFAULT_MAX_DEPTH);
	}

	public StepEvaluator(Simplifier simplifier, int maxDepth) {
		this.simplifier = Objects.requireNonNull(simplifier, "simplifier must not be null");
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive");
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * @return a non-empty step sequence; its last step is the evaluated form
	 * @throws ResourceLimitExceededException if the tree is deeper than the configured maximum
	 */
	public StepSequence evaluate(Expression expression) {
		Objects.requireNonNull(expression, "expression must not be null");
		return new StepSequence(expression.accept(new Evaluation()));
	}

	/**
	 * State of one {@link #evaluate} call.
	 */
	private final class Evaluation implements ExpressionVisitor<List<String>> {

		/** Leaf subtrees by text, reused instead of being read back. */
		private final Map<String, Expression> leaves = new HashMap<>();
		private int depth = 0;

		@Override
		public List<String> visitNumber(Expression.Number number) {
			return leaf(number);
		}

		@Override
		public List<String> visitSymbol(Expression.Symbol symbol) {
			return leaf(symbol);
		}

		@Override
		public List<String> visitUnknown(Expression.Unknown unknown) {
			return leaf(unknown);
		}

		@Override
		public List<String> visitAdd(Expression.Add add) {
			return combine(add.args(), Expression.Add::new);
		}

		@Override
		public List<String> visitMul(Expression.Mul mul) {
			return combine(mul.args(), Expression.Mul::new);
		}

		@Override
		public List<String> visitFunctionCall(Expression.FunctionCall call) {
			return combine(call.args(), parts -> new Expression.FunctionCall(call.name(), parts));
		}

		@Override
		public List<String> visitPow(Expression.Pow pow) {
			return combine(List.of(pow.base(), pow.exponent()),
					parts -> new Expression.Pow(parts.get(0), parts.get(1)));
		}

		private List<String> leaf(Expression leaf) {
			String text = ExpressionPrinter.print(leaf);
			leaves.putIfAbsent(text, leaf);
			return List.of(text);
		}

		private List<String> combine(List<Expression> children,
				Function<List<Expression>, Expression> rebuild) {
			List<List<String>> childSteps = new ArrayList<>(children.size());
			enter();
			try {
				for (Expression child : children) {
					childSteps.add(child.accept(this));
				}
			}
			finally {
				depth--;
			}

			int stepCount = childSteps.stream().mapToInt(List::size).max().orElse(1);
			List<String> steps = new ArrayList<>();
			for (int i = 0; i < stepCount; i++) {
				List<Expression> parts = new ArrayList<>(childSteps.size());
				for (List<String> sequence : childSteps) {
					parts.add(resolve(sequence.get(Math.min(i, sequence.size() - 1))));
				}
				Expression candidate = rebuild.apply(parts);
				appendDistinct(steps, ExpressionPrinter.print(candidate));

				Expression simplified = trySimplify(candidate);
				if (!simplified.equals(candidate)) {
					appendDistinct(steps, ExpressionPrinter.print(simplified));
				}
			}
			return steps;
		}

		private Expression resolve(String step) {
			Expression leaf = leaves.get(step);
			if (leaf != null) {
				return leaf;
			}
			try {
				return ExpressionReader.read(step);
			} catch (ExpressionReadException e) {
				logger.debug("Could not read step '{}' back, keeping it opaque: {}", step, e.getMessage());
				return new Expression.Unknown(step);
			}
		}

		private Expression trySimplify(Expression candidate) {
			try {
				return simplifier.simplify(candidate);
			} catch (RuntimeException e) {
				logger.debug("Simplification of '{}' failed, keeping it unsimplified: {}",
						ExpressionPrinter.print(candidate), e.getMessage());
				return candidate;
			}
		}

		private void enter() {
			if (++depth > maxDepth) {
				throw new ResourceLimitExceededException("expression depth", maxDepth);
			}
		}
	}

	private static void appendDistinct(List<String> steps, String step) {
		if (steps.isEmpty() || !steps.get(steps.size() - 1).equals(step)) {
			steps.add(step);
		}
	}
}
