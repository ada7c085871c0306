package org.javai.latexast.steps;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.latexast.expr.Expression.add;
import static org.javai.latexast.expr.Expression.call;
import static org.javai.latexast.expr.Expression.mul;
import static org.javai.latexast.expr.Expression.number;
import static org.javai.latexast.expr.Expression.pow;
import static org.javai.latexast.expr.Expression.symbol;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.apache.logging.log4j.Level;
import org.javai.latexast.ResourceLimitExceededException;
import org.javai.latexast.expr.Expression;
import org.javai.latexast.expr.SimplificationException;
import org.javai.latexast.expr.Simplifier;
import org.javai.latexast.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class StepEvaluatorTest {

	private final StepEvaluator evaluator = new StepEvaluator();

	@Test
	void leavesHaveASingleStep() {
		assertThat(evaluator.evaluate(number(5)).steps()).containsExactly("5.0");
		assertThat(evaluator.evaluate(symbol("x")).steps()).containsExactly("x");
		assertThat(evaluator.evaluate(new Expression.Unknown("x = 1.0")).steps()).containsExactly("x = 1.0");
	}

	@Test
	void sumOfNumbersReducesToItsValue() {
		StepSequence steps = evaluator.evaluate(add(number(1), number(2)));

		assertThat(steps.steps()).containsExactly("1.0 + 2.0", "3.0");
		assertThat(steps.finalStep()).isEqualTo("3.0");
	}

	@Test
	void irreducibleFunctionHasOneStep() {
		assertThat(evaluator.evaluate(call("sin", symbol("x"))).steps()).containsExactly("sin(x)");
	}

	@Test
	void childrenReduceInLockStep() {
		StepSequence steps = evaluator.evaluate(
				mul(add(number(1), number(2)), add(number(3), number(4))));

		assertThat(steps.steps()).containsExactly("(1.0 + 2.0)*(3.0 + 4.0)", "3.0*7.0", "21.0");
	}

	@Test
	void reducedChildHoldsItsLastStep() {
		StepSequence steps = evaluator.evaluate(add(add(number(1), number(2)), symbol("x")));

		assertThat(steps.steps()).containsExactly("(1.0 + 2.0) + x", "3.0 + x");
	}

	@Test
	void nestedExpressionTakesFiveSteps() {
		Expression expression = add(
				pow(mul(add(number(1), number(2)), add(number(3), number(4))), number(2)),
				number(1));

		StepSequence steps = evaluator.evaluate(expression);

		assertThat(steps.steps()).containsExactly(
				"((1.0 + 2.0)*(3.0 + 4.0))**2.0 + 1.0",
				"(3.0*7.0)**2.0 + 1.0",
				"21.0**2.0 + 1.0",
				"441.0 + 1.0",
				"442.0");
		assertThat(steps.firstSteps(2)).hasSize(2);
		assertThat(steps.finalStep()).isEqualTo("442.0");
	}

	@Test
	void emptyOperatorsDoNotCrash() {
		assertThat(evaluator.evaluate(add()).steps()).containsExactly("Add()", "0.0");
		assertThat(evaluator.evaluate(call("f")).steps()).containsExactly("f()");
	}

	@Test
	void nonFiniteResultKeepsTheUnsimplifiedForm() {
		assertThat(evaluator.evaluate(pow(number(0), number(-1))).steps()).containsExactly("0.0**(-1.0)");
	}

	@Test
	void simplificationFailureIsAbsorbedAndLogged() {
		Simplifier failing = mock(Simplifier.class);
		when(failing.simplify(any())).thenThrow(new SimplificationException("boom"));
		StepEvaluator withFailingSimplifier = new StepEvaluator(failing, 50);

		try (LogCaptorAppender captor = LogCaptorAppender.create(StepEvaluator.class, Level.DEBUG)) {
			StepSequence steps = withFailingSimplifier.evaluate(add(number(1), number(2)));

			assertThat(steps.steps()).containsExactly("1.0 + 2.0");
			assertThat(captor.messages())
					.anyMatch(m -> m.contains("Simplification of '1.0 + 2.0' failed") && m.contains("boom"));
		}
	}

	@Test
	void deepTreesAreRejected() {
		Expression deep = number(1);
		for (int i = 0; i < 5; i++) {
			deep = add(deep, number(1));
		}
		Expression tree = deep;

		assertThatThrownBy(() -> new StepEvaluator(new Simplifier(), 3).evaluate(tree))
				.isInstanceOf(ResourceLimitExceededException.class);
		assertThat(new StepEvaluator(new Simplifier(), 10).evaluate(tree).finalStep()).isEqualTo("6.0");
	}
}
