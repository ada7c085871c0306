package org.javai.latexast.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.javai.latexast.expr.Expression.add;
import static org.javai.latexast.expr.Expression.call;
import static org.javai.latexast.expr.Expression.mul;
import static org.javai.latexast.expr.Expression.number;
import static org.javai.latexast.expr.Expression.pow;
import static org.javai.latexast.expr.Expression.symbol;

import org.junit.jupiter.api.Test;

class SimplifierTest {

	private final Simplifier simplifier = new Simplifier();
	private final Expression x = symbol("x");

	@Test
	void foldsNumericTermsOfASum() {
		assertThat(simplifier.simplify(add(number(1), number(2)))).isEqualTo(number(3));
		assertThat(simplifier.simplify(add(x, number(1), number(2)))).isEqualTo(add(x, number(3)));
	}

	@Test
	void dropsIdentityElements() {
		assertThat(simplifier.simplify(add(x, number(0)))).isEqualTo(x);
		assertThat(simplifier.simplify(mul(number(1), x))).isEqualTo(x);
	}

	@Test
	void productWithZeroIsZero() {
		assertThat(simplifier.simplify(mul(number(0), x, symbol("y")))).isEqualTo(number(0));
	}

	@Test
	void onlyTheRootIsRewritten() {
		Expression nested = add(x, add(number(1), number(2)));
		assertThat(simplifier.simplify(nested)).isSameAs(nested);
	}

	@Test
	void leavesAlreadySimpleFormsUntouched() {
		Expression negated = mul(number(-1), x);
		assertThat(simplifier.simplify(negated)).isSameAs(negated);
		Expression shifted = add(x, number(1));
		assertThat(simplifier.simplify(shifted)).isSameAs(shifted);
	}

	@Test
	void emptyOperatorsBecomeTheirIdentity() {
		assertThat(simplifier.simplify(add())).isEqualTo(number(0));
		assertThat(simplifier.simplify(mul())).isEqualTo(number(1));
	}

	@Test
	void evaluatesPowers() {
		assertThat(simplifier.simplify(pow(number(2), number(3)))).isEqualTo(number(8));
		assertThat(simplifier.simplify(pow(x, number(1)))).isEqualTo(x);
		assertThat(simplifier.simplify(pow(x, number(0)))).isEqualTo(number(1));
		assertThat(simplifier.simplify(pow(x, number(2)))).isEqualTo(pow(x, number(2)));
	}

	@Test
	void evaluatesBuiltinFunctionsOfNumbers() {
		assertThat(simplifier.simplify(call("sin", number(0)))).isEqualTo(number(0));
		assertThat(simplifier.simplify(call("factorial", number(5)))).isEqualTo(number(120));
		Expression log = simplifier.simplify(call("log", number(8), number(2)));
		assertThat(log).isInstanceOf(Expression.Number.class);
		assertThat(((Expression.Number) log).value()).isCloseTo(3.0, within(1e-12));
	}

	@Test
	void leavesSymbolicAndUnknownFunctionsAlone() {
		assertThat(simplifier.simplify(call("sin", x))).isEqualTo(call("sin", x));
		assertThat(simplifier.simplify(call("f", number(1)))).isEqualTo(call("f", number(1)));
	}

	@Test
	void nonFiniteResultsAreRejected() {
		assertThatThrownBy(() -> simplifier.simplify(pow(number(0), number(-1))))
				.isInstanceOf(SimplificationException.class)
				.hasMessageContaining("0.0**(-1.0)");
		assertThatThrownBy(() -> simplifier.simplify(pow(number(-1), number(0.5))))
				.isInstanceOf(SimplificationException.class);
		assertThatThrownBy(() -> simplifier.simplify(call("log", number(0))))
				.isInstanceOf(SimplificationException.class);
	}
}
