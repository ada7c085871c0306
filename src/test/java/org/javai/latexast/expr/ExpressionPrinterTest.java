package org.javai.latexast.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.latexast.expr.Expression.add;
import static org.javai.latexast.expr.Expression.call;
import static org.javai.latexast.expr.Expression.mul;
import static org.javai.latexast.expr.Expression.number;
import static org.javai.latexast.expr.Expression.pow;
import static org.javai.latexast.expr.Expression.symbol;

import org.junit.jupiter.api.Test;

class ExpressionPrinterTest {

	private static final Expression X = symbol("x");
	private static final Expression Y = symbol("y");

	@Test
	void numbersUseJavaDoubleText() {
		assertThat(ExpressionPrinter.print(number(3))).isEqualTo("3.0");
		assertThat(ExpressionPrinter.print(number(0.5))).isEqualTo("0.5");
		assertThat(ExpressionPrinter.print(number(1e20))).isEqualTo("1.0E20");
	}

	@Test
	void sumWritesNegatedTermsWithMinus() {
		assertThat(ExpressionPrinter.print(add(X, mul(number(-1), Y)))).isEqualTo("x - y");
		assertThat(ExpressionPrinter.print(add(X, number(-2)))).isEqualTo("x - 2.0");
		assertThat(ExpressionPrinter.print(add(X, mul(number(-3), Y)))).isEqualTo("x - 3.0*y");
	}

	@Test
	void leadingNegatedTermKeepsMinusSign() {
		assertThat(ExpressionPrinter.print(add(mul(number(-1), X), number(1)))).isEqualTo("-x + 1.0");
	}

	@Test
	void productsAndPowers() {
		assertThat(ExpressionPrinter.print(mul(number(2), pow(X, number(2))))).isEqualTo("2.0*x**2.0");
		assertThat(ExpressionPrinter.print(pow(X, number(-1)))).isEqualTo("x**(-1.0)");
		assertThat(ExpressionPrinter.print(mul(number(-1), X))).isEqualTo("-x");
		assertThat(ExpressionPrinter.print(mul(number(2), number(-3)))).isEqualTo("2.0*(-3.0)");
	}

	@Test
	void nestedOperatorsAreParenthesized() {
		assertThat(ExpressionPrinter.print(mul(add(X, Y), symbol("z")))).isEqualTo("(x + y)*z");
		assertThat(ExpressionPrinter.print(pow(add(number(1), number(2)), number(2))))
				.isEqualTo("(1.0 + 2.0)**2.0");
		assertThat(ExpressionPrinter.print(add(add(X, Y), symbol("z")))).isEqualTo("(x + y) + z");
	}

	@Test
	void functionsAndDegenerateOperatorsUseCallForm() {
		assertThat(ExpressionPrinter.print(call("log", X, number(2)))).isEqualTo("log(x, 2.0)");
		assertThat(ExpressionPrinter.print(add())).isEqualTo("Add()");
		assertThat(ExpressionPrinter.print(mul(X))).isEqualTo("Mul(x)");
	}

	@Test
	void unknownPrintsItsText() {
		assertThat(ExpressionPrinter.print(new Expression.Unknown("x = 1.0"))).isEqualTo("x = 1.0");
	}
}
