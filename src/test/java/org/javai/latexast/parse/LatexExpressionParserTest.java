package org.javai.latexast.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.latexast.expr.Expression.add;
import static org.javai.latexast.expr.Expression.call;
import static org.javai.latexast.expr.Expression.mul;
import static org.javai.latexast.expr.Expression.number;
import static org.javai.latexast.expr.Expression.pow;
import static org.javai.latexast.expr.Expression.symbol;

import org.javai.latexast.ResourceLimitExceededException;
import org.javai.latexast.expr.Expression;
import org.javai.latexast.vocabulary.LatexVocabulary;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LatexExpressionParserTest {

	private final LatexExpressionParser parser = new LatexExpressionParser();

	private Expression parse(String latex) {
		SemanticParseResult result = parser.parse(latex);
		assertThat(result).isInstanceOf(SemanticParseResult.Parsed.class);
		return ((SemanticParseResult.Parsed) result).expression();
	}

	private SemanticParseResult.Failed fail(String latex) {
		SemanticParseResult result = parser.parse(latex);
		assertThat(result).isInstanceOf(SemanticParseResult.Failed.class);
		return (SemanticParseResult.Failed) result;
	}

	@Nested
	class Arithmetic {

		@Test
		void sum() {
			assertThat(parse("1+2")).isEqualTo(add(number(1), number(2)));
		}

		@Test
		void subtractionAddsANegatedTerm() {
			assertThat(parse("x-y")).isEqualTo(add(symbol("x"), mul(number(-1), symbol("y"))));
			assertThat(parse("x-2y")).isEqualTo(add(symbol("x"), mul(number(-2), symbol("y"))));
		}

		@Test
		void unaryMinus() {
			assertThat(parse("-3")).isEqualTo(number(-3));
			assertThat(parse("-x")).isEqualTo(mul(number(-1), symbol("x")));
		}

		@Test
		void sumsAndProductsAreFlattened() {
			assertThat(parse("a+b+c")).isEqualTo(add(symbol("a"), symbol("b"), symbol("c")));
			assertThat(parse("2 \\cdot 3 \\times x")).isEqualTo(mul(number(2), number(3), symbol("x")));
		}

		@Test
		void implicitMultiplication() {
			assertThat(parse("2x")).isEqualTo(mul(number(2), symbol("x")));
			assertThat(parse("(1+2)(3+4)"))
					.isEqualTo(mul(add(number(1), number(2)), add(number(3), number(4))));
		}

		@Test
		void whitespaceSeparatesNumbers() {
			assertThat(parse("12 3")).isEqualTo(mul(number(12), number(3)));
			assertThat(parse("3.14")).isEqualTo(number(3.14));
			assertThat(parse(".5")).isEqualTo(number(0.5));
		}

		@Test
		void divisionIsMultiplicationByAReciprocal() {
			assertThat(parse("a/b")).isEqualTo(mul(symbol("a"), pow(symbol("b"), number(-1))));
			assertThat(parse("6 \\div 3")).isEqualTo(mul(number(6), pow(number(3), number(-1))));
		}

		@Test
		void spacingMacrosAreIgnored() {
			assertThat(parse("\\, x \\quad + \\; 1")).isEqualTo(add(symbol("x"), number(1)));
		}
	}

	@Nested
	class Macros {

		@Test
		void fractions() {
			assertThat(parse("\\frac{1}{2}")).isEqualTo(pow(number(2), number(-1)));
			assertThat(parse("\\frac{a}{b}")).isEqualTo(mul(symbol("a"), pow(symbol("b"), number(-1))));
			assertThat(parse("\\frac12")).isEqualTo(pow(number(2), number(-1)));
		}

		@Test
		void roots() {
			assertThat(parse("\\sqrt{x}")).isEqualTo(pow(symbol("x"), number(0.5)));
			assertThat(parse("\\sqrt[3]{x}")).isEqualTo(pow(symbol("x"), pow(number(3), number(-1))));
		}

		@Test
		void powers() {
			assertThat(parse("x^2")).isEqualTo(pow(symbol("x"), number(2)));
			assertThat(parse("x^{10}")).isEqualTo(pow(symbol("x"), number(10)));
			assertThat(parse("x^23")).isEqualTo(mul(pow(symbol("x"), number(2)), number(3)));
		}

		@Test
		void functions() {
			assertThat(parse("\\sin(x)")).isEqualTo(call("sin", symbol("x")));
			assertThat(parse("\\sin^2 x")).isEqualTo(pow(call("sin", symbol("x")), number(2)));
			assertThat(parse("\\log_2 8")).isEqualTo(call("log", number(8), number(2)));
			assertThat(parse("\\arctan{x}")).isEqualTo(call("atan", symbol("x")));
		}

		@Test
		void unparenthesizedFunctionArgumentStopsAtNextFunction() {
			assertThat(parse("\\sin x \\cos y"))
					.isEqualTo(mul(call("sin", symbol("x")), call("cos", symbol("y"))));
		}

		@Test
		void absoluteValueAndDelimiters() {
			assertThat(parse("|x|")).isEqualTo(call("Abs", symbol("x")));
			assertThat(parse("\\left| x \\right|")).isEqualTo(call("Abs", symbol("x")));
			assertThat(parse("\\left( x + 1 \\right)")).isEqualTo(add(symbol("x"), number(1)));
		}

		@Test
		void factorial() {
			assertThat(parse("5!")).isEqualTo(call("factorial", number(5)));
		}

		@Test
		void greekLettersAndSubscripts() {
			assertThat(parse("\\alpha + \\beta")).isEqualTo(add(symbol("alpha"), symbol("beta")));
			assertThat(parse("x_1")).isEqualTo(symbol("x_1"));
			assertThat(parse("a_{n}")).isEqualTo(symbol("a_n"));
		}
	}

	@Test
	void relationsBecomeOpaqueNodes() {
		assertThat(parse("x = 1")).isEqualTo(new Expression.Unknown("x = 1.0"));
		assertThat(parse("a \\leq b")).isEqualTo(new Expression.Unknown("a <= b"));
	}

	@Test
	void emptyInputFails() {
		assertThat(fail("").message()).isEqualTo("Empty expression");
		assertThat(fail("  % only a comment").message()).isEqualTo("Empty expression");
	}

	@Test
	void unsupportedCommandFails() {
		SemanticParseResult.Failed failed = fail("x + \\foo");

		assertThat(failed.message()).isEqualTo("Unsupported command \\foo");
		assertThat(failed.position()).isEqualTo(4);
	}

	@ParameterizedTest
	@ValueSource(strings = {"1+", "\\frac{1}{2", "\\text{hello}", "x)", "\\left( x", "{}", "x^",
			". 1", "x+. 5", "2\\cdot . 5", "1. 5"})
	void malformedExpressionsFailWithoutThrowing(String latex) {
		fail(latex);
	}

	@Test
	void nestingBeyondTheLimitIsNotAParseFailure() {
		LatexExpressionParser shallow = new LatexExpressionParser(LatexVocabulary.standard(), 5);

		assertThat(shallow.parse("((x))")).isInstanceOf(SemanticParseResult.Parsed.class);
		assertThatThrownBy(() -> shallow.parse("((((((((x))))))))"))
				.isInstanceOf(ResourceLimitExceededException.class)
				.hasMessageContaining("expression depth");
	}
}
