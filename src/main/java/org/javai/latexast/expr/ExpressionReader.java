package org.javai.latexast.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the text form written by {@link ExpressionPrinter} back into an expression tree.
 * <p>
 * Grammar:
 * <pre>
 * sum     := term (("+" | "-") term)*
 * term    := "-"? factor ("*" factor)*
 * factor  := primary ("**" factor)?
 * primary := number | identifier | identifier "(" args? ")" | "(" sum ")"
 * </pre>
 * Chains are flattened into one {@code Add} or {@code Mul}; parenthesized
 * sub-expressions are kept as they are. A minus sign applied to a chain led by a number
 * literal negates that literal, otherwise it prepends a {@code -1.0} factor.
 */
public final class ExpressionReader {

	private final String input;
	private int pos = 0;

	private ExpressionReader(String input) {
		this.input = input;
	}

	/**
	 * Reads one expression.
	 *
	 * @throws ExpressionReadException if the text is not in the expression text form
	 */
	public static Expression read(String text) {
		if (text == null || text.isBlank()) {
			throw new ExpressionReadException("Empty expression text", 0);
		}
		ExpressionReader reader = new ExpressionReader(text);
		Expression expression = reader.sum();
		reader.skipWhitespace();
		if (!reader.isAtEnd()) {
			throw new ExpressionReadException(
					"Unexpected '" + reader.peek() + "' after expression", reader.pos);
		}
		return expression;
	}

	private Expression sum() {
		List<Expression> terms = new ArrayList<>();
		terms.add(term());
		while (true) {
			skipWhitespace();
			if (match('+')) {
				terms.add(term());
			}
			else if (match('-')) {
				terms.add(chain().negated());
			}
			else {
				break;
			}
		}
		return terms.size() == 1 ? terms.get(0) : new Expression.Add(terms);
	}

	private Expression term() {
		skipWhitespace();
		if (match('-')) {
			return chain().negated();
		}
		return chain().folded();
	}

	private Chain chain() {
		List<Expression> factors = new ArrayList<>();
		boolean startsWithDigit = startsWithNumber();
		Expression first = factor();
		boolean bareLiteral = startsWithDigit && first instanceof Expression.Number;
		factors.add(first);
		while (true) {
			skipWhitespace();
			if (peek() == '*' && peekAt(1) != '*') {
				advance();
				factors.add(factor());
			}
			else {
				break;
			}
		}
		return new Chain(factors, bareLiteral);
	}

	private Expression factor() {
		Expression primary = primary();
		skipWhitespace();
		if (peek() == '*' && peekAt(1) == '*') {
			pos += 2;
			return new Expression.Pow(primary, factor());
		}
		return primary;
	}

	private Expression primary() {
		skipWhitespace();
		char c = peek();
		if (c == '(') {
			advance();
			Expression inner = sum();
			expect(')');
			return inner;
		}
		if (isDigit(c)) {
			return new Expression.Number(number());
		}
		if (isIdentifierStart(c)) {
			String name = identifier();
			skipWhitespace();
			if (match('(')) {
				List<Expression> args = arguments();
				return switch (name) {
					case "Add" -> new Expression.Add(args);
					case "Mul" -> new Expression.Mul(args);
					default -> new Expression.FunctionCall(name, args);
				};
			}
			return new Expression.Symbol(name);
		}
		if (isAtEnd()) {
			throw new ExpressionReadException("Unexpected end of expression text", pos);
		}
		throw new ExpressionReadException("Unexpected '" + c + "'", pos);
	}

	private List<Expression> arguments() {
		List<Expression> args = new ArrayList<>();
		skipWhitespace();
		if (match(')')) {
			return args;
		}
		args.add(sum());
		skipWhitespace();
		while (match(',')) {
			args.add(sum());
			skipWhitespace();
		}
		expect(')');
		return args;
	}

	private double number() {
		int start = pos;
		while (isDigit(peek())) {
			advance();
		}
		if (peek() == '.' && isDigit(peekAt(1))) {
			advance();
			while (isDigit(peek())) {
				advance();
			}
		}
		if (peek() == 'E' || peek() == 'e') {
			int exponentStart = pos;
			advance();
			if (peek() == '+' || peek() == '-') {
				advance();
			}
			if (!isDigit(peek())) {
				pos = exponentStart;
			}
			while (isDigit(peek())) {
				advance();
			}
		}
		return Double.parseDouble(input.substring(start, pos));
	}

	private String identifier() {
		int start = pos;
		while (isIdentifierChar(peek())) {
			advance();
		}
		return input.substring(start, pos);
	}

	private boolean startsWithNumber() {
		skipWhitespace();
		return isDigit(peek());
	}

	private void expect(char expected) {
		skipWhitespace();
		if (!match(expected)) {
			throw new ExpressionReadException("Expected '" + expected + "'", pos);
		}
	}

	private boolean match(char expected) {
		if (peek() == expected) {
			advance();
			return true;
		}
		return false;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	private char peek() {
		return peekAt(0);
	}

	private char peekAt(int offset) {
		int index = pos + offset;
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private void advance() {
		pos++;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}

	/**
	 * A factor chain as read, before it is folded into a single expression.
	 *
	 * @param bareLiteral whether the chain starts with an unparenthesized number literal
	 */
	private record Chain(List<Expression> factors, boolean bareLiteral) {

		Expression folded() {
			return factors.size() == 1 ? factors.get(0) : new Expression.Mul(factors);
		}

		Expression negated() {
			List<Expression> negated = new ArrayList<>(factors.size() + 1);
			if (bareLiteral) {
				double value = ((Expression.Number) factors.get(0)).value();
				if (factors.size() == 1) {
					return new Expression.Number(-value);
				}
				negated.addAll(factors);
				negated.set(0, new Expression.Number(-value));
			}
			else {
				negated.add(new Expression.Number(-1.0));
				negated.addAll(factors);
			}
			return new Expression.Mul(negated);
		}
	}
}
