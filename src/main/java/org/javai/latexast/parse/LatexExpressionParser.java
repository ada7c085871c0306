package org.javai.latexast.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.latexast.ProcessorSettings;
import org.javai.latexast.ResourceLimitExceededException;
import org.javai.latexast.expr.Expression;
import org.javai.latexast.expr.ExpressionPrinter;
import org.javai.latexast.parse.LatexToken.TokenType;
import org.javai.latexast.vocabulary.LatexVocabulary;

/**
 * Semantic parser for LaTeX math expressions.
 * <p>
 * Produces an {@link Expression} tree or a {@link SemanticParseResult.Failed} result; there
 * are no partial results. The tree follows the usual conventions of symbolic math back
 * ends: subtraction is addition of a negated term, division and {@code \frac} are
 * multiplication by a power of {@code -1}, {@code \sqrt} is a power of {@code 0.5}, and
 * nested sums and products are flattened. Relations become opaque
 * {@link Expression.Unknown} nodes.
 * <p>
 * Grammar:
 * <pre>
 * relation := additive (relop additive)?
 * additive := term (("+" | "-") term)*
 * term     := unary (("*" | "\cdot" | "\times" | "/" | "\div")? unary)*
 * unary    := ("-" | "+") unary | postfix
 * postfix  := primary ("^" argument | "!")*
 * </pre>
 * An unbraced argument of {@code ^}, {@code _} or {@code \frac} is a single token, as in
 * TeX: {@code x^23} is {@code x^2} times {@code 3}.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class LatexExpressionParser {

	private static final Map<String, String> RELATIONS = Map.ofEntries(
			Map.entry("=", "="),
			Map.entry("<", "<"),
			Map.entry(">", ">"),
			Map.entry("\\le", "<="),
			Map.entry("\\leq", "<="),
			Map.entry("\\leqslant", "<="),
			Map.entry("\\ge", ">="),
			Map.entry("\\geq", ">="),
			Map.entry("\\geqslant", ">="),
			Map.entry("\\ne", "!="),
			Map.entry("\\neq", "!="));

	private static final Set<String> FRACTIONS = Set.of("\\frac", "\\dfrac", "\\tfrac", "\\cfrac");

	private static final Map<String, String> DELIMITERS = Map.of(
			"(", ")",
			"[", "]",
			"|", "|",
			"\\{", "\\}",
			"\\lbrace", "\\rbrace",
			"\\lvert", "\\rvert",
			".", ".");

	private final LatexVocabulary vocabulary;
	private final int maxDepth;

	public LatexExpressionParser() {
		this(LatexVocabulary.standard(), ProcessorSettings.DEFAULT_MAX_DEPTH);
	}

	public LatexExpressionParser(LatexVocabulary vocabulary, int maxDepth) {
		this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive");
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * Parses a LaTeX string into an expression tree.
	 *
	 * @return {@link SemanticParseResult.Parsed} or {@link SemanticParseResult.Failed}
	 * @throws ResourceLimitExceededException if the input nests deeper than the configured maximum
	 */
	public SemanticParseResult parse(String latex) {
		List<LatexToken> tokens = significantTokens(new LatexTokenizer(latex).tokenize());
		try {
			return new SemanticParseResult.Parsed(new Session(tokens).parseAll());
		}
		catch (ExpressionParseException e) {
			return new SemanticParseResult.Failed(e.getMessage(), e.position());
		}
	}

	private List<LatexToken> significantTokens(List<LatexToken> tokens) {
		List<LatexToken> significant = new ArrayList<>(tokens.size());
		for (LatexToken token : tokens) {
			if (token.isType(TokenType.WHITESPACE) || token.isType(TokenType.COMMENT)) {
				continue;
			}
			if (token.isType(TokenType.COMMAND) && vocabulary.isSpacing(token.value())) {
				continue;
			}
			significant.add(token);
		}
		return significant;
	}

	/**
	 * Parser state for one call.
	 */
	private final class Session {

		private final List<LatexToken> tokens;
		private int current = 0;
		private int depth = 0;

		Session(List<LatexToken> tokens) {
			this.tokens = tokens;
		}

		Expression parseAll() {
			if (isAtEnd()) {
				throw new ExpressionParseException("Empty expression", 0);
			}
			Expression expression = relation();
			if (!isAtEnd()) {
				throw unexpected(peek());
			}
			return expression;
		}

		private Expression relation() {
			Expression left = additive();
			LatexToken token = peek();
			String operator = RELATIONS.get(token.value());
			if (operator != null && (token.isType(TokenType.CHAR) || token.isType(TokenType.COMMAND))) {
				advance();
				Expression right = additive();
				return new Expression.Unknown(
						ExpressionPrinter.print(left) + " " + operator + " " + ExpressionPrinter.print(right));
			}
			return left;
		}

		private Expression additive() {
			List<Expression> terms = new ArrayList<>();
			appendTerm(terms, term());
			while (true) {
				if (peek().isChar('+')) {
					advance();
					appendTerm(terms, term());
				}
				else if (peek().isChar('-')) {
					advance();
					appendTerm(terms, negate(term()));
				}
				else {
					break;
				}
			}
			return terms.size() == 1 ? terms.get(0) : new Expression.Add(terms);
		}

		private Expression term() {
			List<Expression> factors = new ArrayList<>();
			appendFactor(factors, unary());
			while (true) {
				LatexToken token = peek();
				if (token.isChar('*') || token.isCommand("\\cdot") || token.isCommand("\\times")) {
					advance();
					appendFactor(factors, unary());
				}
				else if (token.isChar('/') || token.isCommand("\\div")) {
					advance();
					appendFactor(factors, reciprocal(unary()));
				}
				else if (startsImplicitFactor(token)) {
					appendFactor(factors, postfix());
				}
				else {
					break;
				}
			}
			return factors.size() == 1 ? factors.get(0) : new Expression.Mul(factors);
		}

		private Expression unary() {
			enter();
			try {
				if (peek().isChar('-')) {
					advance();
					return negate(unary());
				}
				if (peek().isChar('+')) {
					advance();
					return unary();
				}
				return postfix();
			}
			finally {
				depth--;
			}
		}

		private void enter() {
			if (++depth > maxDepth) {
				throw new ResourceLimitExceededException("expression depth", maxDepth);
			}
		}

		private Expression postfix() {
			Expression base = primary();
			while (true) {
				if (peek().isChar('^')) {
					advance();
					base = new Expression.Pow(base, argument());
				}
				else if (peek().isChar('!')) {
					advance();
					base = new Expression.FunctionCall("factorial", List.of(base));
				}
				else {
					return base;
				}
			}
		}

		private Expression primary() {
			LatexToken token = peek();
			return switch (token.type()) {
				case CHAR -> primaryChar(token);
				case BEGIN_GROUP -> group();
				case COMMAND -> primaryCommand(token);
				case EOF -> throw new ExpressionParseException("Unexpected end of input", token.position());
				default -> throw unexpected(token);
			};
		}

		private Expression primaryChar(LatexToken token) {
			char c = token.value().charAt(0);
			if (isDigit(c) || (c == '.' && digitFollows())) {
				return number();
			}
			if (isLetter(c)) {
				advance();
				return new Expression.Symbol(withSubscript(String.valueOf(c)));
			}
			if (c == '(' || c == '[') {
				advance();
				Expression inner = additive();
				expectChar(c == '(' ? ')' : ']');
				return inner;
			}
			if (c == '|') {
				advance();
				Expression inner = additive();
				expectChar('|');
				return new Expression.FunctionCall("Abs", List.of(inner));
			}
			throw unexpected(token);
		}

		private Expression primaryCommand(LatexToken token) {
			String command = token.value();
			if (FRACTIONS.contains(command)) {
				advance();
				Expression numerator = argument();
				Expression denominator = argument();
				if (numerator instanceof Expression.Number n && n.value() == 1.0) {
					return reciprocal(denominator);
				}
				List<Expression> factors = new ArrayList<>();
				appendFactor(factors, numerator);
				factors.add(reciprocal(denominator));
				return new Expression.Mul(factors);
			}
			if (command.equals("\\sqrt")) {
				advance();
				Expression index = null;
				if (peek().isChar('[')) {
					advance();
					index = additive();
					expectChar(']');
				}
				Expression radicand = argument();
				return index == null
						? new Expression.Pow(radicand, new Expression.Number(0.5))
						: new Expression.Pow(radicand, reciprocal(index));
			}
			if (command.equals("\\left")) {
				return delimited();
			}
			if (command.equals("\\{")) {
				advance();
				Expression inner = additive();
				expectCommand("\\}");
				return inner;
			}
			Optional<String> function = vocabulary.functionFor(command);
			if (function.isPresent()) {
				advance();
				return functionCall(function.get());
			}
			Optional<String> symbol = vocabulary.symbolFor(command);
			if (symbol.isPresent()) {
				advance();
				return new Expression.Symbol(withSubscript(symbol.get()));
			}
			throw new ExpressionParseException("Unsupported command " + command, token.position());
		}

		private Expression functionCall(String name) {
			Expression power = null;
			Expression base = null;
			for (int i = 0; i < 2; i++) {
				if (power == null && peek().isChar('^')) {
					advance();
					power = argument();
				}
				else if (base == null && name.equals("log") && peek().isChar('_')) {
					advance();
					base = argument();
				}
			}

			Expression argument = functionArgument();
			List<Expression> args = base == null ? List.of(argument) : List.of(argument, base);
			Expression call = new Expression.FunctionCall(name, args);
			return power == null ? call : new Expression.Pow(call, power);
		}

		private Expression functionArgument() {
			LatexToken token = peek();
			if (token.isChar('(') || token.isCommand("\\left") || token.isType(TokenType.BEGIN_GROUP)) {
				return primary();
			}
			List<Expression> factors = new ArrayList<>();
			appendFactor(factors, unary());
			while (startsImplicitFactor(peek()) && !isFunction(peek())) {
				appendFactor(factors, postfix());
			}
			return factors.size() == 1 ? factors.get(0) : new Expression.Mul(factors);
		}

		private Expression delimited() {
			LatexToken left = advance();
			LatexToken opening = advance();
			String closing = DELIMITERS.get(opening.value());
			if (closing == null) {
				throw new ExpressionParseException("Unsupported delimiter after \\left: " + opening.value(),
						opening.position());
			}
			Expression inner = additive();
			LatexToken right = peek();
			if (!right.isCommand("\\right")) {
				throw new ExpressionParseException("Missing \\right for \\left", left.position());
			}
			advance();
			LatexToken actual = advance();
			if (!actual.value().equals(closing) && !opening.value().equals(".") && !actual.value().equals(".")) {
				throw new ExpressionParseException(
						"Mismatched delimiters: \\left" + opening.value() + " closed by \\right" + actual.value(),
						actual.position());
			}
			if (opening.value().equals("|") || opening.value().equals("\\lvert")) {
				return new Expression.FunctionCall("Abs", List.of(inner));
			}
			return inner;
		}

		private Expression group() {
			LatexToken open = advance();
			if (peek().isType(TokenType.END_GROUP)) {
				throw new ExpressionParseException("Empty group", open.position());
			}
			Expression inner = additive();
			if (!peek().isType(TokenType.END_GROUP)) {
				throw new ExpressionParseException("Unbalanced '{'", open.position());
			}
			advance();
			return inner;
		}

		/**
		 * A braced group, or a single token as TeX reads unbraced macro arguments.
		 */
		private Expression argument() {
			enter();
			try {
				return singleArgument();
			}
			finally {
				depth--;
			}
		}

		private Expression singleArgument() {
			LatexToken token = peek();
			if (token.isType(TokenType.BEGIN_GROUP)) {
				return group();
			}
			if (token.isType(TokenType.CHAR) && isDigit(token.value().charAt(0))) {
				advance();
				return new Expression.Number(token.value().charAt(0) - '0');
			}
			if (token.isType(TokenType.CHAR) && isLetter(token.value().charAt(0))) {
				advance();
				return new Expression.Symbol(token.value());
			}
			if (token.isType(TokenType.COMMAND)) {
				return primaryCommand(token);
			}
			if (token.isType(TokenType.EOF)) {
				throw new ExpressionParseException("Missing argument", token.position());
			}
			throw unexpected(token);
		}

		private String withSubscript(String name) {
			if (!peek().isChar('_')) {
				return name;
			}
			LatexToken underscore = advance();
			StringBuilder sb = new StringBuilder(name).append('_');
			if (peek().isType(TokenType.BEGIN_GROUP)) {
				advance();
				while (!peek().isType(TokenType.END_GROUP)) {
					appendSubscriptToken(sb, advanceOrFail(underscore));
				}
				advance();
			}
			else {
				appendSubscriptToken(sb, advanceOrFail(underscore));
			}
			if (sb.length() == name.length() + 1) {
				throw new ExpressionParseException("Empty subscript", underscore.position());
			}
			return sb.toString();
		}

		private void appendSubscriptToken(StringBuilder sb, LatexToken token) {
			if (token.isType(TokenType.CHAR) && Character.isLetterOrDigit(token.value().charAt(0))
					&& token.value().charAt(0) < 128) {
				sb.append(token.value());
				return;
			}
			if (token.isType(TokenType.COMMAND)) {
				Optional<String> symbol = vocabulary.symbolFor(token.value());
				if (symbol.isPresent()) {
					sb.append(symbol.get());
					return;
				}
			}
			throw new ExpressionParseException("Unsupported subscript content " + token.value(), token.position());
		}

		private LatexToken advanceOrFail(LatexToken context) {
			if (isAtEnd()) {
				throw new ExpressionParseException("Unterminated subscript", context.position());
			}
			return advance();
		}

		/**
		 * Reads a number from adjacent digit tokens; whitespace ends the number.
		 */
		private Expression number() {
			int start = peek().position();
			StringBuilder digits = new StringBuilder();
			while (isDigitToken(peek()) && adjacent(start, digits)) {
				digits.append(advance().value());
			}
			if (peek().isChar('.') && digitFollows() && adjacent(start, digits)) {
				digits.append(advance().value());
				while (isDigitToken(peek()) && adjacent(start, digits)) {
					digits.append(advance().value());
				}
			}
			if (digits.chars().noneMatch(ch -> isDigit((char) ch))) {
				throw new ExpressionParseException("Malformed number", start);
			}
			double value = Double.parseDouble(digits.toString());
			if (!Double.isFinite(value)) {
				throw new ExpressionParseException("Number out of range: " + digits, start);
			}
			return new Expression.Number(value);
		}

		/**
		 * Whether the token after the current one is a digit written directly after it.
		 */
		private boolean digitFollows() {
			LatexToken next = peekAt(1);
			return isDigitToken(next) && next.position() == peek().position() + 1;
		}

		private boolean adjacent(int start, CharSequence consumed) {
			return peek().position() == start + consumed.length();
		}

		private boolean startsImplicitFactor(LatexToken token) {
			if (token.isType(TokenType.BEGIN_GROUP)) {
				return true;
			}
			if (token.isType(TokenType.CHAR)) {
				char c = token.value().charAt(0);
				return isDigit(c) || isLetter(c) || c == '(' || c == '[';
			}
			if (token.isType(TokenType.COMMAND)) {
				String command = token.value();
				return FRACTIONS.contains(command)
						|| command.equals("\\sqrt")
						|| command.equals("\\left")
						|| command.equals("\\{")
						|| vocabulary.functionFor(command).isPresent()
						|| vocabulary.symbolFor(command).isPresent();
			}
			return false;
		}

		private boolean isFunction(LatexToken token) {
			return token.isType(TokenType.COMMAND) && vocabulary.functionFor(token.value()).isPresent();
		}

		private void expectChar(char expected) {
			LatexToken token = peek();
			if (!token.isChar(expected)) {
				throw new ExpressionParseException("Expected '" + expected + "' but found "
						+ describe(token), token.position());
			}
			advance();
		}

		private void expectCommand(String expected) {
			LatexToken token = peek();
			if (!token.isCommand(expected)) {
				throw new ExpressionParseException("Expected " + expected + " but found "
						+ describe(token), token.position());
			}
			advance();
		}

		private ExpressionParseException unexpected(LatexToken token) {
			return new ExpressionParseException("Unexpected " + describe(token), token.position());
		}

		private String describe(LatexToken token) {
			return token.isType(TokenType.EOF) ? "end of input" : "'" + token.value() + "'";
		}

		private LatexToken peek() {
			return peekAt(0);
		}

		private LatexToken peekAt(int offset) {
			int index = Math.min(current + offset, tokens.size() - 1);
			return tokens.get(index);
		}

		private LatexToken advance() {
			LatexToken token = peek();
			if (!isAtEnd()) {
				current++;
			}
			return token;
		}

		private boolean isAtEnd() {
			return peek().isType(TokenType.EOF);
		}

		private boolean isDigitToken(LatexToken token) {
			return token.isType(TokenType.CHAR) && isDigit(token.value().charAt(0));
		}
	}

	private static Expression negate(Expression term) {
		if (term instanceof Expression.Number n) {
			return new Expression.Number(-n.value());
		}
		List<Expression> factors = new ArrayList<>();
		if (term instanceof Expression.Mul m && !m.args().isEmpty()
				&& m.args().get(0) instanceof Expression.Number lead) {
			factors.add(new Expression.Number(-lead.value()));
			factors.addAll(m.args().subList(1, m.args().size()));
			return new Expression.Mul(factors);
		}
		factors.add(new Expression.Number(-1.0));
		appendFactor(factors, term);
		return new Expression.Mul(factors);
	}

	private static Expression reciprocal(Expression denominator) {
		return new Expression.Pow(denominator, new Expression.Number(-1.0));
	}

	private static void appendTerm(List<Expression> terms, Expression term) {
		if (term instanceof Expression.Add add) {
			terms.addAll(add.args());
		}
		else {
			terms.add(term);
		}
	}

	private static void appendFactor(List<Expression> factors, Expression factor) {
		if (factor instanceof Expression.Mul mul) {
			factors.addAll(mul.args());
		}
		else {
			factors.add(factor);
		}
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
