package org.javai.latexast.tokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.latexast.ProcessorSettings;
import org.javai.latexast.ResourceLimitExceededException;
import org.javai.latexast.parse.LatexToken;
import org.javai.latexast.parse.LatexToken.TokenType;
import org.javai.latexast.parse.LatexTokenizer;
import org.javai.latexast.vocabulary.LatexVocabulary;

/**
 * Recursive descent walker over LaTeX structure.
 * <p>
 * Accepts any syntactically well-formed LaTeX without regard to mathematical meaning and
 * enforces only structural rules: braces, optional-argument brackets, math regions and
 * environments must be balanced. Macro arguments are read according to the argument
 * specs of the {@link LatexVocabulary}; macros it does not list take no arguments, so a
 * following brace group becomes a sibling node.
 */
public class LatexWalker {

	private final LatexVocabulary vocabulary;
	private final int maxDepth;

	public LatexWalker() {
		this(LatexVocabulary.standard(), ProcessorSettings.DEFAULT_MAX_DEPTH);
	}

	public LatexWalker(LatexVocabulary vocabulary, int maxDepth) {
		this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive");
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * Walks the input into its raw node tree.
	 *
	 * @throws LatexSyntaxException if braces, brackets, math regions or environments are unbalanced
	 * @throws ResourceLimitExceededException if groups nest deeper than the configured maximum
	 */
	public List<LatexNode> walk(String latex) {
		WalkerState state = new WalkerState(new LatexTokenizer(latex).tokenize());
		return state.nodes(Closer.NONE, 0);
	}

	/**
	 * What ends the node list currently being read.
	 */
	private record Closer(Kind kind, String value, int openedAt) {

		static final Closer NONE = new Closer(Kind.NONE, "", -1);

		enum Kind {
			NONE, GROUP, BRACKET, MATH, ENVIRONMENT
		}
	}

	private final class WalkerState {

		private final List<LatexToken> tokens;
		private int current = 0;

		WalkerState(List<LatexToken> tokens) {
			this.tokens = tokens;
		}

		List<LatexNode> nodes(Closer closer, int depth) {
			if (depth > maxDepth) {
				throw new ResourceLimitExceededException("nesting depth", maxDepth);
			}
			List<LatexNode> nodes = new ArrayList<>();
			while (true) {
				LatexToken token = peek();
				switch (token.type()) {
					case EOF -> {
						if (closer.kind() != Closer.Kind.NONE) {
							throw unterminated(closer);
						}
						return nodes;
					}
					case BEGIN_GROUP -> nodes.add(group(depth));
					case END_GROUP -> {
						if (closer.kind() == Closer.Kind.GROUP) {
							return nodes;
						}
						throw new LatexSyntaxException("Unexpected '}' with no matching '{'", token.position());
					}
					case MATH_SHIFT -> {
						if (closer.kind() == Closer.Kind.MATH && closer.value().equals(token.value())) {
							return nodes;
						}
						advance();
						List<LatexNode> children = nodes(new Closer(Closer.Kind.MATH, token.value(), token.position()), depth + 1);
						advance();
						nodes.add(new LatexNode.MathNode(token.value(), children, token.position()));
					}
					case COMMAND -> {
						if (closesMath(token, closer) || closesEnvironment(token, closer)) {
							return nodes;
						}
						nodes.add(command(token, depth));
					}
					case COMMENT -> nodes.add(new LatexNode.CommentNode(advance().value(), token.position()));
					case SPECIAL -> nodes.add(new LatexNode.SpecialsNode(advance().value(), token.position()));
					case CHAR, WHITESPACE -> {
						if (closer.kind() == Closer.Kind.BRACKET && token.isChar(']')) {
							return nodes;
						}
						nodes.add(chars(closer));
					}
				}
			}
		}

		private LatexNode.GroupNode group(int depth) {
			LatexToken open = advance();
			List<LatexNode> children = nodes(new Closer(Closer.Kind.GROUP, "}", open.position()), depth + 1);
			advance(); // consume '}'
			return new LatexNode.GroupNode(children, open.position());
		}

		private LatexNode command(LatexToken token, int depth) {
			if (depth > maxDepth) {
				throw new ResourceLimitExceededException("nesting depth", maxDepth);
			}
			String name = token.value();
			switch (name) {
				case "\\(", "\\[" -> {
					advance();
					String closing = name.equals("\\(") ? "\\)" : "\\]";
					List<LatexNode> children = nodes(new Closer(Closer.Kind.MATH, closing, token.position()), depth + 1);
					advance();
					return new LatexNode.MathNode(name, children, token.position());
				}
				case "\\)", "\\]" -> throw new LatexSyntaxException(
						"Unexpected " + name + " with no matching opening delimiter", token.position());
				case "\\begin" -> {
					advance();
					String environment = environmentName(token);
					List<LatexNode> children = nodes(
							new Closer(Closer.Kind.ENVIRONMENT, environment, token.position()), depth + 1);
					LatexToken end = advance();
					String closing = environmentName(end);
					if (!closing.equals(environment)) {
						throw new LatexSyntaxException("Environment '" + environment + "' closed by \\end{"
								+ closing + "}", end.position());
					}
					return new LatexNode.EnvironmentNode(environment, children, token.position());
				}
				case "\\end" -> throw new LatexSyntaxException(
						"Unexpected \\end with no matching \\begin", token.position());
				default -> {
					advance();
					return new LatexNode.MacroNode(name, arguments(name, depth), token.position());
				}
			}
		}

		private List<List<LatexNode>> arguments(String macro, int depth) {
			List<List<LatexNode>> arguments = new ArrayList<>();
			for (char kind : vocabulary.argumentsOf(macro).toCharArray()) {
				List<LatexNode> argument = kind == '[' ? optionalArgument(depth) : mandatoryArgument(depth);
				if (argument != null) {
					arguments.add(argument);
				}
			}
			return arguments;
		}

		private List<LatexNode> mandatoryArgument(int depth) {
			int mark = current;
			skipWhitespace();
			LatexToken token = peek();
			switch (token.type()) {
				case BEGIN_GROUP -> {
					return group(depth).children();
				}
				case CHAR -> {
					advance();
					return List.of(new LatexNode.CharsNode(token.value(), token.position()));
				}
				case COMMAND -> {
					if (isStructural(token)) {
						current = mark;
						return null;
					}
					return List.of(command(token, depth + 1));
				}
				default -> {
					current = mark;
					return null;
				}
			}
		}

		private List<LatexNode> optionalArgument(int depth) {
			int mark = current;
			skipWhitespace();
			LatexToken open = peek();
			if (!open.isChar('[')) {
				current = mark;
				return null;
			}
			advance();
			List<LatexNode> children = nodes(new Closer(Closer.Kind.BRACKET, "]", open.position()), depth + 1);
			advance(); // consume ']'
			return children;
		}

		private LatexNode.CharsNode chars(Closer closer) {
			int start = peek().position();
			StringBuilder sb = new StringBuilder();
			while (peek().isType(TokenType.CHAR) || peek().isType(TokenType.WHITESPACE)) {
				if (closer.kind() == Closer.Kind.BRACKET && peek().isChar(']')) {
					break;
				}
				sb.append(advance().value());
			}
			return new LatexNode.CharsNode(sb.toString(), start);
		}

		private String environmentName(LatexToken command) {
			skipWhitespace();
			if (!peek().isType(TokenType.BEGIN_GROUP)) {
				throw new LatexSyntaxException("Expected '{' after " + command.value(), command.position());
			}
			advance();
			StringBuilder sb = new StringBuilder();
			while (!peek().isType(TokenType.END_GROUP)) {
				LatexToken token = peek();
				if (!token.isType(TokenType.CHAR) && !token.isType(TokenType.WHITESPACE)) {
					throw new LatexSyntaxException("Invalid environment name after " + command.value(),
							token.position());
				}
				sb.append(advance().value());
			}
			advance(); // consume '}'
			return sb.toString().trim();
		}

		private boolean closesMath(LatexToken token, Closer closer) {
			return closer.kind() == Closer.Kind.MATH && token.value().equals(closer.value());
		}

		private boolean closesEnvironment(LatexToken token, Closer closer) {
			return closer.kind() == Closer.Kind.ENVIRONMENT && token.isCommand("\\end");
		}

		private boolean isStructural(LatexToken token) {
			return switch (token.value()) {
				case "\\)", "\\]", "\\end" -> true;
				default -> false;
			};
		}

		private LatexSyntaxException unterminated(Closer closer) {
			String message = switch (closer.kind()) {
				case GROUP -> "Unbalanced '{': missing '}'";
				case BRACKET -> "Unterminated optional argument: missing ']'";
				case MATH -> "Unterminated math region: missing " + closer.value();
				case ENVIRONMENT -> "Unterminated environment '" + closer.value() + "': missing \\end";
				case NONE -> "Unexpected end of input";
			};
			return new LatexSyntaxException(message, closer.openedAt());
		}

		private void skipWhitespace() {
			while (peek().isType(TokenType.WHITESPACE) || peek().isType(TokenType.COMMENT)) {
				advance();
			}
		}

		private LatexToken peek() {
			return tokens.get(Math.min(current, tokens.size() - 1));
		}

		private LatexToken advance() {
			LatexToken token = peek();
			if (!token.isType(TokenType.EOF)) {
				current++;
			}
			return token;
		}
	}
}
