package org.javai.latexast.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple tokenizer for LaTeX source.
 * Converts input string into a stream of tokens. Tokenizing never fails: anything that
 * is not a command, brace, math shift, comment, special or whitespace is a single
 * {@link LatexToken.TokenType#CHAR} token, and a trailing lone backslash becomes a
 * character too.
 */
public class LatexTokenizer {

	private final String input;
	private int pos = 0;

	public LatexTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 */
	public List<LatexToken> tokenize() {
		List<LatexToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			tokens.add(nextToken());
		}

		tokens.add(new LatexToken(LatexToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private LatexToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '\\' -> scanCommand();
			case '{' -> {
				advance();
				yield new LatexToken(LatexToken.TokenType.BEGIN_GROUP, "{", start);
			}
			case '}' -> {
				advance();
				yield new LatexToken(LatexToken.TokenType.END_GROUP, "}", start);
			}
			case '$' -> {
				advance();
				if (peek() == '$') {
					advance();
					yield new LatexToken(LatexToken.TokenType.MATH_SHIFT, "$$", start);
				}
				yield new LatexToken(LatexToken.TokenType.MATH_SHIFT, "$", start);
			}
			case '%' -> scanComment();
			case '&', '~', '#' -> {
				advance();
				yield new LatexToken(LatexToken.TokenType.SPECIAL, String.valueOf(c), start);
			}
			default -> {
				if (isWhitespace(c)) {
					yield scanWhitespace();
				}
				advance();
				yield new LatexToken(LatexToken.TokenType.CHAR, String.valueOf(c), start);
			}
		};
	}

	private LatexToken scanCommand() {
		int start = pos;
		advance(); // consume '\'

		if (isAtEnd()) {
			return new LatexToken(LatexToken.TokenType.CHAR, "\\", start);
		}

		if (isLetter(peek())) {
			while (!isAtEnd() && isLetter(peek())) {
				advance();
			}
		}
		else {
			// Control symbol: backslash followed by exactly one non-letter
			advance();
		}

		return new LatexToken(LatexToken.TokenType.COMMAND, input.substring(start, pos), start);
	}

	private LatexToken scanComment() {
		int start = pos;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		return new LatexToken(LatexToken.TokenType.COMMENT, input.substring(start, pos), start);
	}

	private LatexToken scanWhitespace() {
		int start = pos;
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
		return new LatexToken(LatexToken.TokenType.WHITESPACE, input.substring(start, pos), start);
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return Character.isWhitespace(c);
	}

	private boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
