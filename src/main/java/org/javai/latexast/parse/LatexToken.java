package org.javai.latexast.parse;

/**
 * Represents a token of LaTeX source.
 *
 * @param type the token type
 * @param value the token text; for commands this includes the leading backslash
 * @param position the character position in the input string
 */
public record LatexToken(TokenType type, String value, int position) {

	public enum TokenType {
		COMMAND,       // \frac, \alpha, \\, \,
		BEGIN_GROUP,   // {
		END_GROUP,     // }
		MATH_SHIFT,    // $ or $$
		COMMENT,       // % up to end of line
		SPECIAL,       // & ~ #
		WHITESPACE,    // run of whitespace
		CHAR,          // any other single character
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case COMMAND, CHAR, SPECIAL, MATH_SHIFT -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isCommand(String expected) {
		return type == TokenType.COMMAND && value.equals(expected);
	}

	public boolean isChar(char expected) {
		return type == TokenType.CHAR && value.length() == 1 && value.charAt(0) == expected;
	}
}
