package org.javai.latexast.tokens;

/**
 * Exception thrown when LaTeX input is not well formed: unbalanced braces, unterminated
 * math regions or mismatched environments. There is no fallback for such input.
 */
public class LatexSyntaxException extends RuntimeException {

	private final int position;

	public LatexSyntaxException(String message, int position) {
		super(message + " at position " + position);
		this.position = position;
	}

	public int position() {
		return position;
	}
}
