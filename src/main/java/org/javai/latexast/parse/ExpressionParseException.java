package org.javai.latexast.parse;

/**
 * Exception thrown when LaTeX input is not a mathematical expression the semantic
 * parser understands.
 */
public class ExpressionParseException extends RuntimeException {

	private final int position;

	public ExpressionParseException(String message, int position) {
		super(message);
		this.position = position;
	}

	public int position() {
		return position;
	}
}
