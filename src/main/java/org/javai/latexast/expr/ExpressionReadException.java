package org.javai.latexast.expr;

/**
 * Thrown when a string is not in the expression text form.
 */
public class ExpressionReadException extends RuntimeException {

	private final int position;

	public ExpressionReadException(String message, int position) {
		super(message + " at position " + position);
		this.position = position;
	}

	public int position() {
		return position;
	}
}
