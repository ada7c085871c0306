package org.javai.latexast.expr;

/**
 * Exception thrown when an expression cannot be simplified.
 */
public class SimplificationException extends RuntimeException {

	public SimplificationException(String message) {
		super(message);
	}

	public SimplificationException(String message, Throwable cause) {
		super(message, cause);
	}
}
