package org.javai.latexast;

/**
 * Exception thrown by a {@link FormulaRecognizer} that cannot recognise an image.
 */
public class RecognitionException extends RuntimeException {

	public RecognitionException(String message) {
		super(message);
	}

	public RecognitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
