package org.javai.latexast.vocabulary;

/**
 * Exception thrown when a vocabulary definition cannot be loaded.
 */
public class VocabularyException extends RuntimeException {

	public VocabularyException(String message) {
		super(message);
	}

	public VocabularyException(String message, Throwable cause) {
		super(message, cause);
	}
}
