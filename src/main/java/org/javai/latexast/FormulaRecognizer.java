package org.javai.latexast;

/**
 * Turns an image of a formula into LaTeX source. Implementations live outside this
 * library; whatever string they return is processed as is.
 */
@FunctionalInterface
public interface FormulaRecognizer {

	/**
	 * @param image encoded image bytes
	 * @return the recognised LaTeX source
	 * @throws RecognitionException if the image cannot be recognised
	 */
	String recognize(byte[] image);
}
