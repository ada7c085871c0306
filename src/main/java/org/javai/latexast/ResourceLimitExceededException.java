package org.javai.latexast;

/**
 * Thrown when an input exceeds a configured size or nesting limit.
 * <p>
 * Unlike parse failures this is never recovered from: no fallback is attempted for
 * input that is too large or too deeply nested.
 */
public class ResourceLimitExceededException extends RuntimeException {

	private final String limit;
	private final int maximum;

	public ResourceLimitExceededException(String limit, int maximum) {
		super("Input exceeds the " + limit + " limit of " + maximum);
		this.limit = limit;
		this.maximum = maximum;
	}

	public String limit() {
		return limit;
	}

	public int maximum() {
		return maximum;
	}
}
