package org.javai.schemeload.sexpr;

/**
 * Exception thrown when script text is not a well-formed sequence of s-expressions.
 * A parse failure is fatal for the whole text being read.
 */
public class SExprParseException extends RuntimeException {

	private final int position;

	public SExprParseException(String message, int position) {
		super(message);
		this.position = position;
	}

	public SExprParseException(String message, Throwable cause) {
		super(message, cause);
		this.position = -1;
	}

	/**
	 * Character offset at which the problem was detected, or -1 when unknown.
	 */
	public int position() {
		return position;
	}
}
