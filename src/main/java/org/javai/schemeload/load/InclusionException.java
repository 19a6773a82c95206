package org.javai.schemeload.load;

/**
 * Exception thrown when an inclusion form cannot include the file it names.
 */
public class InclusionException extends RuntimeException {

	public InclusionException(String message) {
		super(message);
	}

	public InclusionException(String message, Throwable cause) {
		super(message, cause);
	}
}
