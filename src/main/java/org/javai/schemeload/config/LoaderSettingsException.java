package org.javai.schemeload.config;

/**
 * Exception thrown when loader settings cannot be read or are invalid.
 */
public class LoaderSettingsException extends RuntimeException {

	public LoaderSettingsException(String message) {
		super(message);
	}

	public LoaderSettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
