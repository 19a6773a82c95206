package org.javai.schemeload.config;

import java.util.Locale;

/**
 * What an inclusion operator does with the file it names.
 */
public enum InclusionMode {

	/** Resolve and load the file right away. */
	LOAD,

	/** Only remember the file; it is loaded when registered files are loaded explicitly. */
	REGISTER;

	public static InclusionMode fromConfig(String value) {
		if (value == null) {
			throw new LoaderSettingsException("Inclusion mode must not be null");
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new LoaderSettingsException("Unknown inclusion mode '" + value + "'; expected 'load' or 'register'", e);
		}
	}
}
