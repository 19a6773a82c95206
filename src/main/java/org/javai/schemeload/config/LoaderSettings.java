package org.javai.schemeload.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of the script loader.
 *
 * @param includeDirectory directory relative script names are resolved against
 * @param previewLength maximum length of the form preview kept in a diagnostic
 * @param foldCase whether symbols are lower-cased while reading
 * @param prelude compatibility script loaded before anything else, or {@code null}
 * @param compatDefinitions forms evaluated instead of the prelude when the prelude file is missing
 * @param inclusionOperators top-level operators that name a file to include, and what to do with it
 * @param skipDefinitions per script file name, top-level definitions that must not be evaluated
 */
public record LoaderSettings(
		Path includeDirectory,
		int previewLength,
		boolean foldCase,
		String prelude,
		List<String> compatDefinitions,
		Map<String, InclusionMode> inclusionOperators,
		Map<String, Set<String>> skipDefinitions
) {

	public static final int MIN_PREVIEW_LENGTH = 8;

	public LoaderSettings {
		Objects.requireNonNull(includeDirectory, "includeDirectory must not be null");
		if (previewLength < MIN_PREVIEW_LENGTH) {
			throw new LoaderSettingsException("preview-length must be at least " + MIN_PREVIEW_LENGTH + " but was " + previewLength);
		}
		compatDefinitions = compatDefinitions != null ? List.copyOf(compatDefinitions) : List.of();
		inclusionOperators = inclusionOperators != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(inclusionOperators))
				: Map.of();
		skipDefinitions = skipDefinitions != null ? Map.copyOf(skipDefinitions) : Map.of();
	}

	/**
	 * Built-in settings, used for every key a settings file leaves out.
	 */
	public static LoaderSettings defaults() {
		Map<String, InclusionMode> operators = new LinkedHashMap<>();
		operators.put("load", InclusionMode.LOAD);
		operators.put("kern-load", InclusionMode.LOAD);
		operators.put("kern-include", InclusionMode.REGISTER);
		return new LoaderSettings(
				Path.of("Scripts"),
				80,
				false,
				"tinyscheme-compat.scm",
				List.of("(define nil '())", "(define NIL '())", "(define t #t)", "(define f #f)"),
				operators,
				Map.of("naz.scm", Set.of("original-load", "load")));
	}

	public LoaderSettings withIncludeDirectory(Path directory) {
		return new LoaderSettings(directory, previewLength, foldCase, prelude, compatDefinitions,
				inclusionOperators, skipDefinitions);
	}

	public LoaderSettings withFoldCase(boolean fold) {
		return new LoaderSettings(includeDirectory, previewLength, fold, prelude, compatDefinitions,
				inclusionOperators, skipDefinitions);
	}

	public LoaderSettings withPreviewLength(int length) {
		return new LoaderSettings(includeDirectory, length, foldCase, prelude, compatDefinitions,
				inclusionOperators, skipDefinitions);
	}

	public boolean isInclusionOperator(String operator) {
		return inclusionOperators.containsKey(operator);
	}

	/**
	 * Whether the top-level definition of {@code name} in the script called {@code fileName} is skipped.
	 */
	public boolean isSkipped(String fileName, String name) {
		if (fileName == null) {
			return false;
		}
		for (Map.Entry<String, Set<String>> entry : skipDefinitions.entrySet()) {
			if (fileName.equalsIgnoreCase(entry.getKey()) && entry.getValue().contains(name)) {
				return true;
			}
		}
		return false;
	}
}
