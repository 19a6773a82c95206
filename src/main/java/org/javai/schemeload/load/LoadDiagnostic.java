package org.javai.schemeload.load;

/**
 * One failure recorded while loading a script file.
 *
 * @param file the script being loaded
 * @param kind what failed
 * @param formPreview the failing form's text, truncated; empty for whole-file failures
 * @param failingOperator operator name of the failing form, or {@code null}
 * @param message best-effort failure message
 */
public record LoadDiagnostic(String file, Kind kind, String formPreview, String failingOperator, String message) {

	public enum Kind {
		/** Malformed text; the whole file was abandoned. */
		PARSE,
		/** A well-formed form failed in the evaluator. */
		EVALUATION,
		/** An inclusion form could not include its file. */
		INCLUSION,
		/** The file itself could not be read. */
		READ
	}

	public LoadDiagnostic {
		formPreview = formPreview != null ? formPreview : "";
		message = message != null ? message : "";
	}

	/**
	 * Cuts {@code text} to {@code maxLength} characters, marking the cut with {@code ...}.
	 */
	public static String preview(String text, int maxLength) {
		if (text == null) {
			return "";
		}
		return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
	}
}
