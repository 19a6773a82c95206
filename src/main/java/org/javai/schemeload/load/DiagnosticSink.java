package org.javai.schemeload.load;

/**
 * Receives load failures as they happen and the report at the end of each file.
 */
public interface DiagnosticSink {

	/**
	 * Called once for every recorded failure, in order.
	 */
	void formFailed(LoadDiagnostic diagnostic);

	/**
	 * Called once per file load, including nested loads, after the last form.
	 */
	void loadCompleted(LoadReport report);
}
