package org.javai.schemeload.load;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of loading one script file.
 *
 * @param file the script that was loaded
 * @param totalForms number of top-level forms read
 * @param failedForms number of forms that failed to evaluate or include
 * @param skippedForms number of forms deliberately not evaluated
 * @param aborted whether the file was abandoned before evaluating anything
 * @param distinctFailingOperators operator names of the failed forms, in first-failure order
 * @param diagnostics every recorded failure in order
 */
public record LoadReport(
		String file,
		int totalForms,
		int failedForms,
		int skippedForms,
		boolean aborted,
		Set<String> distinctFailingOperators,
		List<LoadDiagnostic> diagnostics
) {

	public LoadReport {
		distinctFailingOperators = distinctFailingOperators != null
				? Collections.unmodifiableSet(new LinkedHashSet<>(distinctFailingOperators))
				: Set.of();
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public boolean hasFailures() {
		return !diagnostics.isEmpty();
	}

	/**
	 * Number of forms that were evaluated or included without failing.
	 */
	public int succeededForms() {
		return totalForms - failedForms - skippedForms;
	}

	public static Builder builder(String file) {
		return new Builder(file);
	}

	/**
	 * Accumulates the state of one load call.
	 */
	public static final class Builder {

		private final String file;
		private int totalForms;
		private int failedForms;
		private int skippedForms;
		private boolean aborted;
		private final Set<String> operators = new LinkedHashSet<>();
		private final List<LoadDiagnostic> diagnostics = new ArrayList<>();

		private Builder(String file) {
			this.file = file;
		}

		public Builder totalForms(int count) {
			this.totalForms = count;
			return this;
		}

		public Builder skipped() {
			skippedForms++;
			return this;
		}

		/**
		 * Records a failed form.
		 */
		public Builder failed(LoadDiagnostic diagnostic) {
			failedForms++;
			diagnostics.add(diagnostic);
			if (diagnostic.failingOperator() != null) {
				operators.add(diagnostic.failingOperator());
			}
			return this;
		}

		/**
		 * Records a failure that abandons the whole file.
		 */
		public Builder abort(LoadDiagnostic diagnostic) {
			aborted = true;
			diagnostics.add(diagnostic);
			return this;
		}

		public LoadReport build() {
			return new LoadReport(file, totalForms, failedForms, skippedForms, aborted, operators, diagnostics);
		}
	}
}
