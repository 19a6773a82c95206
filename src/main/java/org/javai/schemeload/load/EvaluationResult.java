package org.javai.schemeload.load;

/**
 * Outcome of submitting one form to the evaluator.
 */
public sealed interface EvaluationResult {

	boolean success();

	record Success(Object value) implements EvaluationResult {
		@Override
		public boolean success() {
			return true;
		}
	}

	/**
	 * @param error the exception raised by the evaluator
	 * @param message the most specific message extracted from it
	 */
	record Failure(Throwable error, String message) implements EvaluationResult {
		@Override
		public boolean success() {
			return false;
		}
	}
}
