package org.javai.schemeload.load;

import java.util.Objects;

/**
 * The single place where exceptions thrown by a {@link ScriptEvaluator} are turned into an
 * {@link EvaluationResult}. Nothing past this point relies on exceptions for evaluator failures.
 */
public final class EvaluationGateway {

	private final ScriptEvaluator evaluator;

	public EvaluationGateway(ScriptEvaluator evaluator) {
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
	}

	public EvaluationResult submit(String formText) {
		try {
			return new EvaluationResult.Success(evaluator.evaluate(formText));
		} catch (Exception ex) {
			return new EvaluationResult.Failure(ex, FailureMessages.extract(ex));
		}
	}
}
