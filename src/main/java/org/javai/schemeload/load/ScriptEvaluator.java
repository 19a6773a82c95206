package org.javai.schemeload.load;

/**
 * The evaluator scripts are executed on.
 * <p>
 * Receives exactly one syntactically complete form as text per call, executes it against the
 * shared environment and returns its value. Failures are signalled by throwing; evaluators that
 * can attach structured detail should throw {@link ScriptEvaluationException}.
 */
@FunctionalInterface
public interface ScriptEvaluator {

	Object evaluate(String formText) throws Exception;
}
