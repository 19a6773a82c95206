package org.javai.schemeload.load;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluator failure that may carry structured detail, such as the irritants of a script
 * {@code (error ...)} call or the name of an unbound variable.
 */
public class ScriptEvaluationException extends RuntimeException {

	private final Map<String, Object> details = new LinkedHashMap<>();

	public ScriptEvaluationException(String message) {
		super(message);
	}

	public ScriptEvaluationException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Attaches a detail entry and returns this exception.
	 */
	public ScriptEvaluationException withDetail(String key, Object value) {
		details.put(key, value);
		return this;
	}

	public Map<String, Object> details() {
		return Collections.unmodifiableMap(details);
	}
}
