package org.javai.schemeload.interp;

import org.javai.schemeload.load.ScriptEvaluationException;

/**
 * Runtime failure raised by {@link SchemeInterpreter}.
 */
public class SchemeError extends ScriptEvaluationException {

	public SchemeError(String message) {
		super(message);
	}

	public SchemeError(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public SchemeError withDetail(String key, Object value) {
		super.withDetail(key, value);
		return this;
	}
}
