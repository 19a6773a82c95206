package org.javai.schemeload.load;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort extraction of a readable message from an evaluator failure.
 * <p>
 * Wrapped failures are unwrapped to the innermost cause that has a message, the structured detail
 * of every {@link ScriptEvaluationException} in the chain is appended as {@code [key: value]},
 * and when no cause says anything the outermost message or the exception type is used.
 */
public final class FailureMessages {

	private FailureMessages() {
	}

	public static String extract(Throwable error) {
		if (error == null) {
			return "unknown error";
		}

		List<Throwable> chain = causeChain(error);
		String message = null;
		for (int i = chain.size() - 1; i >= 0; i--) {
			String candidate = chain.get(i).getMessage();
			if (candidate != null && !candidate.isBlank()) {
				message = candidate;
				break;
			}
		}
		if (message == null) {
			message = error.getClass().getSimpleName();
		}

		StringBuilder sb = new StringBuilder(message);
		for (Throwable t : chain) {
			if (t instanceof ScriptEvaluationException evaluationException) {
				for (Map.Entry<String, Object> detail : evaluationException.details().entrySet()) {
					sb.append(" [").append(detail.getKey()).append(": ").append(detail.getValue()).append(']');
				}
			}
		}
		return sb.toString();
	}

	private static List<Throwable> causeChain(Throwable error) {
		List<Throwable> chain = new ArrayList<>();
		Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
			chain.add(t);
		}
		return chain;
	}
}
