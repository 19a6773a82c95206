package org.javai.schemeload.load;

import java.util.List;

/**
 * Resolves the file named by an inclusion form and loads it through the same loader, or
 * registers it for a later load, depending on the request's mode.
 */
public interface InclusionHandler {

	/**
	 * @throws InclusionException if the file cannot be included
	 */
	void include(InclusionRequest request, ScriptLoader loader);

	/**
	 * Loads the files registered so far through {@code loader}, in registration order.
	 * Handlers that never register return an empty list.
	 */
	default List<LoadReport> loadRegistered(ScriptLoader loader) {
		return List.of();
	}
}
