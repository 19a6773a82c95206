package org.javai.schemeload.env;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The process-wide top-level environment shared by every loaded script.
 * <p>
 * One instance lives from application start to shutdown and is handed explicitly to the
 * evaluator. Definitions accumulate across files; redefining a name replaces the previous value.
 * There is no per-file isolation and no synchronization: all loading happens on one thread.
 */
public final class EnvironmentStore {

	private final Map<String, Object> bindings = new LinkedHashMap<>();

	/**
	 * Binds {@code name}, replacing any earlier binding.
	 *
	 * @return the previous value, if any
	 */
	public Optional<Object> define(String name, Object value) {
		Objects.requireNonNull(name, "name must not be null");
		return Optional.ofNullable(bindings.put(name, value));
	}

	/**
	 * Replaces the value of an existing binding.
	 *
	 * @return false when {@code name} is not bound
	 */
	public boolean assign(String name, Object value) {
		if (!bindings.containsKey(name)) {
			return false;
		}
		bindings.put(name, value);
		return true;
	}

	public Optional<Object> lookup(String name) {
		return Optional.ofNullable(bindings.get(name));
	}

	public boolean isBound(String name) {
		return bindings.containsKey(name);
	}

	/**
	 * Bound names in first-definition order.
	 */
	public Set<String> names() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(bindings.keySet()));
	}

	public int size() {
		return bindings.size();
	}
}
