package org.javai.schemeload.interp;

import java.util.HashMap;
import java.util.Map;
import org.javai.schemeload.env.EnvironmentStore;

/**
 * A lexical scope. The outermost frame has no local variables of its own and reads and writes
 * the shared {@link EnvironmentStore}.
 */
final class Frame {

	private final Frame parent;
	private final EnvironmentStore store;
	private final Map<String, Object> variables;

	private Frame(Frame parent, EnvironmentStore store) {
		this.parent = parent;
		this.store = store;
		this.variables = parent == null ? null : new HashMap<>();
	}

	static Frame global(EnvironmentStore store) {
		return new Frame(null, store);
	}

	Frame extend() {
		return new Frame(this, store);
	}

	boolean isGlobal() {
		return parent == null;
	}

	void define(String name, Object value) {
		if (isGlobal()) {
			store.define(name, value);
		} else {
			variables.put(name, value);
		}
	}

	Object lookup(String name) {
		for (Frame frame = this; frame != null; frame = frame.parent) {
			if (frame.isGlobal()) {
				if (frame.store.isBound(name)) {
					return checkAssigned(name, frame.store.lookup(name).orElse(Unspecified.VOID));
				}
			} else if (frame.variables.containsKey(name)) {
				return checkAssigned(name, frame.variables.get(name));
			}
		}
		throw new SchemeError("unbound variable: " + name).withDetail("symbol", name);
	}

	void assign(String name, Object value) {
		for (Frame frame = this; frame != null; frame = frame.parent) {
			if (frame.isGlobal()) {
				if (frame.store.assign(name, value)) {
					return;
				}
			} else if (frame.variables.containsKey(name)) {
				frame.variables.put(name, value);
				return;
			}
		}
		throw new SchemeError("set!: unbound variable: " + name).withDetail("symbol", name);
	}

	private static Object checkAssigned(String name, Object value) {
		if (value == Unspecified.UNASSIGNED) {
			throw new SchemeError("variable used before its definition: " + name).withDetail("symbol", name);
		}
		return value;
	}
}
