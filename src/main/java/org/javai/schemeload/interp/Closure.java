package org.javai.schemeload.interp;

import java.util.List;
import org.javai.schemeload.sexpr.SExpr;

/**
 * A procedure created by {@code lambda} or a procedure {@code define}.
 */
final class Closure implements Procedure {

	private final String name;
	private final List<String> parameters;
	private final String restParameter;
	private final List<SExpr> body;
	private final Frame frame;
	private final SchemeInterpreter interpreter;

	Closure(String name, List<String> parameters, String restParameter, List<SExpr> body, Frame frame,
			SchemeInterpreter interpreter) {
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.restParameter = restParameter;
		this.body = body;
		this.frame = frame;
		this.interpreter = interpreter;
	}

	String name() {
		return name;
	}

	/**
	 * The same procedure under another name, used when an anonymous lambda is bound by
	 * {@code define}.
	 */
	Closure named(String newName) {
		return new Closure(newName, parameters, restParameter, body, frame, interpreter);
	}

	List<SExpr> body() {
		return body;
	}

	/**
	 * A fresh frame holding the arguments of one call.
	 */
	Frame bind(List<Object> args) {
		int required = parameters.size();
		if (args.size() < required || (restParameter == null && args.size() > required)) {
			throw new SchemeError(name + ": expected " + (restParameter == null ? "" : "at least ") + required
					+ " argument(s), got " + args.size())
					.withDetail("procedure", name);
		}
		Frame callFrame = frame.extend();
		for (int i = 0; i < required; i++) {
			callFrame.define(parameters.get(i), args.get(i));
		}
		if (restParameter != null) {
			callFrame.define(restParameter, List.copyOf(args.subList(required, args.size())));
		}
		return callFrame;
	}

	@Override
	public Object apply(List<Object> args) {
		return interpreter.apply(this, args);
	}
}
