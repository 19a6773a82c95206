package org.javai.schemeload.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.javai.schemeload.env.EnvironmentStore;
import org.javai.schemeload.load.LoadDiagnostic;
import org.javai.schemeload.load.ScriptEvaluator;
import org.javai.schemeload.sexpr.SExpr;
import org.javai.schemeload.sexpr.SExprReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A small strict Scheme interpreter over an {@link EnvironmentStore}.
 * <p>
 * It enforces the rule that makes normalization necessary: inside a lambda or {@code let} body every
 * {@code define} must come before the first expression. Bodies that interleave the two fail with
 * {@code definition after expression in body}, just like the production evaluator. Calls in tail
 * position do not grow the Java stack.
 */
public class SchemeInterpreter implements ScriptEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(SchemeInterpreter.class);

	private static final int FORM_PREVIEW = 60;
	private static final SExpr VOID_FORM = SExpr.list(SExpr.atom("void"));

	private final EnvironmentStore store;
	private final Frame global;

	/**
	 * An interpreter whose {@code display} output goes to standard output.
	 */
	public SchemeInterpreter(EnvironmentStore store) {
		this(store, System.out::print);
	}

	public SchemeInterpreter(EnvironmentStore store, Consumer<String> output) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.global = Frame.global(store);
		Builtins.install(store, Objects.requireNonNull(output, "output must not be null"));
	}

	/**
	 * Makes {@code function} callable from scripts as {@code name}. Exceptions it throws surface as
	 * {@link SchemeError}s naming the function.
	 */
	public void defineHostFunction(String name, HostFunction function) {
		Objects.requireNonNull(function, "function must not be null");
		store.define(name, (Procedure) args -> {
			try {
				return normalizeResult(function.call(args));
			} catch (SchemeError e) {
				throw e;
			} catch (Exception e) {
				throw new SchemeError(name + ": " + e.getMessage(), e).withDetail("host-function", name);
			}
		});
		logger.debug("Registered host function: {}", name);
	}

	/**
	 * Evaluates every form in {@code formText} at top level and returns the value of the last.
	 */
	@Override
	public Object evaluate(String formText) {
		Object result = Unspecified.VOID;
		try {
			for (SExpr form : SExprReader.parseAll(formText)) {
				result = eval(form, global);
			}
		} catch (StackOverflowError e) {
			throw new SchemeError("recursion too deep");
		}
		return result;
	}

	/**
	 * Calls {@code procedure} with already evaluated arguments.
	 */
	Object apply(Procedure procedure, List<Object> args) {
		if (procedure instanceof Closure closure) {
			Frame frame = closure.bind(args);
			return eval(enterBody(closure.body(), frame), frame);
		}
		return normalizeResult(procedure.apply(args));
	}

	private Object eval(SExpr x, Frame env) {
		while (true) {
			if (x.isAtom()) {
				Object value = SchemeValues.parseAtom(x);
				return value instanceof Symbol symbol ? env.lookup(symbol.name()) : value;
			}
			if (x.isEmptyList()) {
				throw new SchemeError("missing procedure expression: ()");
			}
			String keyword = x.get(0).isSymbol() ? x.get(0).atom() : "";
			switch (keyword) {
				case "quote":
					arity(x, 2, 2);
					return SchemeValues.fromDatum(x.get(1));
				case "quasiquote":
					arity(x, 2, 2);
					return quasiquote(x.get(1), env, 1);
				case "if":
					arity(x, 3, 4);
					if (SchemeValues.isTrue(eval(x.get(1), env))) {
						x = x.get(2);
					} else if (x.size() == 4) {
						x = x.get(3);
					} else {
						return Unspecified.VOID;
					}
					continue;
				case "define":
					if (!env.isGlobal()) {
						throw syntaxError(x, "definition in expression context");
					}
					define(x, env);
					return Unspecified.VOID;
				case "set!":
					arity(x, 3, 3);
					env.assign(symbolName(x, x.get(1)), eval(x.get(2), env));
					return Unspecified.VOID;
				case "lambda":
					arity(x, 3, Integer.MAX_VALUE);
					return lambda("lambda", x.get(1), x.tail(2), env);
				case "begin":
					if (x.size() == 1) {
						return Unspecified.VOID;
					}
					for (SExpr form : x.items().subList(1, x.size() - 1)) {
						eval(form, env);
					}
					x = x.get(x.size() - 1);
					continue;
				case "let":
					arity(x, 3, Integer.MAX_VALUE);
					if (x.get(1).isSymbol()) {
						Frame loopFrame = env.extend();
						NamedBindings bindings = bindings(x, x.get(2), env);
						Closure loop = new Closure(x.get(1).atom(), bindings.names, null, x.tail(3), loopFrame, this);
						loopFrame.define(x.get(1).atom(), loop);
						env = loop.bind(bindings.values);
						x = enterBody(x.tail(3), env);
					} else {
						NamedBindings bindings = bindings(x, x.get(1), env);
						Frame frame = env.extend();
						for (int i = 0; i < bindings.names.size(); i++) {
							frame.define(bindings.names.get(i), bindings.values.get(i));
						}
						env = frame;
						x = enterBody(x.tail(2), env);
					}
					continue;
				case "let*":
					arity(x, 3, Integer.MAX_VALUE);
					for (SExpr binding : bindingList(x, x.get(1))) {
						Frame frame = env.extend();
						frame.define(bindingName(x, binding), bindingValue(binding, env));
						env = frame;
					}
					env = env.extend();
					x = enterBody(x.tail(2), env);
					continue;
				case "letrec", "letrec*":
					arity(x, 3, Integer.MAX_VALUE);
					env = env.extend();
					List<SExpr> recursive = bindingList(x, x.get(1));
					for (SExpr binding : recursive) {
						env.define(bindingName(x, binding), Unspecified.UNASSIGNED);
					}
					for (SExpr binding : recursive) {
						env.assign(bindingName(x, binding), bindingValue(binding, env));
					}
					x = enterBody(x.tail(2), env);
					continue;
				case "cond":
					Branch branch = cond(x, env);
					if (branch.next() == null) {
						return branch.value();
					}
					x = branch.next();
					continue;
				case "case":
					arity(x, 2, Integer.MAX_VALUE);
					SExpr chosen = caseClause(x, eval(x.get(1), env));
					if (chosen == null) {
						return Unspecified.VOID;
					}
					x = chosen;
					continue;
				case "and":
					if (x.size() == 1) {
						return Boolean.TRUE;
					}
					boolean failed = false;
					for (SExpr test : x.items().subList(1, x.size() - 1)) {
						if (!SchemeValues.isTrue(eval(test, env))) {
							failed = true;
							break;
						}
					}
					if (failed) {
						return Boolean.FALSE;
					}
					x = x.get(x.size() - 1);
					continue;
				case "or":
					if (x.size() == 1) {
						return Boolean.FALSE;
					}
					for (SExpr test : x.items().subList(1, x.size() - 1)) {
						Object value = eval(test, env);
						if (SchemeValues.isTrue(value)) {
							return value;
						}
					}
					x = x.get(x.size() - 1);
					continue;
				case "when", "unless":
					arity(x, 3, Integer.MAX_VALUE);
					boolean proceed = SchemeValues.isTrue(eval(x.get(1), env)) == keyword.equals("when");
					if (!proceed) {
						return Unspecified.VOID;
					}
					for (SExpr form : x.items().subList(2, x.size() - 1)) {
						eval(form, env);
					}
					x = x.get(x.size() - 1);
					continue;
				case "do":
					return doLoop(x, env);
				default:
					break;
			}

			Object operator = eval(x.get(0), env);
			if (!(operator instanceof Procedure procedure)) {
				throw new SchemeError("attempt to call a non-procedure: " + SchemeValues.write(operator))
						.withDetail("form", x.toString());
			}
			List<Object> args = new ArrayList<>(x.size() - 1);
			for (SExpr arg : x.tail(1)) {
				args.add(eval(arg, env));
			}
			if (procedure instanceof Closure closure) {
				env = closure.bind(args);
				x = enterBody(closure.body(), env);
				continue;
			}
			return normalizeResult(procedure.apply(args));
		}
	}

	/**
	 * Runs the definitions and all but the last expression of a body and returns the last
	 * expression, to be evaluated in tail position. A body with a definition after an expression is
	 * rejected before any of it runs.
	 */
	private SExpr enterBody(List<SExpr> body, Frame env) {
		int firstExpression = body.size();
		for (int i = 0; i < body.size(); i++) {
			if (!isDefinition(body.get(i))) {
				firstExpression = Math.min(firstExpression, i);
			} else if (i > firstExpression) {
				throw new SchemeError("definition after expression in body")
						.withDetail("form", LoadDiagnostic.preview(body.get(i).toString(), FORM_PREVIEW));
			}
		}
		for (SExpr definition : body.subList(0, firstExpression)) {
			define(definition, env);
		}
		if (firstExpression == body.size()) {
			return VOID_FORM;
		}
		for (SExpr form : body.subList(firstExpression, body.size() - 1)) {
			eval(form, env);
		}
		return body.get(body.size() - 1);
	}

	private static boolean isDefinition(SExpr form) {
		return form.isList() && !form.isEmptyList() && form.get(0).isSymbol("define");
	}

	private void define(SExpr x, Frame env) {
		arity(x, 2, Integer.MAX_VALUE);
		SExpr target = x.get(1);
		if (target.isList()) {
			if (target.isEmptyList()) {
				throw syntaxError(x, "missing procedure name");
			}
			String name = symbolName(x, target.get(0));
			if (x.size() < 3) {
				throw syntaxError(x, "procedure definition without a body");
			}
			env.define(name, lambda(name, SExpr.list(target.tail(1)), x.tail(2), env));
			return;
		}
		String name = symbolName(x, target);
		if (x.size() > 3) {
			throw syntaxError(x, "too many forms in variable definition");
		}
		Object value = x.size() == 3 ? eval(x.get(2), env) : Unspecified.VOID;
		if (value instanceof Closure closure && closure.name().equals("lambda")) {
			value = closure.named(name);
		}
		env.define(name, value);
	}

	private Closure lambda(String name, SExpr formals, List<SExpr> body, Frame env) {
		if (formals.isSymbol()) {
			return new Closure(name, List.of(), formals.atom(), body, env, this);
		}
		if (!formals.isList()) {
			throw new SchemeError("bad parameter list: " + formals);
		}
		List<String> names = new ArrayList<>();
		String rest = null;
		List<SExpr> items = formals.items();
		for (int i = 0; i < items.size(); i++) {
			SExpr item = items.get(i);
			if (item.isSymbol(".")) {
				if (i != items.size() - 2) {
					throw new SchemeError("bad rest parameter in: " + formals);
				}
				rest = symbolName(formals, items.get(i + 1));
				break;
			}
			names.add(symbolName(formals, item));
		}
		return new Closure(name, names, rest, body, env, this);
	}

	private Object quasiquote(SExpr template, Frame env, int depth) {
		if (template.isAtom()) {
			return SchemeValues.fromDatum(template);
		}
		if (template.size() == 2 && template.get(0).isSymbol("unquote")) {
			if (depth == 1) {
				return eval(template.get(1), env);
			}
			return List.of(new Symbol("unquote"), quasiquote(template.get(1), env, depth - 1));
		}
		if (template.size() == 2 && template.get(0).isSymbol("quasiquote")) {
			return List.of(new Symbol("quasiquote"), quasiquote(template.get(1), env, depth + 1));
		}
		List<Object> result = new ArrayList<>();
		for (SExpr item : template.items()) {
			if (depth == 1 && item.size() == 2 && item.get(0).isSymbol("unquote-splicing")) {
				Object spliced = eval(item.get(1), env);
				if (!(spliced instanceof List<?> values)) {
					throw new SchemeError("unquote-splicing: expected a list")
							.withDetail("value", SchemeValues.write(spliced));
				}
				result.addAll(values);
			} else {
				result.add(quasiquote(item, env, depth));
			}
		}
		return Collections.unmodifiableList(result);
	}

	/**
	 * Outcome of a {@code cond}: either an expression still to evaluate in tail position or a
	 * finished value.
	 */
	private record Branch(SExpr next, Object value) {

		static Branch tail(SExpr next) {
			return new Branch(next, null);
		}

		static Branch done(Object value) {
			return new Branch(null, value);
		}
	}

	private Branch cond(SExpr x, Frame env) {
		for (SExpr clause : x.tail(1)) {
			if (!clause.isList() || clause.isEmptyList()) {
				throw syntaxError(x, "bad cond clause: " + clause);
			}
			if (clause.get(0).isSymbol("else")) {
				return Branch.tail(sequence(clause.tail(1), env));
			}
			Object value = eval(clause.get(0), env);
			if (!SchemeValues.isTrue(value)) {
				continue;
			}
			if (clause.size() == 1) {
				return Branch.done(value);
			}
			if (clause.size() == 3 && clause.get(1).isSymbol("=>")) {
				Object receiver = eval(clause.get(2), env);
				if (!(receiver instanceof Procedure procedure)) {
					throw new SchemeError("cond: => target is not a procedure");
				}
				return Branch.done(apply(procedure, List.of(value)));
			}
			return Branch.tail(sequence(clause.tail(1), env));
		}
		return Branch.done(Unspecified.VOID);
	}

	private SExpr caseClause(SExpr x, Object key) {
		for (SExpr clause : x.tail(2)) {
			if (!clause.isList() || clause.size() < 2) {
				throw syntaxError(x, "bad case clause: " + clause);
			}
			SExpr data = clause.get(0);
			boolean matches = data.isSymbol("else");
			if (!matches && data.isList()) {
				for (SExpr datum : data.items()) {
					if (Builtins.isEqv(SchemeValues.fromDatum(datum), key)) {
						matches = true;
						break;
					}
				}
			}
			if (matches) {
				return SExpr.form("begin", clause.tail(1));
			}
		}
		return null;
	}

	private SExpr sequence(List<SExpr> forms, Frame env) {
		if (forms.isEmpty()) {
			return VOID_FORM;
		}
		for (SExpr form : forms.subList(0, forms.size() - 1)) {
			eval(form, env);
		}
		return forms.get(forms.size() - 1);
	}

	private Object doLoop(SExpr x, Frame env) {
		arity(x, 3, Integer.MAX_VALUE);
		List<SExpr> specs = bindingList(x, x.get(1));
		SExpr exit = x.get(2);
		if (!exit.isList() || exit.isEmptyList()) {
			throw syntaxError(x, "bad do exit clause");
		}
		Frame frame = env.extend();
		for (SExpr spec : specs) {
			frame.define(bindingName(x, spec), bindingValue(spec, env));
		}
		while (!SchemeValues.isTrue(eval(exit.get(0), frame))) {
			for (SExpr command : x.tail(3)) {
				eval(command, frame);
			}
			List<Object> steps = new ArrayList<>(specs.size());
			for (SExpr spec : specs) {
				steps.add(spec.size() > 2 ? eval(spec.get(2), frame) : frame.lookup(bindingName(x, spec)));
			}
			Frame nextFrame = env.extend();
			for (int i = 0; i < specs.size(); i++) {
				nextFrame.define(bindingName(x, specs.get(i)), steps.get(i));
			}
			frame = nextFrame;
		}
		Object result = Unspecified.VOID;
		for (SExpr form : exit.tail(1)) {
			result = eval(form, frame);
		}
		return result;
	}

	// binding helpers

	private static final class NamedBindings {
		final List<String> names = new ArrayList<>();
		final List<Object> values = new ArrayList<>();
	}

	private NamedBindings bindings(SExpr x, SExpr list, Frame env) {
		NamedBindings result = new NamedBindings();
		for (SExpr binding : bindingList(x, list)) {
			result.names.add(bindingName(x, binding));
			result.values.add(bindingValue(binding, env));
		}
		return result;
	}

	private static List<SExpr> bindingList(SExpr x, SExpr list) {
		if (!list.isList()) {
			throw syntaxError(x, "bad binding list: " + list);
		}
		return list.items();
	}

	private static String bindingName(SExpr x, SExpr binding) {
		if (binding.isSymbol()) {
			return binding.atom();
		}
		if (!binding.isList() || binding.isEmptyList()) {
			throw syntaxError(x, "bad binding: " + binding);
		}
		return symbolName(x, binding.get(0));
	}

	private Object bindingValue(SExpr binding, Frame env) {
		if (binding.isAtom() || binding.size() < 2) {
			return Unspecified.VOID;
		}
		return eval(binding.get(1), env);
	}

	// checks

	private static String symbolName(SExpr x, SExpr candidate) {
		if (!candidate.isSymbol()) {
			throw syntaxError(x, "expected a symbol but got " + candidate);
		}
		return candidate.atom();
	}

	private static void arity(SExpr x, int min, int max) {
		if (x.size() < min || x.size() > max) {
			throw syntaxError(x, "bad syntax");
		}
	}

	private static SchemeError syntaxError(SExpr x, String message) {
		return new SchemeError(x.operator().orElse("syntax") + ": " + message)
				.withDetail("form", LoadDiagnostic.preview(x.toString(), FORM_PREVIEW));
	}

	private static Object normalizeResult(Object value) {
		return value == null ? Unspecified.VOID : value;
	}
}
