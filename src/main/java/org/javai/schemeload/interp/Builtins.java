package org.javai.schemeload.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.javai.schemeload.env.EnvironmentStore;

/**
 * The primitive procedures every interpreter starts with.
 */
final class Builtins {

	private final EnvironmentStore store;
	private final Consumer<String> output;

	private Builtins(EnvironmentStore store, Consumer<String> output) {
		this.store = store;
		this.output = output;
	}

	static void install(EnvironmentStore store, Consumer<String> output) {
		Builtins builtins = new Builtins(store, output);
		builtins.arithmetic();
		builtins.comparison();
		builtins.predicates();
		builtins.lists();
		builtins.higherOrder();
		builtins.text();
		builtins.misc();
	}

	private void define(String name, Procedure procedure) {
		store.define(name, procedure);
	}

	private void arithmetic() {
		define("+", args -> fold("+", args, 0L, Math::addExact, Double::sum));
		define("*", args -> fold("*", args, 1L, Math::multiplyExact, (a, b) -> a * b));
		define("-", args -> {
			atLeast("-", args, 1);
			if (args.size() == 1) {
				return combine("-", 0L, args.get(0), Math::subtractExact, (a, b) -> a - b);
			}
			Object result = args.get(0);
			for (Object arg : args.subList(1, args.size())) {
				result = combine("-", result, arg, Math::subtractExact, (a, b) -> a - b);
			}
			return result;
		});
		define("/", args -> {
			atLeast("/", args, 1);
			Object result = args.size() == 1 ? Long.valueOf(1L) : args.get(0);
			for (Object arg : args.size() == 1 ? args : args.subList(1, args.size())) {
				result = divide(result, arg);
			}
			return result;
		});
		define("quotient", args -> {
			exactly("quotient", args, 2);
			return integer("quotient", args.get(0)) / nonZero("quotient", integer("quotient", args.get(1)));
		});
		define("remainder", args -> {
			exactly("remainder", args, 2);
			return integer("remainder", args.get(0)) % nonZero("remainder", integer("remainder", args.get(1)));
		});
		define("modulo", args -> {
			exactly("modulo", args, 2);
			return Math.floorMod(integer("modulo", args.get(0)), nonZero("modulo", integer("modulo", args.get(1))));
		});
		define("abs", args -> {
			exactly("abs", args, 1);
			Number n = number("abs", args.get(0));
			return n instanceof Long l ? (Object) Math.abs(l) : (Object) Math.abs(n.doubleValue());
		});
		define("min", args -> extreme("min", args, -1));
		define("max", args -> extreme("max", args, 1));
	}

	private void comparison() {
		define("=", args -> compareChain("=", args, c -> c == 0));
		define("<", args -> compareChain("<", args, c -> c < 0));
		define(">", args -> compareChain(">", args, c -> c > 0));
		define("<=", args -> compareChain("<=", args, c -> c <= 0));
		define(">=", args -> compareChain(">=", args, c -> c >= 0));
		define("not", args -> {
			exactly("not", args, 1);
			return Boolean.FALSE.equals(args.get(0));
		});
		define("eq?", args -> {
			exactly("eq?", args, 2);
			return isEqv(args.get(0), args.get(1));
		});
		define("eqv?", args -> {
			exactly("eqv?", args, 2);
			return isEqv(args.get(0), args.get(1));
		});
		define("equal?", args -> {
			exactly("equal?", args, 2);
			return Objects.equals(args.get(0), args.get(1));
		});
	}

	private void predicates() {
		predicate("null?", v -> v instanceof List<?> l && l.isEmpty());
		predicate("pair?", v -> v instanceof List<?> l && !l.isEmpty());
		predicate("list?", v -> v instanceof List<?>);
		predicate("number?", v -> v instanceof Long || v instanceof Double);
		predicate("integer?", v -> v instanceof Long || (v instanceof Double d && d == Math.rint(d)));
		predicate("string?", v -> v instanceof String);
		predicate("symbol?", v -> v instanceof Symbol);
		predicate("boolean?", v -> v instanceof Boolean);
		predicate("char?", v -> v instanceof Character);
		predicate("procedure?", v -> v instanceof Procedure);
		predicate("zero?", v -> number("zero?", v).doubleValue() == 0.0);
	}

	private void lists() {
		define("cons", args -> {
			exactly("cons", args, 2);
			List<Object> tail = list("cons", args.get(1));
			List<Object> result = new ArrayList<>(tail.size() + 1);
			result.add(args.get(0));
			result.addAll(tail);
			return Collections.unmodifiableList(result);
		});
		define("car", args -> {
			exactly("car", args, 1);
			return nonEmpty("car", args.get(0)).get(0);
		});
		define("cdr", args -> {
			exactly("cdr", args, 1);
			List<Object> list = nonEmpty("cdr", args.get(0));
			return list.subList(1, list.size());
		});
		define("cadr", args -> {
			exactly("cadr", args, 1);
			List<Object> list = list("cadr", args.get(0));
			if (list.size() < 2) {
				throw new SchemeError("cadr: list too short").withDetail("argument", SchemeValues.write(list));
			}
			return list.get(1);
		});
		define("list", List::copyOf);
		define("length", args -> {
			exactly("length", args, 1);
			return (long) list("length", args.get(0)).size();
		});
		define("append", args -> {
			List<Object> result = new ArrayList<>();
			for (Object arg : args) {
				result.addAll(list("append", arg));
			}
			return Collections.unmodifiableList(result);
		});
		define("reverse", args -> {
			exactly("reverse", args, 1);
			List<Object> result = new ArrayList<>(list("reverse", args.get(0)));
			Collections.reverse(result);
			return Collections.unmodifiableList(result);
		});
		define("list-ref", args -> {
			exactly("list-ref", args, 2);
			List<Object> list = list("list-ref", args.get(0));
			long index = integer("list-ref", args.get(1));
			if (index < 0 || index >= list.size()) {
				throw new SchemeError("list-ref: index out of range").withDetail("index", index);
			}
			return list.get((int) index);
		});
		define("memv", args -> member("memv", args, Builtins::isEqv));
		define("memq", args -> member("memq", args, Builtins::isEqv));
		define("member", args -> member("member", args, Objects::equals));
		define("assv", args -> assoc("assv", args, Builtins::isEqv));
		define("assq", args -> assoc("assq", args, Builtins::isEqv));
		define("assoc", args -> assoc("assoc", args, Objects::equals));
	}

	private void higherOrder() {
		define("map", args -> {
			atLeast("map", args, 2);
			Procedure f = procedure("map", args.get(0));
			List<List<Object>> lists = new ArrayList<>();
			for (Object arg : args.subList(1, args.size())) {
				lists.add(list("map", arg));
			}
			int length = lists.stream().mapToInt(List::size).min().orElse(0);
			List<Object> result = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				int index = i;
				result.add(f.apply(lists.stream().map(l -> l.get(index)).collect(Collectors.toList())));
			}
			return Collections.unmodifiableList(result);
		});
		define("for-each", args -> {
			atLeast("for-each", args, 2);
			Procedure f = procedure("for-each", args.get(0));
			List<List<Object>> lists = new ArrayList<>();
			for (Object arg : args.subList(1, args.size())) {
				lists.add(list("for-each", arg));
			}
			int length = lists.stream().mapToInt(List::size).min().orElse(0);
			for (int i = 0; i < length; i++) {
				int index = i;
				f.apply(lists.stream().map(l -> l.get(index)).collect(Collectors.toList()));
			}
			return Unspecified.VOID;
		});
		define("apply", args -> {
			atLeast("apply", args, 2);
			Procedure f = procedure("apply", args.get(0));
			List<Object> spread = new ArrayList<>(args.subList(1, args.size() - 1));
			spread.addAll(list("apply", args.get(args.size() - 1)));
			return f.apply(spread);
		});
	}

	private void text() {
		define("display", args -> {
			exactly("display", args, 1);
			output.accept(SchemeValues.display(args.get(0)));
			return Unspecified.VOID;
		});
		define("write", args -> {
			exactly("write", args, 1);
			output.accept(SchemeValues.write(args.get(0)));
			return Unspecified.VOID;
		});
		define("newline", args -> {
			exactly("newline", args, 0);
			output.accept("\n");
			return Unspecified.VOID;
		});
		define("string-append", args -> {
			StringBuilder result = new StringBuilder();
			for (Object arg : args) {
				result.append(string("string-append", arg));
			}
			return result.toString();
		});
		define("string-length", args -> {
			exactly("string-length", args, 1);
			return (long) string("string-length", args.get(0)).length();
		});
		define("string=?", args -> {
			exactly("string=?", args, 2);
			return string("string=?", args.get(0)).equals(string("string=?", args.get(1)));
		});
		define("number->string", args -> {
			exactly("number->string", args, 1);
			return number("number->string", args.get(0)).toString();
		});
		define("symbol->string", args -> {
			exactly("symbol->string", args, 1);
			if (!(args.get(0) instanceof Symbol symbol)) {
				throw typeError("symbol->string", "symbol", args.get(0));
			}
			return symbol.name();
		});
		define("string->symbol", args -> {
			exactly("string->symbol", args, 1);
			return new Symbol(string("string->symbol", args.get(0)));
		});
	}

	private void misc() {
		define("void", args -> Unspecified.VOID);
		define("error", args -> {
			atLeast("error", args, 1);
			String message = SchemeValues.display(args.get(0));
			SchemeError error = new SchemeError(message);
			if (args.size() > 1) {
				error.withDetail("irritants", args.subList(1, args.size()).stream()
						.map(SchemeValues::write)
						.collect(Collectors.joining(" ")));
			}
			throw error;
		});
	}

	// argument checking

	private void predicate(String name, Predicate<Object> test) {
		define(name, args -> {
			exactly(name, args, 1);
			return test.test(args.get(0));
		});
	}

	private static void exactly(String name, List<Object> args, int count) {
		if (args.size() != count) {
			throw new SchemeError(name + ": expected " + count + " argument(s), got " + args.size())
					.withDetail("procedure", name);
		}
	}

	private static void atLeast(String name, List<Object> args, int count) {
		if (args.size() < count) {
			throw new SchemeError(name + ": expected at least " + count + " argument(s), got " + args.size())
					.withDetail("procedure", name);
		}
	}

	private static SchemeError typeError(String name, String expected, Object actual) {
		return new SchemeError(name + ": expected " + expected)
				.withDetail("argument", SchemeValues.write(actual));
	}

	private static Number number(String name, Object value) {
		if (value instanceof Long || value instanceof Double) {
			return (Number) value;
		}
		throw typeError(name, "number", value);
	}

	private static long integer(String name, Object value) {
		if (value instanceof Long l) {
			return l;
		}
		throw typeError(name, "integer", value);
	}

	private static long nonZero(String name, long value) {
		if (value == 0) {
			throw new SchemeError(name + ": division by zero");
		}
		return value;
	}

	private static String string(String name, Object value) {
		if (value instanceof String s) {
			return s;
		}
		throw typeError(name, "string", value);
	}

	@SuppressWarnings("unchecked")
	private static List<Object> list(String name, Object value) {
		if (value instanceof List<?>) {
			return (List<Object>) value;
		}
		throw typeError(name, "list", value);
	}

	private static List<Object> nonEmpty(String name, Object value) {
		List<Object> list = list(name, value);
		if (list.isEmpty()) {
			throw typeError(name, "pair", value);
		}
		return list;
	}

	private static Procedure procedure(String name, Object value) {
		if (value instanceof Procedure p) {
			return p;
		}
		throw typeError(name, "procedure", value);
	}

	// numeric helpers

	private static Object fold(String name, List<Object> args, long identity, BinaryOperator<Long> exact,
			BinaryOperator<Double> inexact) {
		Object result = identity;
		for (Object arg : args) {
			result = combine(name, result, arg, exact, inexact);
		}
		return result;
	}

	private static Object combine(String name, Object left, Object right, BinaryOperator<Long> exact,
			BinaryOperator<Double> inexact) {
		Number a = number(name, left);
		Number b = number(name, right);
		if (a instanceof Long x && b instanceof Long y) {
			try {
				return exact.apply(x, y);
			} catch (ArithmeticException e) {
				return inexact.apply(x.doubleValue(), y.doubleValue());
			}
		}
		return inexact.apply(a.doubleValue(), b.doubleValue());
	}

	private static Object divide(Object left, Object right) {
		Number a = number("/", left);
		Number b = number("/", right);
		if (a instanceof Long x && b instanceof Long y) {
			if (y == 0) {
				throw new SchemeError("/: division by zero");
			}
			return x % y == 0 ? (Object) (x / y) : (Object) (x.doubleValue() / y);
		}
		return a.doubleValue() / b.doubleValue();
	}

	private static int compare(String name, Object left, Object right) {
		Number a = number(name, left);
		Number b = number(name, right);
		if (a instanceof Long x && b instanceof Long y) {
			return Long.compare(x, y);
		}
		return Double.compare(a.doubleValue(), b.doubleValue());
	}

	private static Object compareChain(String name, List<Object> args, IntPredicate accept) {
		atLeast(name, args, 1);
		for (int i = 0; i + 1 < args.size(); i++) {
			if (!accept.test(compare(name, args.get(i), args.get(i + 1)))) {
				return Boolean.FALSE;
			}
		}
		number(name, args.get(args.size() - 1));
		return Boolean.TRUE;
	}

	private static Object extreme(String name, List<Object> args, int sign) {
		atLeast(name, args, 1);
		Object best = number(name, args.get(0));
		boolean inexact = best instanceof Double;
		for (Object arg : args.subList(1, args.size())) {
			inexact |= arg instanceof Double;
			if (compare(name, arg, best) * sign > 0) {
				best = arg;
			}
		}
		return inexact ? (Object) ((Number) best).doubleValue() : best;
	}

	// equivalence and search

	static boolean isEqv(Object a, Object b) {
		if (a == b) {
			return true;
		}
		if (a instanceof List<?> l && b instanceof List<?> m) {
			return l.isEmpty() && m.isEmpty();
		}
		if (a instanceof Procedure || a instanceof String) {
			return false;
		}
		return Objects.equals(a, b);
	}

	private static Object member(String name, List<Object> args, BiPredicate<Object, Object> same) {
		exactly(name, args, 2);
		List<Object> list = list(name, args.get(1));
		for (int i = 0; i < list.size(); i++) {
			if (same.test(args.get(0), list.get(i))) {
				return list.subList(i, list.size());
			}
		}
		return Boolean.FALSE;
	}

	private static Object assoc(String name, List<Object> args, BiPredicate<Object, Object> same) {
		exactly(name, args, 2);
		for (Object entry : list(name, args.get(1))) {
			List<Object> pair = nonEmpty(name, entry);
			if (same.test(args.get(0), pair.get(0))) {
				return pair;
			}
		}
		return Boolean.FALSE;
	}
}
