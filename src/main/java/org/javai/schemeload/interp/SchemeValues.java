package org.javai.schemeload.interp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.javai.schemeload.sexpr.SExpr;

/**
 * Conversions between read syntax and runtime values.
 * <p>
 * Runtime values are plain Java objects: {@link Long} and {@link Double} numbers, {@link Boolean},
 * {@link Character}, {@link String}, {@link Symbol}, immutable {@link List}s for proper lists,
 * {@link Procedure}s and {@link Unspecified} markers.
 */
public final class SchemeValues {

	private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
	private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

	private static final Map<String, Character> CHAR_NAMES = Map.of(
			"space", ' ',
			"newline", '\n',
			"tab", '\t',
			"return", '\r',
			"nul", '\0',
			"null", '\0');

	private SchemeValues() {
	}

	/**
	 * The value of a quoted datum.
	 */
	public static Object fromDatum(SExpr datum) {
		if (datum.isList()) {
			List<Object> values = new ArrayList<>(datum.size());
			for (SExpr item : datum.items()) {
				values.add(fromDatum(item));
			}
			return List.copyOf(values);
		}
		return parseAtom(datum);
	}

	/**
	 * The value of a self-evaluating atom, or a {@link Symbol} for anything that names something.
	 */
	static Object parseAtom(SExpr atom) {
		if (atom.isStringLiteral()) {
			return atom.stringValue();
		}
		String text = atom.atom();
		switch (text) {
			case "#t", "#true":
				return Boolean.TRUE;
			case "#f", "#false":
				return Boolean.FALSE;
			default:
				break;
		}
		if (text.startsWith("#\\")) {
			return parseCharacter(text);
		}
		if (INTEGER.matcher(text).matches()) {
			try {
				return Long.parseLong(text);
			} catch (NumberFormatException e) {
				return Double.parseDouble(text);
			}
		}
		if (DECIMAL.matcher(text).matches()) {
			return Double.parseDouble(text);
		}
		if (text.startsWith("#")) {
			throw new SchemeError("unsupported literal: " + text).withDetail("literal", text);
		}
		return new Symbol(text);
	}

	private static Character parseCharacter(String text) {
		String name = text.substring(2);
		if (name.length() == 1) {
			return name.charAt(0);
		}
		Character named = CHAR_NAMES.get(name.toLowerCase());
		if (named != null) {
			return named;
		}
		if (name.length() > 1 && (name.charAt(0) == 'x' || name.charAt(0) == 'X')) {
			try {
				return (char) Integer.parseInt(name.substring(1), 16);
			} catch (NumberFormatException e) {
				throw new SchemeError("bad character literal: " + text, e);
			}
		}
		throw new SchemeError("unknown character name: " + text).withDetail("literal", text);
	}

	/**
	 * Everything except {@code #f} counts as true.
	 */
	public static boolean isTrue(Object value) {
		return !Boolean.FALSE.equals(value);
	}

	/**
	 * External representation as produced by {@code display}: strings and characters unquoted.
	 */
	public static String display(Object value) {
		StringBuilder out = new StringBuilder();
		print(value, false, out);
		return out.toString();
	}

	/**
	 * External representation as produced by {@code write}.
	 */
	public static String write(Object value) {
		StringBuilder out = new StringBuilder();
		print(value, true, out);
		return out.toString();
	}

	private static void print(Object value, boolean machine, StringBuilder out) {
		if (value instanceof Boolean b) {
			out.append(b ? "#t" : "#f");
		} else if (value instanceof String s) {
			if (machine) {
				writeString(s, out);
			} else {
				out.append(s);
			}
		} else if (value instanceof Character c) {
			if (machine) {
				out.append("#\\").append(characterName(c));
			} else {
				out.append(c.charValue());
			}
		} else if (value instanceof List<?> list) {
			out.append('(');
			for (int i = 0; i < list.size(); i++) {
				if (i > 0) {
					out.append(' ');
				}
				print(list.get(i), machine, out);
			}
			out.append(')');
		} else if (value instanceof Closure closure) {
			out.append("#<procedure ").append(closure.name()).append('>');
		} else if (value instanceof Procedure) {
			out.append("#<procedure>");
		} else {
			out.append(value);
		}
	}

	private static String characterName(char c) {
		for (Map.Entry<String, Character> entry : CHAR_NAMES.entrySet()) {
			if (entry.getValue() == c && !entry.getKey().equals("null")) {
				return entry.getKey();
			}
		}
		return String.valueOf(c);
	}

	private static void writeString(String s, StringBuilder out) {
		out.append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"' -> out.append("\\\"");
				case '\\' -> out.append("\\\\");
				case '\n' -> out.append("\\n");
				case '\t' -> out.append("\\t");
				case '\r' -> out.append("\\r");
				default -> out.append(c);
			}
		}
		out.append('"');
	}
}
