package org.javai.schemeload.sexpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of a parsed script: either an atom or a list.
 * <p>
 * An atom carries its raw text. String literals keep their surrounding {@code "} delimiters so that
 * {@code "foo"} and the symbol {@code foo} stay distinguishable; numbers, booleans and character
 * literals are kept verbatim. A list carries its items in order. Dotted tails and vector literals
 * are read as ordinary lists.
 */
public record SExpr(String atom, List<SExpr> items) {

	private static final SExpr EMPTY = new SExpr(null, List.of());

	public SExpr {
		if ((atom == null) == (items == null)) {
			throw new IllegalArgumentException("SExpr must be either an atom or a list");
		}
		items = items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : null;
	}

	/**
	 * Creates an atom node.
	 */
	public static SExpr atom(String text) {
		return new SExpr(text, null);
	}

	/**
	 * Creates a list node.
	 */
	public static SExpr list(List<SExpr> items) {
		return items.isEmpty() ? EMPTY : new SExpr(null, items);
	}

	public static SExpr list(SExpr... items) {
		return list(List.of(items));
	}

	/**
	 * Creates a list whose head is the atom {@code symbol}.
	 */
	public static SExpr form(String symbol, List<SExpr> rest) {
		List<SExpr> all = new ArrayList<>(rest.size() + 1);
		all.add(atom(symbol));
		all.addAll(rest);
		return list(all);
	}

	public static SExpr form(String symbol, SExpr... rest) {
		return form(symbol, List.of(rest));
	}

	public static SExpr empty() {
		return EMPTY;
	}

	public boolean isAtom() {
		return atom != null;
	}

	public boolean isList() {
		return items != null;
	}

	public boolean isEmptyList() {
		return items != null && items.isEmpty();
	}

	/**
	 * True for atoms written as {@code "..."} string literals.
	 */
	public boolean isStringLiteral() {
		return atom != null && atom.length() >= 2 && atom.charAt(0) == '"' && atom.charAt(atom.length() - 1) == '"';
	}

	/**
	 * True for atoms that can name something: not a string literal and not a {@code #} literal.
	 */
	public boolean isSymbol() {
		return atom != null && !atom.isEmpty() && !isStringLiteral() && atom.charAt(0) != '#';
	}

	/**
	 * True when this is the symbol {@code name}.
	 */
	public boolean isSymbol(String name) {
		return isSymbol() && atom.equals(name);
	}

	/**
	 * The content of a string literal without its delimiters.
	 */
	public String stringValue() {
		if (!isStringLiteral()) {
			throw new IllegalStateException("Not a string literal: " + atom);
		}
		return atom.substring(1, atom.length() - 1);
	}

	public int size() {
		return items != null ? items.size() : 0;
	}

	public SExpr get(int index) {
		if (items == null) {
			throw new IllegalStateException("Atom has no items: " + atom);
		}
		return items.get(index);
	}

	/**
	 * Items from {@code from} to the end of this list.
	 */
	public List<SExpr> tail(int from) {
		if (items == null) {
			throw new IllegalStateException("Atom has no items: " + atom);
		}
		return from >= items.size() ? List.of() : items.subList(from, items.size());
	}

	/**
	 * The operator name of a list whose first item is a symbol.
	 */
	public Optional<String> operator() {
		if (items == null || items.isEmpty() || !items.get(0).isSymbol()) {
			return Optional.empty();
		}
		return Optional.of(items.get(0).atom());
	}

	/**
	 * Accepts a visitor and dispatches on the node kind.
	 */
	public <R> R accept(SExprVisitor<R> visitor) {
		if (isAtom()) {
			return visitor.visitAtom(atom);
		}
		return visitor.visitList(items);
	}

	@Override
	public String toString() {
		return SExprPrinter.printCompact(this);
	}
}
