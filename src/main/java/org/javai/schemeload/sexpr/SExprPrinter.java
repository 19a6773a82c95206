package org.javai.schemeload.sexpr;

import java.util.List;

/**
 * Prints {@link SExpr} trees back to script text.
 * <p>
 * The compact form is what gets submitted to an evaluator: one line, items separated by single
 * spaces. Reading the output again yields an equivalent tree, and printing that tree yields the
 * same text. The pretty form indents nested lists and is meant for humans.
 */
public class SExprPrinter implements SExprVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private int indentLevel = 0;
	private final boolean pretty;
	private final int indentSize;

	public SExprPrinter() {
		this(true, 2);
	}

	public SExprPrinter(boolean pretty, int indentSize) {
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	@Override
	public Void visitList(List<SExpr> items) {
		output.append('(');
		if (items.isEmpty()) {
			output.append(')');
			return null;
		}

		items.get(0).accept(this);
		if (pretty && items.stream().anyMatch(SExpr::isList)) {
			indentLevel++;
			for (SExpr item : items.subList(1, items.size())) {
				output.append('\n');
				indent();
				item.accept(this);
			}
			indentLevel--;
		} else {
			for (SExpr item : items.subList(1, items.size())) {
				output.append(' ');
				item.accept(this);
			}
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitAtom(String text) {
		output.append(atomText(text));
		return null;
	}

	/**
	 * Text for one atom: string literals are re-escaped, atoms that would not read back as a single
	 * atom are written as string literals, everything else is written verbatim.
	 */
	static String atomText(String text) {
		if (text.length() >= 2 && text.charAt(0) == '"' && text.charAt(text.length() - 1) == '"') {
			return '"' + escapeString(text.substring(1, text.length() - 1)) + '"';
		}
		if (text.startsWith("#\\") && text.length() > 2) {
			return text;
		}
		if (needsQuoting(text)) {
			return '"' + escapeString(text) + '"';
		}
		return text;
	}

	private static boolean needsQuoting(String text) {
		if (text.isEmpty()) {
			return true;
		}
		for (int i = 0; i < text.length(); i++) {
			if (SExprTokenizer.isDelimiter(text.charAt(i))) {
				return true;
			}
		}
		return false;
	}

	static String escapeString(String value) {
		return value.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\t", "\\t")
				.replace("\r", "\\r");
	}

	private void indent() {
		if (pretty) {
			output.append(" ".repeat(indentLevel * indentSize));
		}
	}

	/**
	 * Returns the printed output.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Pretty-prints a node over several indented lines.
	 */
	public static String print(SExpr node) {
		SExprPrinter printer = new SExprPrinter();
		node.accept(printer);
		return printer.toString();
	}

	/**
	 * Prints a node on a single line.
	 */
	public static String printCompact(SExpr node) {
		SExprPrinter printer = new SExprPrinter(false, 0);
		node.accept(printer);
		return printer.toString();
	}

	/**
	 * Prints each node on its own line.
	 */
	public static String printAll(List<SExpr> nodes) {
		StringBuilder sb = new StringBuilder();
		for (SExpr node : nodes) {
			sb.append(printCompact(node)).append('\n');
		}
		return sb.toString();
	}
}
