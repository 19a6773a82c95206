package org.javai.schemeload.sexpr;

import java.util.List;

/**
 * Entry point for reading script text into forms.
 */
public final class SExprReader {

	private SExprReader() {
	}

	/**
	 * Reads every top-level form of {@code text}.
	 *
	 * @throws SExprParseException if the text is malformed anywhere; no forms are returned then
	 */
	public static List<SExpr> parseAll(String text) {
		return parseAll(text, false);
	}

	/**
	 * Reads every top-level form of {@code text}, lower-casing symbols when {@code foldCase} is set.
	 */
	public static List<SExpr> parseAll(String text, boolean foldCase) {
		List<SExprToken> tokens = new SExprTokenizer(text).tokenize();
		return new SExprParser(tokens, foldCase).parse();
	}

	/**
	 * Reads exactly one form.
	 *
	 * @throws SExprParseException if the text is malformed or does not hold exactly one form
	 */
	public static SExpr parseOne(String text) {
		List<SExpr> forms = parseAll(text);
		if (forms.size() != 1) {
			throw new SExprParseException("Expected exactly one form but found " + forms.size(), 0);
		}
		return forms.get(0);
	}
}
