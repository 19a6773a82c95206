package org.javai.schemeload.sexpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent s-expression parser.
 * <p>
 * Converts the tokens produced by {@link SExprTokenizer} into {@link SExpr} trees. Quote sugar is
 * expanded into explicit {@code quote}, {@code quasiquote}, {@code unquote} and
 * {@code unquote-splicing} lists, {@code #( ... )} becomes an ordinary list and a bare {@code .}
 * is kept as a list item. Any syntax error is fatal; no partial result is returned.
 */
public class SExprParser {

	private static final String FOLD_CASE = "#!fold-case";
	private static final String NO_FOLD_CASE = "#!no-fold-case";

	private final List<SExprToken> tokens;
	private int current = 0;
	private boolean foldCase;

	public SExprParser(List<SExprToken> tokens) {
		this(tokens, false);
	}

	/**
	 * @param tokens the tokens to parse
	 * @param foldCase whether symbol atoms are lower-cased; {@code #!fold-case} and
	 * {@code #!no-fold-case} directives in the text switch this for the rest of the input
	 */
	public SExprParser(List<SExprToken> tokens, boolean foldCase) {
		this.tokens = tokens != null ? tokens : List.of();
		this.foldCase = foldCase;
	}

	/**
	 * Parses the tokens into a list of top-level nodes.
	 *
	 * @return list of parsed nodes (may be empty)
	 * @throws SExprParseException if syntax errors are encountered
	 */
	public List<SExpr> parse() {
		List<SExpr> nodes = new ArrayList<>();

		while (!isAtEnd()) {
			if (check(SExprToken.TokenType.DIRECTIVE)) {
				applyDirective(advance());
				continue;
			}
			nodes.add(parseExpression());
		}

		return nodes;
	}

	private SExpr parseExpression() {
		SExprToken token = peek();

		return switch (token.type()) {
			case LPAREN, VECTOR_OPEN -> parseList();
			case ATOM -> {
				advance();
				yield SExpr.atom(fold(token.value()));
			}
			case STRING -> {
				advance();
				yield SExpr.atom('"' + token.value() + '"');
			}
			case QUOTE -> parseSugar("quote");
			case QUASIQUOTE -> parseSugar("quasiquote");
			case UNQUOTE -> parseSugar("unquote");
			case UNQUOTE_SPLICING -> parseSugar("unquote-splicing");
			case DIRECTIVE -> {
				applyDirective(advance());
				if (isAtEnd()) {
					throw new SExprParseException("Unexpected end of input after " + token.value()
							+ " at " + token.location(), token.position());
				}
				yield parseExpression();
			}
			case RPAREN -> throw new SExprParseException(
					"Unexpected ')' at " + token.location() + ": no matching opening parenthesis", token.position());
			case EOF -> throw new SExprParseException(
					"Unexpected end of input at " + token.location(), token.position());
		};
	}

	private SExpr parseSugar(String symbol) {
		SExprToken prefix = advance();
		if (isAtEnd()) {
			throw new SExprParseException("Unexpected end of input after '" + prefix.value()
					+ "' at " + prefix.location(), prefix.position());
		}
		if (check(SExprToken.TokenType.RPAREN)) {
			throw new SExprParseException("Expected an expression after '" + prefix.value()
					+ "' at " + prefix.location() + ", found ')'", prefix.position());
		}
		return SExpr.list(SExpr.atom(symbol), parseExpression());
	}

	private SExpr parseList() {
		SExprToken open = advance(); // consume '(' or '#('

		List<SExpr> items = new ArrayList<>();
		while (!check(SExprToken.TokenType.RPAREN)) {
			if (isAtEnd()) {
				throw new SExprParseException(
						"Unmatched '" + open.value() + "' at " + open.location() + ": reached end of input",
						open.position());
			}
			if (check(SExprToken.TokenType.DIRECTIVE)) {
				applyDirective(advance());
				continue;
			}
			items.add(parseExpression());
		}

		advance(); // consume ')'
		return SExpr.list(items);
	}

	private void applyDirective(SExprToken directive) {
		String name = directive.value().toLowerCase(Locale.ROOT);
		if (FOLD_CASE.equals(name)) {
			foldCase = true;
		} else if (NO_FOLD_CASE.equals(name)) {
			foldCase = false;
		}
		// other directives (#!r6rs, #!eof ...) carry nothing the evaluator needs
	}

	private String fold(String atom) {
		if (!foldCase || atom.startsWith("#\\")) {
			return atom;
		}
		return atom.toLowerCase(Locale.ROOT);
	}

	private SExprToken peek() {
		return tokens.get(current);
	}

	private SExprToken advance() {
		if (!isAtEnd()) {
			current++;
		}
		return tokens.get(current - 1);
	}

	private boolean check(SExprToken.TokenType type) {
		if (isAtEnd()) return false;
		return peek().type() == type;
	}

	private boolean isAtEnd() {
		return current >= tokens.size() || peek().type() == SExprToken.TokenType.EOF;
	}
}
