package org.javai.schemeload.sexpr;

/**
 * A token of script text.
 *
 * @param type the token type
 * @param value the token text; decoded content for strings, raw text otherwise
 * @param position the character position in the input
 * @param line the 1-based line of the token
 */
public record SExprToken(TokenType type, String value, int position, int line) {

	public enum TokenType {
		LPAREN,            // (
		VECTOR_OPEN,       // #(
		RPAREN,            // )
		QUOTE,             // '
		QUASIQUOTE,        // `
		UNQUOTE,           // ,
		UNQUOTE_SPLICING,  // ,@
		STRING,            // "..."
		ATOM,              // symbols, numbers, #t, #\a ...
		DIRECTIVE,         // #!fold-case
		EOF
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case ATOM, DIRECTIVE -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Human readable location used in parse error messages.
	 */
	public String location() {
		return "position " + position + " (line " + line + ")";
	}
}
