package org.javai.schemeload.sexpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for script text.
 * Converts the whole input into a list of tokens in a single pass, skipping whitespace,
 * {@code ;} line comments and nested {@code #| ... |#} block comments.
 */
public class SExprTokenizer {

	private final String input;
	private int pos = 0;
	private int line = 1;

	public SExprTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws SExprParseException if invalid syntax is encountered
	 */
	public List<SExprToken> tokenize() {
		List<SExprToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new SExprToken(SExprToken.TokenType.EOF, "", pos, line));
		return tokens;
	}

	private SExprToken nextToken() {
		int start = pos;
		int startLine = line;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new SExprToken(SExprToken.TokenType.LPAREN, "(", start, startLine);
			}
			case ')' -> {
				advance();
				yield new SExprToken(SExprToken.TokenType.RPAREN, ")", start, startLine);
			}
			case '\'' -> {
				advance();
				yield new SExprToken(SExprToken.TokenType.QUOTE, "'", start, startLine);
			}
			case '`' -> {
				advance();
				yield new SExprToken(SExprToken.TokenType.QUASIQUOTE, "`", start, startLine);
			}
			case ',' -> {
				advance();
				if (peek() == '@') {
					advance();
					yield new SExprToken(SExprToken.TokenType.UNQUOTE_SPLICING, ",@", start, startLine);
				}
				yield new SExprToken(SExprToken.TokenType.UNQUOTE, ",", start, startLine);
			}
			case '"' -> scanString();
			case '#' -> scanHash();
			default -> scanAtom();
		};
	}

	private SExprToken scanString() {
		int start = pos;
		int startLine = line;
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new SExprParseException("Unterminated string starting at position " + start + " (line " + startLine + ")", start);
		}

		advance(); // consume closing "
		return new SExprToken(SExprToken.TokenType.STRING, sb.toString(), start, startLine);
	}

	private SExprToken scanHash() {
		int start = pos;
		int startLine = line;
		advance(); // consume #

		if (isAtEnd()) {
			return new SExprToken(SExprToken.TokenType.ATOM, "#", start, startLine);
		}

		char c = peek();
		if (c == '(') {
			advance();
			return new SExprToken(SExprToken.TokenType.VECTOR_OPEN, "#(", start, startLine);
		}
		if (c == '\\') {
			advance();
			if (isAtEnd()) {
				throw new SExprParseException("Unexpected end of input in character literal at position " + start, start);
			}
			// the first character is always part of the literal, even when it is a delimiter: #\( #\space
			advance();
			scanToDelimiter();
			return new SExprToken(SExprToken.TokenType.ATOM, input.substring(start, pos), start, startLine);
		}
		if (c == '!') {
			scanToDelimiter();
			return new SExprToken(SExprToken.TokenType.DIRECTIVE, input.substring(start, pos), start, startLine);
		}

		scanToDelimiter();
		return new SExprToken(SExprToken.TokenType.ATOM, input.substring(start, pos), start, startLine);
	}

	private SExprToken scanAtom() {
		int start = pos;
		int startLine = line;
		scanToDelimiter();
		return new SExprToken(SExprToken.TokenType.ATOM, input.substring(start, pos), start, startLine);
	}

	private void scanToDelimiter() {
		while (!isAtEnd() && !isDelimiter(peek())) {
			advance();
		}
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (Character.isWhitespace(c)) {
				advance();
			} else if (c == ';') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else if (c == '#' && peekNext() == '|') {
				skipBlockComment();
			} else {
				break;
			}
		}
	}

	private void skipBlockComment() {
		int start = pos;
		pos += 2;
		int depth = 1;
		while (depth > 0) {
			if (isAtEnd()) {
				throw new SExprParseException("Unterminated block comment starting at position " + start, start);
			}
			if (peek() == '#' && peekNext() == '|') {
				depth++;
				pos += 2;
			} else if (peek() == '|' && peekNext() == '#') {
				depth--;
				pos += 2;
			} else {
				advance();
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	static boolean isDelimiter(char c) {
		return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';'
				|| c == '\'' || c == '`' || c == ',';
	}
}
