package org.javai.dygram.parse;

import org.javai.dygram.diagnostics.SourcePosition;

/**
 * Token produced by {@link DygramTokenizer}.
 *
 * @param type token type
 * @param text token text; for strings the unescaped content without quotes
 * @param line 1-based line
 * @param column 1-based column
 */
public record DygramToken(TokenType type, String text, int line, int column) {

	public enum TokenType {
		IDENTIFIER,
		STRING,
		NUMBER,
		/** One of {@code -> --> => <--> <|-- *--> o-->}. */
		ARROW,
		DASH,
		DOUBLE_DASH,
		EQUALS,
		LBRACE,
		RBRACE,
		LBRACKET,
		RBRACKET,
		LPAREN,
		RPAREN,
		LT,
		GT,
		COLON,
		SEMICOLON,
		COMMA,
		DOT,
		AT,
		EOF
	}

	public SourcePosition position() {
		return new SourcePosition(line, column);
	}

	public boolean isArrow(String symbol) {
		return type == TokenType.ARROW && text.equals(symbol);
	}

	@Override
	public String toString() {
		return type + "('" + text + "')@" + line + ":" + column;
	}
}
