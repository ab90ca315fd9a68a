package org.javai.dygram.parse;

import java.util.ArrayList;
import java.util.List;
import org.javai.dygram.diagnostics.SourcePosition;
import org.javai.dygram.parse.DygramToken.TokenType;

/**
 * Tokenizer for DyGram source text. Lexical errors are collected rather than thrown so
 * that a single pass reports every problem in a file.
 */
public class DygramTokenizer {

	private static final String[] ARROWS = {"<|--", "<-->", "*-->", "-->", "->", "=>"};

	private final String input;
	private final List<DygramParseException> errors = new ArrayList<>();
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public DygramTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens, always terminated by an EOF token
	 */
	public List<DygramToken> tokenize() {
		List<DygramToken> tokens = new ArrayList<>();
		while (true) {
			skipWhitespaceAndComments();
			if (isAtEnd()) {
				break;
			}
			DygramToken token = nextToken(tokens.isEmpty() ? null : tokens.get(tokens.size() - 1));
			if (token != null) {
				tokens.add(token);
			}
		}
		tokens.add(new DygramToken(TokenType.EOF, "", line, column));
		return tokens;
	}

	public List<DygramParseException> errors() {
		return List.copyOf(errors);
	}

	private DygramToken nextToken(DygramToken previous) {
		int startLine = line;
		int startColumn = column;
		char c = peek();

		for (String arrow : ARROWS) {
			if (input.startsWith(arrow, pos)) {
				advanceBy(arrow.length());
				return new DygramToken(TokenType.ARROW, arrow, startLine, startColumn);
			}
		}

		return switch (c) {
			case '{' -> single(TokenType.LBRACE, startLine, startColumn);
			case '}' -> single(TokenType.RBRACE, startLine, startColumn);
			case '[' -> single(TokenType.LBRACKET, startLine, startColumn);
			case ']' -> single(TokenType.RBRACKET, startLine, startColumn);
			case '(' -> single(TokenType.LPAREN, startLine, startColumn);
			case ')' -> single(TokenType.RPAREN, startLine, startColumn);
			case '<' -> single(TokenType.LT, startLine, startColumn);
			case '>' -> single(TokenType.GT, startLine, startColumn);
			case ':' -> single(TokenType.COLON, startLine, startColumn);
			case ';' -> single(TokenType.SEMICOLON, startLine, startColumn);
			case ',' -> single(TokenType.COMMA, startLine, startColumn);
			case '.' -> single(TokenType.DOT, startLine, startColumn);
			case '@' -> single(TokenType.AT, startLine, startColumn);
			case '=' -> single(TokenType.EQUALS, startLine, startColumn);
			case '"', '\'' -> scanString(c, startLine, startColumn);
			case '-' -> {
				if (isNumberContext(previous) && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
					yield scanNumber(startLine, startColumn);
				}
				if (input.startsWith("--", pos)) {
					advanceBy(2);
					yield new DygramToken(TokenType.DOUBLE_DASH, "--", startLine, startColumn);
				}
				yield single(TokenType.DASH, startLine, startColumn);
			}
			default -> {
				if (isDigit(c)) {
					yield scanNumber(startLine, startColumn);
				}
				if (isIdentifierStart(c)) {
					yield scanIdentifier(startLine, startColumn);
				}
				errors.add(new DygramParseException("Unexpected character '" + c + "'",
						new SourcePosition(startLine, startColumn)));
				advance();
				yield null;
			}
		};
	}

	private boolean isNumberContext(DygramToken previous) {
		if (previous == null) {
			return false;
		}
		return previous.type() == TokenType.COLON
				|| previous.type() == TokenType.LBRACKET
				|| previous.type() == TokenType.COMMA;
	}

	private DygramToken single(TokenType type, int startLine, int startColumn) {
		char c = advance();
		return new DygramToken(type, String.valueOf(c), startLine, startColumn);
	}

	private DygramToken scanString(char quote, int startLine, int startColumn) {
		advance(); // opening quote
		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != quote) {
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
			errors.add(new DygramParseException("Unterminated string literal",
					new SourcePosition(startLine, startColumn)));
		} else {
			advance(); // closing quote
		}
		return new DygramToken(TokenType.STRING, sb.toString(), startLine, startColumn);
	}

	private DygramToken scanNumber(int startLine, int startColumn) {
		int start = pos;
		if (peek() == '-') {
			advance();
		}
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
			advance();
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}
		return new DygramToken(TokenType.NUMBER, input.substring(start, pos), startLine, startColumn);
	}

	private DygramToken scanIdentifier(int startLine, int startColumn) {
		int start = pos;
		while (!isAtEnd() && isIdentifierPart(peek())) {
			advance();
		}
		String text = input.substring(start, pos);
		if (text.equals("o") && input.startsWith("-->", pos)) {
			advanceBy(3);
			return new DygramToken(TokenType.ARROW, "o-->", startLine, startColumn);
		}
		return new DygramToken(TokenType.IDENTIFIER, text, startLine, startColumn);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (Character.isWhitespace(c)) {
				advance();
			} else if (input.startsWith("//", pos)) {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else if (input.startsWith("/*", pos)) {
				int startLine = line;
				int startColumn = column;
				advanceBy(2);
				while (!isAtEnd() && !input.startsWith("*/", pos)) {
					advance();
				}
				if (isAtEnd()) {
					errors.add(new DygramParseException("Unterminated block comment",
							new SourcePosition(startLine, startColumn)));
				} else {
					advanceBy(2);
				}
			} else {
				return;
			}
		}
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private char peek() {
		return input.charAt(pos);
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private void advanceBy(int count) {
		for (int i = 0; i < count && !isAtEnd(); i++) {
			advance();
		}
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}
}
