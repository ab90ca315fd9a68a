package org.javai.dygram.condition;

import java.util.ArrayList;
import java.util.List;
import org.javai.dygram.condition.ConditionToken.Type;

/**
 * Tokenizer for guard expressions.
 */
class ConditionTokenizer {

	private final String input;
	private int pos = 0;

	ConditionTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	List<ConditionToken> tokenize() {
		List<ConditionToken> tokens = new ArrayList<>();
		while (true) {
			while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
				pos++;
			}
			if (pos >= input.length()) {
				break;
			}
			tokens.add(nextToken());
		}
		tokens.add(new ConditionToken(Type.EOF, "", pos));
		return tokens;
	}

	private ConditionToken nextToken() {
		int start = pos;
		char c = input.charAt(pos);
		return switch (c) {
			case '(' -> single(Type.LPAREN, start);
			case ')' -> single(Type.RPAREN, start);
			case '.' -> single(Type.DOT, start);
			case '"', '\'' -> scanString(c);
			case '&' -> pair("&&", Type.AND, start);
			case '|' -> pair("||", Type.OR, start);
			case '=' -> pair("==", Type.EQ, start);
			case '!' -> input.startsWith("!=", pos) ? pair("!=", Type.NE, start) : single(Type.NOT, start);
			case '<' -> input.startsWith("<=", pos) ? pair("<=", Type.LE, start) : single(Type.LT, start);
			case '>' -> input.startsWith(">=", pos) ? pair(">=", Type.GE, start) : single(Type.GT, start);
			default -> {
				if (Character.isDigit(c) || (c == '-' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
					yield scanNumber();
				}
				if (Character.isLetter(c) || c == '_') {
					yield scanIdentifier();
				}
				throw new ConditionException("Unexpected character '" + c + "' at position " + pos);
			}
		};
	}

	private ConditionToken single(Type type, int start) {
		pos++;
		return new ConditionToken(type, input.substring(start, pos), start);
	}

	private ConditionToken pair(String symbol, Type type, int start) {
		if (!input.startsWith(symbol, pos)) {
			throw new ConditionException("Expected '" + symbol + "' at position " + pos);
		}
		pos += symbol.length();
		return new ConditionToken(type, symbol, start);
	}

	private ConditionToken scanString(char quote) {
		int start = pos;
		pos++;
		StringBuilder sb = new StringBuilder();
		while (pos < input.length() && input.charAt(pos) != quote) {
			char c = input.charAt(pos++);
			if (c == '\\' && pos < input.length()) {
				sb.append(input.charAt(pos++));
			} else {
				sb.append(c);
			}
		}
		if (pos >= input.length()) {
			throw new ConditionException("Unterminated string starting at position " + start);
		}
		pos++;
		return new ConditionToken(Type.STRING, sb.toString(), start);
	}

	private ConditionToken scanNumber() {
		int start = pos;
		if (input.charAt(pos) == '-') {
			pos++;
		}
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos++;
		}
		if (pos + 1 < input.length() && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))) {
			pos++;
			while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
				pos++;
			}
		}
		return new ConditionToken(Type.NUMBER, input.substring(start, pos), start);
	}

	private ConditionToken scanIdentifier() {
		int start = pos;
		while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
			pos++;
		}
		return new ConditionToken(Type.IDENTIFIER, input.substring(start, pos), start);
	}
}
