package org.javai.dygram.condition;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;
import org.javai.dygram.condition.ConditionExpression.Operator;
import org.javai.dygram.condition.ConditionToken.Type;

/**
 * Parses guard expressions.
 * <pre>
 * or         := and ('||' and)*
 * and        := equality ('&amp;&amp;' equality)*
 * equality   := comparison (('==' | '!=') comparison)*
 * comparison := unary (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') unary)*
 * unary      := '!' unary | primary
 * primary    := NUMBER | STRING | true | false | null | path | '(' or ')'
 * </pre>
 */
public final class ConditionParser {

	private static final Pattern TEMPLATE = Pattern.compile("\\{\\{\\s*([^}]*?)\\s*}}");
	static final int MAX_DEPTH = 64;

	private final List<ConditionToken> tokens;
	private int current = 0;
	private int depth = 0;

	private ConditionParser(List<ConditionToken> tokens) {
		this.tokens = tokens;
	}

	/**
	 * Normalizes and parses an expression.
	 *
	 * @throws ConditionException when the expression is malformed
	 */
	public static ConditionExpression parse(String expression) {
		String normalized = normalize(expression);
		if (normalized.isEmpty()) {
			throw new ConditionException("Empty condition");
		}
		ConditionParser parser = new ConditionParser(new ConditionTokenizer(normalized).tokenize());
		ConditionExpression result = parser.or();
		if (parser.peek().type() != Type.EOF) {
			throw new ConditionException("Unexpected '" + parser.peek().text() + "' at position " + parser.peek().position());
		}
		return result;
	}

	/**
	 * Rewrites legacy syntax: {@code {{ a.b }}} becomes {@code a.b}, {@code ===} and
	 * {@code !==} become {@code ==} and {@code !=}, and one level of wrapping quotes is removed.
	 */
	public static String normalize(String expression) {
		if (expression == null) {
			return "";
		}
		String result = expression.trim();
		if (result.length() >= 2) {
			char first = result.charAt(0);
			char last = result.charAt(result.length() - 1);
			if ((first == '\'' || first == '"') && first == last && result.indexOf(first, 1) == result.length() - 1) {
				result = result.substring(1, result.length() - 1).trim();
			}
		}
		result = TEMPLATE.matcher(result).replaceAll("$1");
		return result.replace("===", "==").replace("!==", "!=");
	}

	private ConditionExpression or() {
		ConditionExpression left = and();
		while (match(Type.OR)) {
			left = new ConditionExpression.Binary(Operator.OR, left, and());
		}
		return left;
	}

	private ConditionExpression and() {
		ConditionExpression left = equality();
		while (match(Type.AND)) {
			left = new ConditionExpression.Binary(Operator.AND, left, equality());
		}
		return left;
	}

	private ConditionExpression equality() {
		ConditionExpression left = comparison();
		while (true) {
			if (match(Type.EQ)) {
				left = new ConditionExpression.Binary(Operator.EQ, left, comparison());
			} else if (match(Type.NE)) {
				left = new ConditionExpression.Binary(Operator.NE, left, comparison());
			} else {
				return left;
			}
		}
	}

	private ConditionExpression comparison() {
		ConditionExpression left = unary();
		while (true) {
			Operator operator = switch (peek().type()) {
				case LT -> Operator.LT;
				case LE -> Operator.LE;
				case GT -> Operator.GT;
				case GE -> Operator.GE;
				default -> null;
			};
			if (operator == null) {
				return left;
			}
			current++;
			left = new ConditionExpression.Binary(operator, left, unary());
		}
	}

	private ConditionExpression unary() {
		if (match(Type.NOT)) {
			enter();
			ConditionExpression operand = unary();
			depth--;
			return new ConditionExpression.Not(operand);
		}
		return primary();
	}

	private ConditionExpression primary() {
		ConditionToken token = peek();
		switch (token.type()) {
			case NUMBER -> {
				current++;
				return new ConditionExpression.Literal(new BigDecimal(token.text()));
			}
			case STRING -> {
				current++;
				return new ConditionExpression.Literal(token.text());
			}
			case LPAREN -> {
				current++;
				enter();
				ConditionExpression inner = or();
				if (!match(Type.RPAREN)) {
					throw new ConditionException("Expected ')' at position " + peek().position());
				}
				depth--;
				return inner;
			}
			case IDENTIFIER -> {
				current++;
				switch (token.text()) {
					case "true":
						return new ConditionExpression.Literal(Boolean.TRUE);
					case "false":
						return new ConditionExpression.Literal(Boolean.FALSE);
					case "null":
						return new ConditionExpression.Literal(null);
					default:
						break;
				}
				StringBuilder path = new StringBuilder(token.text());
				while (peek().type() == Type.DOT) {
					current++;
					ConditionToken segment = peek();
					if (segment.type() != Type.IDENTIFIER) {
						throw new ConditionException("Expected name after '.' at position " + segment.position());
					}
					current++;
					path.append('.').append(segment.text());
				}
				return new ConditionExpression.Variable(path.toString());
			}
			case EOF -> throw new ConditionException("Unexpected end of condition");
			default -> throw new ConditionException("Unexpected '" + token.text() + "' at position " + token.position());
		}
	}

	private void enter() {
		if (++depth > MAX_DEPTH) {
			throw new ConditionException("Condition nests deeper than " + MAX_DEPTH + " levels");
		}
	}

	private boolean match(Type type) {
		if (peek().type() == type) {
			current++;
			return true;
		}
		return false;
	}

	private ConditionToken peek() {
		return tokens.get(current);
	}
}
