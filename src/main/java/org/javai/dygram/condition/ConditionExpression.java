package org.javai.dygram.condition;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parsed guard expression.
 */
public sealed interface ConditionExpression {

	enum Operator {
		EQ("=="),
		NE("!="),
		LT("<"),
		LE("<="),
		GT(">"),
		GE(">="),
		AND("&&"),
		OR("||");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}
	}

	/**
	 * @param value {@link java.math.BigDecimal}, {@link String}, {@link Boolean} or {@code null}
	 */
	record Literal(Object value) implements ConditionExpression {
	}

	/**
	 * Dotted variable reference such as {@code errorCount} or {@code config.maxRetries}.
	 */
	record Variable(String path) implements ConditionExpression {
	}

	record Not(ConditionExpression operand) implements ConditionExpression {
	}

	record Binary(Operator operator, ConditionExpression left, ConditionExpression right) implements ConditionExpression {
	}

	/**
	 * Every variable path referenced by the expression, in order of first appearance.
	 */
	default Set<String> variables() {
		Set<String> result = new LinkedHashSet<>();
		collect(this, result);
		return result;
	}

	private static void collect(ConditionExpression expression, Set<String> into) {
		if (expression instanceof Variable v) {
			into.add(v.path());
		} else if (expression instanceof Not n) {
			collect(n.operand(), into);
		} else if (expression instanceof Binary b) {
			collect(b.left(), into);
			collect(b.right(), into);
		}
	}
}
