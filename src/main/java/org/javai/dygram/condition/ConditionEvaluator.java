package org.javai.dygram.condition;

import java.math.BigDecimal;
import java.util.Objects;
import org.javai.dygram.condition.ConditionExpression.Binary;
import org.javai.dygram.condition.ConditionExpression.Literal;
import org.javai.dygram.condition.ConditionExpression.Not;
import org.javai.dygram.condition.ConditionExpression.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates guard expressions. Evaluation has no access to host functions and any failure
 * (parse error, missing variable, type error, non-boolean result) yields {@code false}.
 * <p>
 * Typing is strict: {@code ==} between values of different types is an error unless one
 * side is {@code null}. {@code &&} and {@code ||} are commutative with respect to errors,
 * so {@code false && <error>} is {@code false} and {@code true || <error>} is {@code true}.
 */
public class ConditionEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

	/**
	 * @return the boolean value of the expression, or {@code false} if it cannot be evaluated
	 */
	public boolean evaluate(String expression, EvaluationContext context) {
		Objects.requireNonNull(context, "context must not be null");
		try {
			return Boolean.TRUE.equals(eval(ConditionParser.parse(expression), context));
		} catch (ConditionException e) {
			logger.warn("Condition '{}' evaluated to false: {}", expression, e.getMessage());
			return false;
		}
	}

	private Object eval(ConditionExpression expression, EvaluationContext context) {
		if (expression instanceof Literal literal) {
			return literal.value();
		}
		if (expression instanceof Variable variable) {
			if (!context.has(variable.path())) {
				throw new ConditionException("Undefined variable '" + variable.path() + "'");
			}
			return context.lookup(variable.path()).orElse(null);
		}
		if (expression instanceof Not not) {
			return !asBoolean(eval(not.operand(), context), "!");
		}
		Binary binary = (Binary) expression;
		return switch (binary.operator()) {
			case AND -> and(binary, context);
			case OR -> or(binary, context);
			case EQ -> equal(eval(binary.left(), context), eval(binary.right(), context));
			case NE -> !equal(eval(binary.left(), context), eval(binary.right(), context));
			case LT -> compare(binary, context) < 0;
			case LE -> compare(binary, context) <= 0;
			case GT -> compare(binary, context) > 0;
			case GE -> compare(binary, context) >= 0;
		};
	}

	private boolean and(Binary binary, EvaluationContext context) {
		Outcome left = outcome(binary.left(), context, "&&");
		if (left.value == Boolean.FALSE) {
			return false;
		}
		Outcome right = outcome(binary.right(), context, "&&");
		if (right.value == Boolean.FALSE) {
			return false;
		}
		left.rethrow();
		right.rethrow();
		return true;
	}

	private boolean or(Binary binary, EvaluationContext context) {
		Outcome left = outcome(binary.left(), context, "||");
		if (left.value == Boolean.TRUE) {
			return true;
		}
		Outcome right = outcome(binary.right(), context, "||");
		if (right.value == Boolean.TRUE) {
			return true;
		}
		left.rethrow();
		right.rethrow();
		return false;
	}

	private Outcome outcome(ConditionExpression operand, EvaluationContext context, String operator) {
		try {
			return new Outcome(asBoolean(eval(operand, context), operator), null);
		} catch (ConditionException e) {
			return new Outcome(null, e);
		}
	}

	private boolean equal(Object left, Object right) {
		if (left == null || right == null) {
			return left == right;
		}
		if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
			return l.compareTo(r) == 0;
		}
		if (left.getClass() != right.getClass()) {
			throw new ConditionException("Cannot compare %s with %s".formatted(typeName(left), typeName(right)));
		}
		return left.equals(right);
	}

	private int compare(Binary binary, EvaluationContext context) {
		Object left = eval(binary.left(), context);
		Object right = eval(binary.right(), context);
		if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
			return l.compareTo(r);
		}
		if (left instanceof String l && right instanceof String r) {
			return l.compareTo(r);
		}
		throw new ConditionException("Operator %s is not defined for %s and %s"
				.formatted(binary.operator().symbol(), typeName(left), typeName(right)));
	}

	private boolean asBoolean(Object value, String operator) {
		if (value instanceof Boolean b) {
			return b;
		}
		throw new ConditionException("Operator %s needs a boolean, got %s".formatted(operator, typeName(value)));
	}

	private String typeName(Object value) {
		if (value == null) {
			return "null";
		}
		if (value instanceof BigDecimal) {
			return "number";
		}
		if (value instanceof String) {
			return "string";
		}
		if (value instanceof Boolean) {
			return "boolean";
		}
		return value.getClass().getSimpleName();
	}

	private record Outcome(Boolean value, ConditionException error) {
		void rethrow() {
			if (error != null) {
				throw error;
			}
		}
	}
}
