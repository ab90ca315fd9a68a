package org.javai.dygram.condition;

/**
 * Parse or evaluation failure inside a condition. {@link ConditionEvaluator} never lets it
 * escape; it turns any failure into {@code false}.
 */
public class ConditionException extends RuntimeException {

	public ConditionException(String message) {
		super(message);
	}

	public ConditionException(String message, Throwable cause) {
		super(message, cause);
	}
}
