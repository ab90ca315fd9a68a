package org.javai.dygram.exec;

/**
 * A decision-maker could not produce a usable decision.
 */
public class DecisionException extends RuntimeException {

	public DecisionException(String message) {
		super(message);
	}

	public DecisionException(String message, Throwable cause) {
		super(message, cause);
	}
}
