package org.javai.dygram.exec;

/**
 * Recoverable failure of one tool invocation: bad input, a value that does not fit its
 * declared type, or a missing node. The invocation is rolled back and the run continues.
 */
public class ToolInvocationException extends RuntimeException {

	public ToolInvocationException(String message) {
		super(message);
	}

	public ToolInvocationException(String message, Throwable cause) {
		super(message, cause);
	}
}
