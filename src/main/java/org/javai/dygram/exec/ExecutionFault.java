package org.javai.dygram.exec;

import java.util.Objects;

/**
 * Fatal error for a single run. Other runs are unaffected and the run's context store
 * keeps its last committed state.
 */
public class ExecutionFault extends RuntimeException {

	private final FaultReason reason;

	public ExecutionFault(FaultReason reason, String message) {
		super(message);
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
	}

	public ExecutionFault(FaultReason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
	}

	public FaultReason reason() {
		return reason;
	}
}
