package org.javai.dygram.exec;

/**
 * Why a run failed.
 */
public enum FaultReason {
	NO_ENTRY_POINT,
	NO_ELIGIBLE_TOOL,
	UNKNOWN_TOOL,
	DECISION_TIMEOUT,
	DECISION_FAILED,
	STEP_LIMIT_EXCEEDED
}
