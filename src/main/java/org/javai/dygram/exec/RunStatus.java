package org.javai.dygram.exec;

/**
 * Lifecycle of a run.
 */
public enum RunStatus {
	RUNNING,
	COMPLETED,
	FAILED;

	public boolean isTerminal() {
		return this != RUNNING;
	}
}
