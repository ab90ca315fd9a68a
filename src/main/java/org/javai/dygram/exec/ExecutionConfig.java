package org.javai.dygram.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied by {@link MachineRunner}.
 *
 * @param maxSteps maximum number of applied decisions per run
 * @param decisionTimeout how long to wait for one decision
 * @param decisionRetries extra attempts after a timed out or failed decision
 */
public record ExecutionConfig(int maxSteps, Duration decisionTimeout, int decisionRetries) {

	public static final int DEFAULT_MAX_STEPS = 100;
	public static final Duration DEFAULT_DECISION_TIMEOUT = Duration.ofSeconds(60);
	public static final int DEFAULT_DECISION_RETRIES = 1;

	public ExecutionConfig {
		Objects.requireNonNull(decisionTimeout, "decisionTimeout must not be null");
		if (maxSteps < 1) {
			throw new IllegalArgumentException("maxSteps must be positive");
		}
		if (decisionTimeout.isNegative() || decisionTimeout.isZero()) {
			throw new IllegalArgumentException("decisionTimeout must be positive");
		}
		if (decisionRetries < 0) {
			throw new IllegalArgumentException("decisionRetries must be non-negative");
		}
	}

	public static ExecutionConfig defaults() {
		return new ExecutionConfig(DEFAULT_MAX_STEPS, DEFAULT_DECISION_TIMEOUT, DEFAULT_DECISION_RETRIES);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int maxSteps = DEFAULT_MAX_STEPS;
		private Duration decisionTimeout = DEFAULT_DECISION_TIMEOUT;
		private int decisionRetries = DEFAULT_DECISION_RETRIES;

		public Builder maxSteps(int steps) {
			this.maxSteps = steps;
			return this;
		}

		public Builder decisionTimeout(Duration timeout) {
			this.decisionTimeout = timeout;
			return this;
		}

		public Builder decisionRetries(int retries) {
			this.decisionRetries = retries;
			return this;
		}

		public ExecutionConfig build() {
			return new ExecutionConfig(maxSteps, decisionTimeout, decisionRetries);
		}
	}
}
