package org.javai.dygram.config;

import java.util.Objects;
import org.javai.dygram.exec.ExecutionConfig;
import org.javai.dygram.validate.ValidationOptions;

/**
 * Settings for compiling and running machines.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DygramConfig config = DygramConfig.builder()
 *         .autoCreateMissingNodes(true)
 *         .validation(ValidationOptions.builder().checkOrphans(false).build())
 *         .build();
 * }</pre>
 *
 * @param autoCreateMissingNodes create unresolved edge endpoints instead of reporting them;
 * ignored for {@code @StrictMode} machines
 * @param validation which validation checks run
 * @param execution limits for machine runs
 */
public record DygramConfig(
		boolean autoCreateMissingNodes,
		ValidationOptions validation,
		ExecutionConfig execution
) {

	public DygramConfig {
		Objects.requireNonNull(validation, "validation must not be null");
		Objects.requireNonNull(execution, "execution must not be null");
	}

	public static DygramConfig defaults() {
		return new DygramConfig(false, ValidationOptions.defaults(), ExecutionConfig.defaults());
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private boolean autoCreateMissingNodes;
		private ValidationOptions validation = ValidationOptions.defaults();
		private ExecutionConfig execution = ExecutionConfig.defaults();

		private Builder() {
		}

		public Builder autoCreateMissingNodes(boolean autoCreate) {
			this.autoCreateMissingNodes = autoCreate;
			return this;
		}

		public Builder validation(ValidationOptions options) {
			this.validation = options;
			return this;
		}

		public Builder execution(ExecutionConfig config) {
			this.execution = config;
			return this;
		}

		public DygramConfig build() {
			return new DygramConfig(autoCreateMissingNodes, validation, execution);
		}
	}
}
