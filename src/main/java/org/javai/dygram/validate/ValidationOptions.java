package org.javai.dygram.validate;

import java.util.Objects;
import org.javai.dygram.diagnostics.Severity;

/**
 * Toggles for the individual validation checks.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ValidationOptions options = ValidationOptions.builder()
 *         .checkOrphans(false)
 *         .cycleSeverity(Severity.ERROR)
 *         .build();
 * }</pre>
 *
 * @param checkUnreachable report nodes not reachable from an init node
 * @param checkOrphans report nodes without incident edges
 * @param checkCycles report cycles
 * @param checkDuplicateStates report conflicting declarations of the same node
 * @param checkAnnotations apply annotation compatibility rules
 * @param checkMultiplicity validate edge multiplicities
 * @param checkTypes check attribute values against declared types
 * @param inferDependencies infer dependencies from template references
 * @param cycleSeverity severity used for cycle findings
 */
public record ValidationOptions(
		boolean checkUnreachable,
		boolean checkOrphans,
		boolean checkCycles,
		boolean checkDuplicateStates,
		boolean checkAnnotations,
		boolean checkMultiplicity,
		boolean checkTypes,
		boolean inferDependencies,
		Severity cycleSeverity
) {

	public ValidationOptions {
		Objects.requireNonNull(cycleSeverity, "cycleSeverity must not be null");
	}

	public static ValidationOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private boolean checkUnreachable = true;
		private boolean checkOrphans = true;
		private boolean checkCycles = true;
		private boolean checkDuplicateStates = true;
		private boolean checkAnnotations = true;
		private boolean checkMultiplicity = true;
		private boolean checkTypes = true;
		private boolean inferDependencies = true;
		private Severity cycleSeverity = Severity.WARNING;

		public Builder checkUnreachable(boolean enabled) {
			this.checkUnreachable = enabled;
			return this;
		}

		public Builder checkOrphans(boolean enabled) {
			this.checkOrphans = enabled;
			return this;
		}

		public Builder checkCycles(boolean enabled) {
			this.checkCycles = enabled;
			return this;
		}

		public Builder checkDuplicateStates(boolean enabled) {
			this.checkDuplicateStates = enabled;
			return this;
		}

		public Builder checkAnnotations(boolean enabled) {
			this.checkAnnotations = enabled;
			return this;
		}

		public Builder checkMultiplicity(boolean enabled) {
			this.checkMultiplicity = enabled;
			return this;
		}

		public Builder checkTypes(boolean enabled) {
			this.checkTypes = enabled;
			return this;
		}

		public Builder inferDependencies(boolean enabled) {
			this.inferDependencies = enabled;
			return this;
		}

		public Builder cycleSeverity(Severity severity) {
			this.cycleSeverity = severity;
			return this;
		}

		public ValidationOptions build() {
			return new ValidationOptions(checkUnreachable, checkOrphans, checkCycles, checkDuplicateStates,
					checkAnnotations, checkMultiplicity, checkTypes, inferDependencies, cycleSeverity);
		}
	}
}
