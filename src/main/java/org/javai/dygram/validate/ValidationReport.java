package org.javai.dygram.validate;

import java.util.List;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.model.InferredDependency;

/**
 * Findings of {@link MachineValidator} plus the dependencies it inferred.
 */
public record ValidationReport(List<Diagnostic> diagnostics, List<InferredDependency> dependencies) {

	public ValidationReport {
		diagnostics = List.copyOf(diagnostics);
		dependencies = List.copyOf(dependencies);
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}
}
