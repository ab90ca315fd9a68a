package org.javai.dygram.build;

import java.util.List;
import java.util.Optional;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.model.Machine;

/**
 * A compiled machine and everything found while compiling it.
 *
 * @param machine the validated machine, or {@code null} when the source has syntax errors
 * @param diagnostics all diagnostics in the order they were found
 */
public record CompilationResult(Machine machine, List<Diagnostic> diagnostics) {

	public CompilationResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public Optional<Machine> machineIfPresent() {
		return Optional.ofNullable(machine);
	}

	public boolean hasErrors() {
		return machine == null || diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public boolean hasSyntaxErrors() {
		return diagnostics.stream().anyMatch(d -> d.kind() == DiagnosticKind.SYNTAX_ERROR);
	}

	public List<Diagnostic> errors() {
		return bySeverity(Severity.ERROR);
	}

	public List<Diagnostic> warnings() {
		return bySeverity(Severity.WARNING);
	}

	public List<Diagnostic> bySeverity(Severity severity) {
		return diagnostics.stream().filter(d -> d.severity() == severity).toList();
	}

	public List<Diagnostic> withCode(String code) {
		return diagnostics.stream().filter(d -> d.code().equals(code)).toList();
	}
}
