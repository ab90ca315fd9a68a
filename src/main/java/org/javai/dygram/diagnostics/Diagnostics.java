package org.javai.dygram.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collector shared by the compilation phases of one document.
 */
public final class Diagnostics {

	private final List<Diagnostic> entries = new ArrayList<>();

	public void add(Diagnostic diagnostic) {
		entries.add(diagnostic);
	}

	public void addAll(List<Diagnostic> diagnostics) {
		entries.addAll(diagnostics);
	}

	public boolean hasErrors() {
		return entries.stream().anyMatch(Diagnostic::isError);
	}

	public boolean hasErrorsOfKind(DiagnosticKind kind) {
		return entries.stream().anyMatch(d -> d.isError() && d.kind() == kind);
	}

	public List<Diagnostic> all() {
		return Collections.unmodifiableList(entries);
	}

	public List<Diagnostic> bySeverity(Severity severity) {
		return entries.stream().filter(d -> d.severity() == severity).toList();
	}

	public int size() {
		return entries.size();
	}
}
