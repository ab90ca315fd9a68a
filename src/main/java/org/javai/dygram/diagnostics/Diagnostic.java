package org.javai.dygram.diagnostics;

import java.util.List;
import java.util.Objects;

/**
 * A single finding produced while compiling or validating a machine.
 *
 * @param severity error, warning or info
 * @param kind taxonomy bucket
 * @param code stable machine-readable code, e.g. {@code CYCLE_DETECTED}
 * @param message human readable message
 * @param nodePath qualified path of the node concerned, or {@code null}
 * @param position source location, or {@code null} when not tied to source text
 * @param related further qualified paths (cycle members, ambiguity candidates)
 */
public record Diagnostic(
		Severity severity,
		DiagnosticKind kind,
		String code,
		String message,
		String nodePath,
		SourcePosition position,
		List<String> related
) {

	public Diagnostic {
		Objects.requireNonNull(severity, "severity must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(code, "code must not be null");
		Objects.requireNonNull(message, "message must not be null");
		related = related == null ? List.of() : List.copyOf(related);
	}

	public static Diagnostic error(DiagnosticKind kind, String code, String message) {
		return new Diagnostic(Severity.ERROR, kind, code, message, null, null, List.of());
	}

	public static Diagnostic warning(DiagnosticKind kind, String code, String message) {
		return new Diagnostic(Severity.WARNING, kind, code, message, null, null, List.of());
	}

	public static Diagnostic info(DiagnosticKind kind, String code, String message) {
		return new Diagnostic(Severity.INFO, kind, code, message, null, null, List.of());
	}

	public Diagnostic atNode(String path) {
		return new Diagnostic(severity, kind, code, message, path, position, related);
	}

	public Diagnostic at(SourcePosition where) {
		return new Diagnostic(severity, kind, code, message, nodePath, where, related);
	}

	public Diagnostic withRelated(List<String> paths) {
		return new Diagnostic(severity, kind, code, message, nodePath, position, paths);
	}

	public Diagnostic withSeverity(Severity newSeverity) {
		return new Diagnostic(newSeverity, kind, code, message, nodePath, position, related);
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(severity.name().toLowerCase()).append(' ').append(code);
		if (position != null) {
			sb.append(" at ").append(position);
		}
		if (nodePath != null) {
			sb.append(" [").append(nodePath).append(']');
		}
		return sb.append(": ").append(message).toString();
	}
}
