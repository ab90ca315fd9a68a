package org.javai.dygram.diagnostics;

/**
 * Severity of a {@link Diagnostic}.
 */
public enum Severity {
	ERROR,
	WARNING,
	INFO;

	public static Severity fromName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("severity name must not be null");
		}
		return switch (name.trim().toLowerCase()) {
			case "error" -> ERROR;
			case "warning", "warn" -> WARNING;
			case "info" -> INFO;
			default -> throw new IllegalArgumentException("Unknown severity: " + name);
		};
	}
}
