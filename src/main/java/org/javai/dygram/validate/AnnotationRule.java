package org.javai.dygram.validate;

import java.util.Optional;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.model.MachineNode;

/**
 * Compatibility rules between annotations and node types.
 */
public enum AnnotationRule {

	/** {@code @Async} only makes sense on task nodes. */
	ASYNC_REQUIRES_TASK("Async", Severity.WARNING),
	/** {@code @Singleton} only on task or context nodes. */
	SINGLETON_REQUIRES_TASK_OR_CONTEXT("Singleton", Severity.WARNING),
	/** An entry point cannot be abstract. */
	ABSTRACT_NOT_ON_INIT("Abstract", Severity.ERROR);

	private final String annotation;
	private final Severity severity;

	AnnotationRule(String annotation, Severity severity) {
		this.annotation = annotation;
		this.severity = severity;
	}

	public String annotation() {
		return annotation;
	}

	public Optional<Diagnostic> check(MachineNode node, String path) {
		if (!node.hasAnnotation(annotation) || isSatisfied(node)) {
			return Optional.empty();
		}
		String message = switch (this) {
			case ASYNC_REQUIRES_TASK -> "@Async is only valid on task nodes, '%s' is %s";
			case SINGLETON_REQUIRES_TASK_OR_CONTEXT -> "@Singleton is only valid on task or context nodes, '%s' is %s";
			case ABSTRACT_NOT_ON_INIT -> "@Abstract cannot be applied to init node '%s' (%s)";
		};
		String typeText = node.type() == null ? "untyped" : "of type " + node.type();
		Diagnostic diagnostic = new Diagnostic(severity, DiagnosticKind.SEMANTIC_VIOLATION, name(),
				message.formatted(path, typeText), path, null, null);
		return Optional.of(diagnostic);
	}

	private boolean isSatisfied(MachineNode node) {
		return switch (this) {
			case ASYNC_REQUIRES_TASK -> node.isType("task");
			case SINGLETON_REQUIRES_TASK_OR_CONTEXT -> node.isType("task") || node.isType("context");
			case ABSTRACT_NOT_ON_INIT -> !node.isType("init");
		};
	}
}
