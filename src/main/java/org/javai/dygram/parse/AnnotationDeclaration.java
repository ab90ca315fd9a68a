package org.javai.dygram.parse;

import java.util.Objects;
import org.javai.dygram.diagnostics.SourcePosition;

/**
 * {@code @Name} or {@code @Name("value")}.
 */
public record AnnotationDeclaration(String name, String value, SourcePosition position) {

	public AnnotationDeclaration {
		Objects.requireNonNull(name, "name must not be null");
	}
}
