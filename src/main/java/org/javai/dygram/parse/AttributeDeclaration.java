package org.javai.dygram.parse;

import java.util.Objects;
import org.javai.dygram.diagnostics.SourcePosition;
import org.javai.dygram.model.AttributeValue;

/**
 * {@code name[<Type>]: value;}
 */
public record AttributeDeclaration(String name, TypeRef type, AttributeValue value, SourcePosition position) {

	public AttributeDeclaration {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}
}
