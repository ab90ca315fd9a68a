package org.javai.dygram.parse;

import java.util.List;
import java.util.Objects;
import org.javai.dygram.diagnostics.SourcePosition;

/**
 * {@code note [for] target "content" [@Ann] [{ attrs }]}
 */
public record NoteDeclaration(
		String target,
		String content,
		List<AnnotationDeclaration> annotations,
		List<AttributeDeclaration> attributes,
		SourcePosition position
) {

	public NoteDeclaration {
		Objects.requireNonNull(target, "target must not be null");
		content = content == null ? "" : content;
		annotations = annotations == null ? List.of() : List.copyOf(annotations);
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
	}
}
