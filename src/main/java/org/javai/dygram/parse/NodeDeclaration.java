package org.javai.dygram.parse;

import java.util.List;
import java.util.Objects;
import org.javai.dygram.diagnostics.SourcePosition;

/**
 * A node declaration as written, before qualified-name expansion.
 *
 * @param type type keyword, lowercased, or {@code null}
 * @param name simple or dotted name
 * @param title title string, or {@code null}
 * @param annotations declared annotations
 * @param attributes declared attributes, duplicates preserved
 * @param children nested node declarations
 * @param edges edges declared inside the block
 * @param notes notes declared inside the block
 * @param position source position of the name
 */
public record NodeDeclaration(
		String type,
		String name,
		String title,
		List<AnnotationDeclaration> annotations,
		List<AttributeDeclaration> attributes,
		List<NodeDeclaration> children,
		List<EdgeDeclaration> edges,
		List<NoteDeclaration> notes,
		SourcePosition position
) {

	public NodeDeclaration {
		Objects.requireNonNull(name, "name must not be null");
		annotations = annotations == null ? List.of() : List.copyOf(annotations);
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
		children = children == null ? List.of() : List.copyOf(children);
		edges = edges == null ? List.of() : List.copyOf(edges);
		notes = notes == null ? List.of() : List.copyOf(notes);
	}

	public boolean isQualified() {
		return name.contains(".");
	}
}
