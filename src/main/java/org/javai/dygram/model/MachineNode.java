package org.javai.dygram.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the canonical machine tree. Parent and children are held as ids into the
 * owning {@link Machine}.
 *
 * @param id arena id
 * @param name local simple name, unique among siblings
 * @param type type keyword such as {@code task}, {@code state}, {@code init}, or {@code null}
 * @param title display title, or {@code null}
 * @param parent parent id, or {@code null} for roots
 * @param children child ids in declaration order
 * @param attributes attributes, unique by name
 * @param annotations annotations, unique by name
 */
public record MachineNode(
		NodeId id,
		String name,
		String type,
		String title,
		NodeId parent,
		List<NodeId> children,
		List<Attribute> attributes,
		List<Annotation> annotations
) {

	public MachineNode {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(name, "name must not be null");
		children = children == null ? List.of() : List.copyOf(children);
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
		annotations = annotations == null ? List.of() : List.copyOf(annotations);
	}

	public Optional<Attribute> attribute(String attributeName) {
		return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
	}

	public boolean hasAnnotation(String annotationName) {
		return annotations.stream().anyMatch(a -> a.name().equalsIgnoreCase(annotationName));
	}

	public boolean isType(String candidate) {
		return type != null && type.equalsIgnoreCase(candidate);
	}

	public boolean isContainer() {
		return !children.isEmpty();
	}
}
