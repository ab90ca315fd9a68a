package org.javai.dygram.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.dygram.diagnostics.SourcePosition;
import org.javai.dygram.model.Annotation;
import org.javai.dygram.model.Attribute;

/**
 * Node under construction. Only the merge phase mutates it.
 */
final class MutableNode {

	final int id;
	final String name;
	final MutableNode parent;
	final List<MutableNode> children = new ArrayList<>();
	final List<Attribute> attributes = new ArrayList<>();
	final List<Annotation> annotations = new ArrayList<>();
	String type;
	/** True while {@link #type} was copied from a qualified descendant rather than declared. */
	boolean typeInherited;
	String title;
	SourcePosition position;

	MutableNode(int id, String name, MutableNode parent) {
		this.id = id;
		this.name = name;
		this.parent = parent;
	}

	Optional<MutableNode> child(String childName) {
		return children.stream().filter(c -> c.name.equals(childName)).findFirst();
	}

	/**
	 * Replaces an attribute of the same name in place, or appends it.
	 */
	void upsertAttribute(Attribute attribute) {
		for (int i = 0; i < attributes.size(); i++) {
			if (attributes.get(i).name().equals(attribute.name())) {
				attributes.set(i, attribute);
				return;
			}
		}
		attributes.add(attribute);
	}

	/**
	 * Adds the annotation unless one with the same name is already present.
	 */
	void mergeAnnotation(Annotation annotation) {
		boolean present = annotations.stream().anyMatch(a -> a.name().equals(annotation.name()));
		if (!present) {
			annotations.add(annotation);
		}
	}

	String path() {
		return parent == null ? name : parent.path() + "." + name;
	}

	@Override
	public String toString() {
		return path();
	}
}
