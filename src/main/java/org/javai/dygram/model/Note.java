package org.javai.dygram.model;

import java.util.List;
import java.util.Objects;

/**
 * Documentation attached to a node.
 *
 * @param target resolved target node
 * @param targetPath full qualified path of the target as declared
 * @param content note text
 * @param attributes note attributes
 * @param annotations note annotations
 */
public record Note(NodeId target, String targetPath, String content, List<Attribute> attributes,
		List<Annotation> annotations) {

	public Note {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(targetPath, "targetPath must not be null");
		content = content == null ? "" : content;
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
		annotations = annotations == null ? List.of() : List.copyOf(annotations);
	}
}
