package org.javai.dygram.parse;

import java.util.List;
import java.util.Objects;
import org.javai.dygram.model.ArrowType;

/**
 * One hop of an edge chain: the arrow with its label and the targets it points to.
 *
 * @param arrowType relationship kind
 * @param label free text label, or {@code null}
 * @param attributes label attributes such as {@code when: "..."}
 * @param sourceMultiplicity multiplicity written before the arrow, or {@code null}
 * @param targetMultiplicity multiplicity written after the arrow, or {@code null}
 * @param targets target references, simple or dotted
 */
public record EdgeSegment(
		ArrowType arrowType,
		String label,
		List<AttributeDeclaration> attributes,
		String sourceMultiplicity,
		String targetMultiplicity,
		List<String> targets
) {

	public EdgeSegment {
		Objects.requireNonNull(arrowType, "arrowType must not be null");
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
		targets = List.copyOf(targets);
	}
}
