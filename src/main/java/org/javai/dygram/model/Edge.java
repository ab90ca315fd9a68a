package org.javai.dygram.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A resolved edge between two nodes of the same machine.
 *
 * @param source source node
 * @param target target node
 * @param arrowType relationship kind
 * @param label free text label, or {@code null}
 * @param attributes ordered edge attributes, including guards ({@code if}, {@code when}, {@code unless})
 * @param sourceMultiplicity cardinality on the source end, or {@code null}
 * @param targetMultiplicity cardinality on the target end, or {@code null}
 */
public record Edge(
		NodeId source,
		NodeId target,
		ArrowType arrowType,
		String label,
		List<Attribute> attributes,
		String sourceMultiplicity,
		String targetMultiplicity
) {

	public Edge {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(arrowType, "arrowType must not be null");
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
	}

	public static Edge simple(NodeId source, NodeId target) {
		return new Edge(source, target, ArrowType.ASSOCIATION, null, List.of(), null, null);
	}

	public Optional<Attribute> attribute(String name) {
		return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
	}

	public Edge withEndpoints(NodeId newSource, NodeId newTarget) {
		return new Edge(newSource, newTarget, arrowType, label, attributes, sourceMultiplicity, targetMultiplicity);
	}

	public Edge withAttributes(List<Attribute> newAttributes) {
		return new Edge(source, target, arrowType, label, newAttributes, sourceMultiplicity, targetMultiplicity);
	}

	public Edge withLabel(String newLabel) {
		return new Edge(source, target, arrowType, newLabel, attributes, sourceMultiplicity, targetMultiplicity);
	}
}
