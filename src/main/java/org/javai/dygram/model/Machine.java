package org.javai.dygram.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical, immutable machine model. Nodes live in an arena indexed by {@link NodeId};
 * ids are assigned in pre-order of the node tree so that equal trees have equal ids.
 *
 * @param title machine title, or {@code null}
 * @param attributes machine-level attributes
 * @param annotations machine-level annotations
 * @param nodes arena of nodes, {@code nodes.get(i).id().value() == i}
 * @param edges resolved edges in declaration order
 * @param notes resolved notes
 * @param inferredDependencies dependencies derived from template references
 */
public record Machine(
		String title,
		List<Attribute> attributes,
		List<Annotation> annotations,
		List<MachineNode> nodes,
		List<Edge> edges,
		List<Note> notes,
		List<InferredDependency> inferredDependencies
) {

	public static final String STRICT_MODE = "StrictMode";

	public Machine {
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
		annotations = annotations == null ? List.of() : List.copyOf(annotations);
		nodes = nodes == null ? List.of() : List.copyOf(nodes);
		edges = edges == null ? List.of() : List.copyOf(edges);
		notes = notes == null ? List.of() : List.copyOf(notes);
		inferredDependencies = inferredDependencies == null ? List.of() : List.copyOf(inferredDependencies);
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i).id().value() != i) {
				throw new IllegalArgumentException("node at index " + i + " has id " + nodes.get(i).id());
			}
		}
	}

	public MachineNode node(NodeId id) {
		Objects.requireNonNull(id, "id must not be null");
		if (id.value() >= nodes.size()) {
			throw new IllegalArgumentException("No node with id " + id);
		}
		return nodes.get(id.value());
	}

	public List<MachineNode> roots() {
		return nodes.stream().filter(n -> n.parent() == null).toList();
	}

	public List<MachineNode> children(NodeId id) {
		return node(id).children().stream().map(this::node).toList();
	}

	/**
	 * Dotted path from the root to the node, e.g. {@code API.Authentication}.
	 */
	public String qualifiedName(NodeId id) {
		Deque<String> segments = new ArrayDeque<>();
		NodeId cursor = id;
		while (cursor != null) {
			MachineNode n = node(cursor);
			segments.addFirst(n.name());
			cursor = n.parent();
		}
		return String.join(".", segments);
	}

	public Optional<MachineNode> findByPath(String qualifiedPath) {
		if (qualifiedPath == null || qualifiedPath.isBlank()) {
			return Optional.empty();
		}
		String[] segments = qualifiedPath.split("\\.");
		List<MachineNode> level = roots();
		MachineNode found = null;
		for (String segment : segments) {
			found = level.stream().filter(n -> n.name().equals(segment)).findFirst().orElse(null);
			if (found == null) {
				return Optional.empty();
			}
			level = children(found.id());
		}
		return Optional.ofNullable(found);
	}

	public List<MachineNode> findBySimpleName(String name) {
		return nodes.stream().filter(n -> n.name().equals(name)).toList();
	}

	public List<Edge> outgoing(NodeId id) {
		return edges.stream().filter(e -> e.source().equals(id)).toList();
	}

	public List<Edge> incoming(NodeId id) {
		return edges.stream().filter(e -> e.target().equals(id)).toList();
	}

	public List<MachineNode> nodesOfType(String type) {
		return nodes.stream().filter(n -> n.isType(type)).toList();
	}

	public Optional<Attribute> attribute(String name) {
		return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
	}

	public boolean hasAnnotation(String name) {
		return annotations.stream().anyMatch(a -> a.name().equalsIgnoreCase(name));
	}

	public boolean isStrict() {
		return hasAnnotation(STRICT_MODE);
	}

	/**
	 * Ancestors of a node from its parent up to the root.
	 */
	public List<NodeId> ancestors(NodeId id) {
		List<NodeId> result = new ArrayList<>();
		NodeId cursor = node(id).parent();
		while (cursor != null) {
			result.add(cursor);
			cursor = node(cursor).parent();
		}
		return result;
	}

	public Machine withInferredDependencies(List<InferredDependency> dependencies) {
		return new Machine(title, attributes, annotations, nodes, edges, notes, dependencies);
	}
}
