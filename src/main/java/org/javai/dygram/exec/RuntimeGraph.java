package org.javai.dygram.exec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.javai.dygram.model.Annotation;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.InferredDependency;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineAssembler;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.javai.dygram.model.Note;

/**
 * Mutable copy of a machine owned by one run. Nodes and edges are keyed by id so that
 * runtime edits never invalidate ids held elsewhere; removed ids are not reused.
 */
public final class RuntimeGraph {

	private final String title;
	private final List<Attribute> attributes;
	private final List<Annotation> annotations;
	private final TreeMap<Integer, MachineNode> nodes;
	private final List<Edge> edges;
	private final List<Note> notes;
	private final List<InferredDependency> dependencies;
	private int nextId;

	private RuntimeGraph(String title, List<Attribute> attributes, List<Annotation> annotations,
			TreeMap<Integer, MachineNode> nodes, List<Edge> edges, List<Note> notes,
			List<InferredDependency> dependencies, int nextId) {
		this.title = title;
		this.attributes = attributes;
		this.annotations = annotations;
		this.nodes = nodes;
		this.edges = edges;
		this.notes = notes;
		this.dependencies = dependencies;
		this.nextId = nextId;
	}

	public static RuntimeGraph of(Machine machine) {
		Objects.requireNonNull(machine, "machine must not be null");
		TreeMap<Integer, MachineNode> nodes = new TreeMap<>();
		machine.nodes().forEach(n -> nodes.put(n.id().value(), n));
		return new RuntimeGraph(machine.title(), machine.attributes(), machine.annotations(), nodes,
				new ArrayList<>(machine.edges()), new ArrayList<>(machine.notes()),
				new ArrayList<>(machine.inferredDependencies()), machine.nodes().size());
	}

	/**
	 * Independent copy used for checkpoints.
	 */
	public RuntimeGraph copy() {
		return new RuntimeGraph(title, attributes, annotations, new TreeMap<>(nodes), new ArrayList<>(edges),
				new ArrayList<>(notes), new ArrayList<>(dependencies), nextId);
	}

	public Optional<MachineNode> node(NodeId id) {
		return Optional.ofNullable(nodes.get(id.value()));
	}

	public MachineNode require(NodeId id) {
		return node(id).orElseThrow(() -> new ToolInvocationException("Node " + id + " no longer exists"));
	}

	public List<MachineNode> nodes() {
		return List.copyOf(nodes.values());
	}

	public List<Edge> edges() {
		return List.copyOf(edges);
	}

	public List<Edge> outgoing(NodeId id) {
		return edges.stream().filter(e -> e.source().equals(id)).toList();
	}

	public List<Edge> incoming(NodeId id) {
		return edges.stream().filter(e -> e.target().equals(id)).toList();
	}

	public List<Attribute> machineAttributes() {
		return attributes;
	}

	public List<Annotation> machineAnnotations() {
		return annotations;
	}

	public String qualifiedName(NodeId id) {
		Deque<String> segments = new ArrayDeque<>();
		NodeId cursor = id;
		while (cursor != null) {
			MachineNode node = require(cursor);
			segments.addFirst(node.name());
			cursor = node.parent();
		}
		return String.join(".", segments);
	}

	/**
	 * Finds a node by qualified path, or by simple name when that name is unique.
	 */
	public Optional<NodeId> find(String reference) {
		if (reference == null || reference.isBlank()) {
			return Optional.empty();
		}
		for (MachineNode node : nodes.values()) {
			if (qualifiedName(node.id()).equals(reference)) {
				return Optional.of(node.id());
			}
		}
		List<MachineNode> bySimpleName = nodes.values().stream().filter(n -> n.name().equals(reference)).toList();
		return bySimpleName.size() == 1 ? Optional.of(bySimpleName.get(0).id()) : Optional.empty();
	}

	public NodeId resolve(String reference) {
		return find(reference).orElseThrow(() -> new ToolInvocationException("Unknown or ambiguous node '" + reference + "'"));
	}

	/**
	 * Adds a node under {@code parent} (or at the root) and returns its new id.
	 */
	public NodeId addNode(String name, String type, String nodeTitle, NodeId parent, List<Attribute> nodeAttributes) {
		if (name == null || name.isBlank() || name.contains(".")) {
			throw new ToolInvocationException("Node name must be a simple, non-empty identifier: '" + name + "'");
		}
		boolean duplicate = nodes.values().stream()
				.anyMatch(n -> Objects.equals(n.parent(), parent) && n.name().equals(name));
		if (duplicate) {
			throw new ToolInvocationException("A node named '" + name + "' already exists there");
		}
		NodeId id = new NodeId(nextId++);
		nodes.put(id.value(), new MachineNode(id, name, type, nodeTitle, parent, List.of(), nodeAttributes, List.of()));
		if (parent != null) {
			MachineNode p = require(parent);
			List<NodeId> children = new ArrayList<>(p.children());
			children.add(id);
			replace(new MachineNode(p.id(), p.name(), p.type(), p.title(), p.parent(), children, p.attributes(),
					p.annotations()));
		}
		return id;
	}

	/**
	 * Removes a node, its descendants and every edge, note and dependency touching them.
	 *
	 * @return ids of all removed nodes
	 */
	public List<NodeId> removeNode(NodeId id) {
		MachineNode node = require(id);
		List<NodeId> removed = new ArrayList<>();
		collect(node, removed);
		removed.forEach(r -> nodes.remove(r.value()));
		edges.removeIf(e -> removed.contains(e.source()) || removed.contains(e.target()));
		notes.removeIf(n -> removed.contains(n.target()));
		dependencies.removeIf(d -> removed.contains(d.source()) || removed.contains(d.target()));
		if (node.parent() != null) {
			MachineNode p = require(node.parent());
			List<NodeId> children = new ArrayList<>(p.children());
			children.remove(id);
			replace(new MachineNode(p.id(), p.name(), p.type(), p.title(), p.parent(), children, p.attributes(),
					p.annotations()));
		}
		return removed;
	}

	public void addEdge(Edge edge) {
		require(edge.source());
		require(edge.target());
		edges.add(edge);
	}

	/**
	 * @return number of edges removed
	 */
	public int removeEdges(NodeId source, NodeId target) {
		int before = edges.size();
		edges.removeIf(e -> e.source().equals(source) && e.target().equals(target));
		return before - edges.size();
	}

	/**
	 * Points every edge {@code source -> oldTarget} at {@code newTarget}.
	 *
	 * @return number of edges changed
	 */
	public int retarget(NodeId source, NodeId oldTarget, NodeId newTarget) {
		require(newTarget);
		int changed = 0;
		for (int i = 0; i < edges.size(); i++) {
			Edge edge = edges.get(i);
			if (edge.source().equals(source) && edge.target().equals(oldTarget)) {
				edges.set(i, edge.withEndpoints(source, newTarget));
				changed++;
			}
		}
		return changed;
	}

	/**
	 * Snapshot of the current graph as a canonical machine, renumbering ids in pre-order.
	 */
	public Machine toMachine() {
		MachineAssembler assembler = new MachineAssembler()
				.title(title)
				.attributes(attributes)
				.annotations(annotations)
				.edges(edges)
				.notes(notes)
				.dependencies(dependencies);
		nodes.values().forEach(assembler::node);
		return assembler.assemble();
	}

	private void collect(MachineNode node, List<NodeId> into) {
		into.add(node.id());
		for (NodeId child : node.children()) {
			node(child).ifPresent(c -> collect(c, into));
		}
	}

	private void replace(MachineNode node) {
		nodes.put(node.id().value(), node);
	}
}
