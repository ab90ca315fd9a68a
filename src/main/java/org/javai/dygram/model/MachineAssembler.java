package org.javai.dygram.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a canonical {@link Machine} from nodes carrying arbitrary ids, renumbering them
 * in pre-order and rewriting every edge, note and dependency reference accordingly.
 * References to ids that are not part of the assembled tree are dropped.
 */
public final class MachineAssembler {

	private final Map<Integer, MachineNode> byId = new HashMap<>();
	private final List<Integer> rootOrder = new ArrayList<>();

	private String title;
	private List<Attribute> attributes = List.of();
	private List<Annotation> annotations = List.of();
	private List<Edge> edges = List.of();
	private List<Note> notes = List.of();
	private List<InferredDependency> dependencies = List.of();

	public MachineAssembler title(String machineTitle) {
		this.title = machineTitle;
		return this;
	}

	public MachineAssembler attributes(List<Attribute> machineAttributes) {
		this.attributes = machineAttributes;
		return this;
	}

	public MachineAssembler annotations(List<Annotation> machineAnnotations) {
		this.annotations = machineAnnotations;
		return this;
	}

	public MachineAssembler node(MachineNode node) {
		Objects.requireNonNull(node, "node must not be null");
		byId.put(node.id().value(), node);
		if (node.parent() == null) {
			rootOrder.add(node.id().value());
		}
		return this;
	}

	public MachineAssembler edges(List<Edge> machineEdges) {
		this.edges = machineEdges;
		return this;
	}

	public MachineAssembler notes(List<Note> machineNotes) {
		this.notes = machineNotes;
		return this;
	}

	public MachineAssembler dependencies(List<InferredDependency> inferred) {
		this.dependencies = inferred;
		return this;
	}

	public Machine assemble() {
		Map<Integer, NodeId> remap = new HashMap<>();
		List<Integer> order = new ArrayList<>();
		for (Integer root : rootOrder) {
			visit(root, remap, order);
		}

		List<MachineNode> nodes = new ArrayList<>(order.size());
		for (Integer oldId : order) {
			MachineNode old = byId.get(oldId);
			NodeId parent = old.parent() == null ? null : remap.get(old.parent().value());
			List<NodeId> children = old.children().stream()
					.map(c -> remap.get(c.value()))
					.filter(Objects::nonNull)
					.toList();
			nodes.add(new MachineNode(remap.get(oldId), old.name(), old.type(), old.title(), parent, children,
					old.attributes(), old.annotations()));
		}

		List<Edge> newEdges = new ArrayList<>();
		for (Edge edge : edges) {
			NodeId source = remap.get(edge.source().value());
			NodeId target = remap.get(edge.target().value());
			if (source != null && target != null) {
				newEdges.add(edge.withEndpoints(source, target));
			}
		}
		List<Note> newNotes = new ArrayList<>();
		for (Note note : notes) {
			NodeId target = remap.get(note.target().value());
			if (target != null) {
				newNotes.add(new Note(target, note.targetPath(), note.content(), note.attributes(), note.annotations()));
			}
		}
		List<InferredDependency> newDependencies = new ArrayList<>();
		for (InferredDependency dependency : dependencies) {
			NodeId source = remap.get(dependency.source().value());
			NodeId target = remap.get(dependency.target().value());
			if (source != null && target != null) {
				newDependencies.add(new InferredDependency(source, target, dependency.reason(), dependency.path()));
			}
		}
		return new Machine(title, attributes, annotations, nodes, newEdges, newNotes, newDependencies);
	}

	private void visit(Integer oldId, Map<Integer, NodeId> remap, List<Integer> order) {
		MachineNode node = byId.get(oldId);
		if (node == null || remap.containsKey(oldId)) {
			return;
		}
		remap.put(oldId, new NodeId(order.size()));
		order.add(oldId);
		for (NodeId child : node.children()) {
			visit(child.value(), remap, order);
		}
	}
}
