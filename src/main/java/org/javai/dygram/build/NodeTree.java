package org.javai.dygram.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.dygram.model.Annotation;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineAssembler;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.javai.dygram.model.Note;

/**
 * Mutable forest of nodes produced by qualified-name expansion.
 */
public final class NodeTree {

	private final List<MutableNode> arena = new ArrayList<>();
	private final List<MutableNode> roots = new ArrayList<>();

	MutableNode create(MutableNode parent, String name) {
		MutableNode node = new MutableNode(arena.size(), name, parent);
		arena.add(node);
		if (parent == null) {
			roots.add(node);
		} else {
			parent.children.add(node);
		}
		return node;
	}

	Optional<MutableNode> child(MutableNode parent, String name) {
		if (parent != null) {
			return parent.child(name);
		}
		return roots.stream().filter(r -> r.name.equals(name)).findFirst();
	}

	/**
	 * Follows a dotted path down from {@code scope} (or the roots when {@code null}).
	 */
	Optional<MutableNode> descend(MutableNode scope, String dottedPath) {
		MutableNode cursor = scope;
		for (String segment : dottedPath.split("\\.")) {
			Optional<MutableNode> next = child(cursor, segment);
			if (next.isEmpty()) {
				return Optional.empty();
			}
			cursor = next.get();
		}
		return Optional.ofNullable(cursor);
	}

	/**
	 * Looks a path up relative to {@code scope}, then each enclosing scope, then the roots.
	 */
	Optional<MutableNode> lookup(MutableNode scope, String dottedPath) {
		MutableNode cursor = scope;
		while (cursor != null) {
			Optional<MutableNode> found = descend(cursor, dottedPath);
			if (found.isPresent()) {
				return found;
			}
			cursor = cursor.parent;
		}
		return descend(null, dottedPath);
	}

	/**
	 * Creates whatever part of the path is missing below {@code scope} and returns the leaf.
	 */
	MutableNode ensurePath(MutableNode scope, String dottedPath) {
		MutableNode cursor = scope;
		for (String segment : dottedPath.split("\\.")) {
			MutableNode parent = cursor;
			cursor = child(parent, segment).orElseGet(() -> create(parent, segment));
		}
		return cursor;
	}

	public int size() {
		return arena.size();
	}

	/**
	 * Snapshot of the tree as a canonical machine with the given edges and notes, whose
	 * ids must refer to this tree's arena ids.
	 */
	Machine freeze(String title, List<Attribute> attributes, List<Annotation> annotations, List<Edge> edges,
			List<Note> notes) {
		MachineAssembler assembler = new MachineAssembler()
				.title(title)
				.attributes(attributes)
				.annotations(annotations)
				.edges(edges)
				.notes(notes);
		for (MutableNode node : arena) {
			assembler.node(new MachineNode(
					new NodeId(node.id),
					node.name,
					node.type,
					node.title,
					node.parent == null ? null : new NodeId(node.parent.id),
					node.children.stream().map(c -> new NodeId(c.id)).toList(),
					node.attributes,
					node.annotations));
		}
		return assembler.assemble();
	}

	MutableNode byId(int id) {
		return arena.get(id);
	}
}
