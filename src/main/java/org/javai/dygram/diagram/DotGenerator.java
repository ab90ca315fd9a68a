package org.javai.dygram.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.dygram.condition.EdgeConditions;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.Note;

/**
 * Renders a machine as a Graphviz DOT digraph. Nodes with children become clusters; arrow
 * types map to Graphviz edge styles.
 */
public class DotGenerator {

	private static final String INDENT = "  ";

	public String generate(Machine machine) {
		Objects.requireNonNull(machine, "machine must not be null");
		StringBuilder sb = new StringBuilder();
		sb.append("digraph \"").append(escape(machine.title() == null ? "machine" : machine.title())).append("\" {\n");
		sb.append(INDENT).append("compound=true;\n");
		sb.append(INDENT).append("rankdir=LR;\n");
		sb.append(INDENT).append("node [fontname=\"Helvetica\"];\n");
		sb.append(INDENT).append("edge [fontname=\"Helvetica\", fontsize=10];\n");
		if (machine.title() != null) {
			sb.append(INDENT).append("label=\"").append(escape(machine.title())).append("\";\n");
			sb.append(INDENT).append("labelloc=t;\n");
		}
		for (MachineNode root : machine.roots()) {
			appendNode(machine, root, sb, 1);
		}
		for (Edge edge : machine.edges()) {
			appendEdge(machine, edge, sb);
		}
		int index = 0;
		for (Note note : machine.notes()) {
			String id = "note_" + index++;
			sb.append(INDENT).append(id).append(" [shape=note, style=filled, fillcolor=\"#fff8c4\", label=\"")
					.append(escape(note.content())).append("\"];\n");
			sb.append(INDENT).append(id).append(" -> ").append(nodeId(machine.node(note.target())))
					.append(" [style=dotted, arrowhead=none];\n");
		}
		sb.append("}\n");
		return sb.toString();
	}

	private void appendNode(Machine machine, MachineNode node, StringBuilder sb, int depth) {
		String indent = INDENT.repeat(depth);
		if (node.isContainer()) {
			sb.append(indent).append("subgraph cluster_").append(node.id().value()).append(" {\n");
			sb.append(indent).append(INDENT).append("label=\"").append(escape(label(node))).append("\";\n");
			sb.append(indent).append(INDENT).append("style=rounded;\n");
			sb.append(indent).append(INDENT).append(nodeId(node)).append(" [shape=point, style=invis];\n");
			for (MachineNode child : machine.children(node.id())) {
				appendNode(machine, child, sb, depth + 1);
			}
			sb.append(indent).append("}\n");
			return;
		}
		sb.append(indent).append(nodeId(node)).append(" [label=\"").append(escape(label(node))).append("\", ")
				.append(shape(node)).append("];\n");
	}

	private void appendEdge(Machine machine, Edge edge, StringBuilder sb) {
		MachineNode source = machine.node(edge.source());
		MachineNode target = machine.node(edge.target());
		List<String> attributes = new ArrayList<>();
		String label = edgeLabel(edge);
		if (!label.isEmpty()) {
			attributes.add("label=\"" + escape(label) + "\"");
		}
		if (edge.sourceMultiplicity() != null) {
			attributes.add("taillabel=\"" + escape(edge.sourceMultiplicity()) + "\"");
		}
		if (edge.targetMultiplicity() != null) {
			attributes.add("headlabel=\"" + escape(edge.targetMultiplicity()) + "\"");
		}
		if (source.isContainer()) {
			attributes.add("ltail=cluster_" + source.id().value());
		}
		if (target.isContainer()) {
			attributes.add("lhead=cluster_" + target.id().value());
		}
		switch (edge.arrowType()) {
			case DEPENDENCY -> attributes.add("style=dashed");
			case INHERITANCE -> attributes.add("arrowhead=empty");
			case COMPOSITION -> attributes.add("dir=both, arrowtail=diamond");
			case AGGREGATION -> attributes.add("dir=both, arrowtail=odiamond");
			case BIDIRECTIONAL -> attributes.add("dir=both");
			case EMPHASIS -> attributes.add("penwidth=2.5");
			case ASSOCIATION -> {
				// default style
			}
		}
		sb.append(INDENT).append(nodeId(source)).append(" -> ").append(nodeId(target));
		if (!attributes.isEmpty()) {
			sb.append(" [").append(String.join(", ", attributes)).append("]");
		}
		sb.append(";\n");
	}

	private String edgeLabel(Edge edge) {
		StringBuilder sb = new StringBuilder();
		if (edge.label() != null && !EdgeConditions.hasGuard(edge)) {
			sb.append(edge.label());
		}
		EdgeConditions.combinedExpression(edge).ifPresent(c -> {
			if (sb.length() > 0) {
				sb.append("\n");
			}
			sb.append('[').append(c).append(']');
		});
		return sb.toString();
	}

	private static String label(MachineNode node) {
		StringBuilder sb = new StringBuilder();
		if (node.type() != null) {
			sb.append("<<").append(node.type()).append(">>\n");
		}
		sb.append(node.title() != null && !node.title().isBlank() ? node.title() : node.name());
		return sb.toString();
	}

	private static String shape(MachineNode node) {
		String type = node.type() == null ? "" : node.type().toLowerCase();
		return switch (type) {
			case "init" -> "shape=circle, style=filled, fillcolor=\"#d5f5d5\"";
			case "state" -> "shape=ellipse";
			case "task" -> "shape=box, style=rounded";
			case "context" -> "shape=cylinder";
			case "note" -> "shape=note";
			default -> "shape=box";
		};
	}

	private static String nodeId(MachineNode node) {
		return "n" + node.id().value();
	}

	static String escape(String text) {
		return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
	}
}
