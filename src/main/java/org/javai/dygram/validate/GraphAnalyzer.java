package org.javai.dygram.validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;

/**
 * Reachability, orphan and cycle analysis over a machine's edges.
 * <p>
 * Notes, context and style nodes and container nodes describe the machine rather than
 * take part in its control flow, so they are never reported as unreachable or orphaned.
 */
public class GraphAnalyzer {

	public static final String INIT_TYPE = "init";

	private static final Set<String> NON_FLOW_TYPES = Set.of("note", "context", "style");

	private final Machine machine;
	private final Map<NodeId, List<NodeId>> adjacency = new HashMap<>();
	private final Set<NodeId> connected = new HashSet<>();

	public GraphAnalyzer(Machine machine) {
		this.machine = Objects.requireNonNull(machine, "machine must not be null");
		for (Edge edge : machine.edges()) {
			adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
			connected.add(edge.source());
			connected.add(edge.target());
		}
	}

	public List<MachineNode> entryPoints() {
		return machine.nodesOfType(INIT_TYPE);
	}

	/**
	 * Nodes that take part in control flow but cannot be reached from any init node.
	 * Empty when the machine has no init node.
	 */
	public List<MachineNode> unreachableNodes() {
		List<MachineNode> entries = entryPoints();
		if (entries.isEmpty()) {
			return List.of();
		}
		Set<NodeId> reached = new HashSet<>();
		Deque<NodeId> queue = new ArrayDeque<>();
		for (MachineNode entry : entries) {
			reached.add(entry.id());
			queue.add(entry.id());
		}
		while (!queue.isEmpty()) {
			NodeId current = queue.poll();
			for (NodeId next : successors(current)) {
				if (reached.add(next)) {
					queue.add(next);
				}
			}
		}
		return machine.nodes().stream()
				.filter(this::isFlowNode)
				.filter(n -> !reached.contains(n.id()))
				.toList();
	}

	/**
	 * Flow nodes without any incident edge, init nodes excluded.
	 */
	public List<MachineNode> orphanNodes() {
		return machine.nodes().stream()
				.filter(this::isFlowNode)
				.filter(n -> !n.isType(INIT_TYPE))
				.filter(n -> !connected.contains(n.id()))
				.toList();
	}

	/**
	 * Distinct cycles found by depth-first search in id order. Each path starts and ends with
	 * the same node, e.g. {@code [a, b, c, a]}.
	 */
	public List<List<NodeId>> cycles() {
		List<List<NodeId>> result = new ArrayList<>();
		Set<List<NodeId>> seen = new HashSet<>();
		Set<NodeId> visited = new HashSet<>();
		for (MachineNode node : machine.nodes()) {
			if (!visited.contains(node.id())) {
				dfs(node.id(), visited, new LinkedHashSet<>(), new ArrayList<>(), result, seen);
			}
		}
		return result;
	}

	private void dfs(NodeId node, Set<NodeId> visited, Set<NodeId> onStack, List<NodeId> path,
			List<List<NodeId>> result, Set<List<NodeId>> seen) {
		visited.add(node);
		onStack.add(node);
		path.add(node);
		for (NodeId next : successors(node)) {
			if (onStack.contains(next)) {
				List<NodeId> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
				if (seen.add(canonical(cycle))) {
					cycle.add(next);
					result.add(List.copyOf(cycle));
				}
			} else if (!visited.contains(next)) {
				dfs(next, visited, onStack, path, result, seen);
			}
		}
		onStack.remove(node);
		path.remove(path.size() - 1);
	}

	/**
	 * Rotation of the cycle starting at its smallest id, so each cycle is reported once.
	 */
	private List<NodeId> canonical(List<NodeId> cycle) {
		int start = cycle.indexOf(cycle.stream().min(NodeId::compareTo).orElseThrow());
		List<NodeId> rotated = new ArrayList<>(cycle.subList(start, cycle.size()));
		rotated.addAll(cycle.subList(0, start));
		return rotated;
	}

	public GraphStatistics statistics() {
		int exits = (int) machine.nodes().stream()
				.filter(this::isFlowNode)
				.filter(n -> connected.contains(n.id()))
				.filter(n -> successors(n.id()).isEmpty())
				.count();
		return new GraphStatistics(machine.nodes().size(), machine.edges().size(), entryPoints().size(), exits,
				cycles().size());
	}

	private List<NodeId> successors(NodeId node) {
		return adjacency.getOrDefault(node, List.of());
	}

	private boolean isFlowNode(MachineNode node) {
		if (node.isContainer()) {
			return false;
		}
		return node.type() == null || !NON_FLOW_TYPES.contains(node.type().toLowerCase());
	}
}
