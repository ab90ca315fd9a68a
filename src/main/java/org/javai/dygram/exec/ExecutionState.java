package org.javai.dygram.exec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.NodeId;

/**
 * State of one run: where it is, what it has seen and what it holds. Owned by a single
 * run and never shared; only {@link ExecutionEngine} mutates it.
 */
public final class ExecutionState {

	private final Machine source;
	private final Instant startedAt = Instant.now();
	private RuntimeGraph graph;
	private ContextStore context;
	private NodeId currentNode;
	private Map<NodeId, Integer> visitCounts = new HashMap<>();
	private final List<StepRecord> history = new ArrayList<>();
	private int errorCount;
	private String activeState;
	private RunStatus status = RunStatus.RUNNING;
	private ExecutionFault fault;

	ExecutionState(Machine source, RuntimeGraph graph, ContextStore context, NodeId start) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.graph = graph;
		this.context = context;
		this.currentNode = start;
	}

	/**
	 * The validated machine the run started from. Runtime edits never touch it.
	 */
	public Machine source() {
		return source;
	}

	public Instant startedAt() {
		return startedAt;
	}

	public RuntimeGraph graph() {
		return graph;
	}

	public ContextStore context() {
		return context;
	}

	public NodeId currentNode() {
		return currentNode;
	}

	public String currentNodePath() {
		return graph.qualifiedName(currentNode);
	}

	public int visitCount(NodeId node) {
		return visitCounts.getOrDefault(node, 0);
	}

	public Map<NodeId, Integer> visitCounts() {
		return Collections.unmodifiableMap(visitCounts);
	}

	public List<StepRecord> history() {
		return Collections.unmodifiableList(history);
	}

	public int stepCount() {
		return history.size();
	}

	public int errorCount() {
		return errorCount;
	}

	public String activeState() {
		return activeState;
	}

	public RunStatus status() {
		return status;
	}

	public ExecutionFault fault() {
		return fault;
	}

	void moveTo(NodeId node) {
		this.currentNode = node;
		visitCounts.merge(node, 1, Integer::sum);
	}

	void activeState(String state) {
		this.activeState = state;
	}

	void incrementErrors() {
		errorCount++;
	}

	void record(StepRecord step) {
		history.add(step);
	}

	void complete() {
		this.status = RunStatus.COMPLETED;
	}

	void fail(ExecutionFault executionFault) {
		this.status = RunStatus.FAILED;
		this.fault = executionFault;
	}

	Checkpoint checkpoint() {
		return new Checkpoint(graph.copy(), context.snapshot(), currentNode, new HashMap<>(visitCounts), activeState);
	}

	void rollback(Checkpoint checkpoint) {
		this.graph = checkpoint.graph();
		this.context = checkpoint.context();
		this.currentNode = checkpoint.currentNode();
		this.visitCounts = new HashMap<>(checkpoint.visitCounts());
		this.activeState = checkpoint.activeState();
	}

	record Checkpoint(RuntimeGraph graph, ContextStore context, NodeId currentNode, Map<NodeId, Integer> visitCounts,
			String activeState) {
	}
}
