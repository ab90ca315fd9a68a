package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.dygram.build.QualifiedNameExpander;
import org.javai.dygram.condition.ConditionEvaluator;
import org.javai.dygram.condition.EdgeConditions;
import org.javai.dygram.condition.EvaluationContext;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.javai.dygram.validate.GraphAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets a validated machine one decision at a time.
 * <p>
 * The engine never waits for anything itself: {@link #enumerateTools(ExecutionState)} lists
 * what may be done at the current node and {@link #applyDecision(ExecutionState, ToolChoice)}
 * applies the choice an external decision-maker made. Each meta tool invocation is atomic:
 * a failing invocation restores the graph and the context store it started from.
 */
public class ExecutionEngine {

	private static final Logger logger = LoggerFactory.getLogger(ExecutionEngine.class);
	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	public static final String TRANSITION_PREFIX = "transition_to_";
	public static final String META_ATTRIBUTE = "meta";
	public static final String STATE_TYPE = "state";

	private static final Pattern WRITE_INTENT = Pattern.compile("\\b(write|update|set|store)", Pattern.CASE_INSENSITIVE);

	private final ConditionEvaluator evaluator;

	public ExecutionEngine() {
		this(new ConditionEvaluator());
	}

	public ExecutionEngine(ConditionEvaluator evaluator) {
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
	}

	/**
	 * Starts a run at the first {@code init} node.
	 *
	 * @throws ExecutionFault with {@link FaultReason#NO_ENTRY_POINT} if the machine has no init node
	 */
	public ExecutionState start(Machine machine) {
		Objects.requireNonNull(machine, "machine must not be null");
		MachineNode entry = machine.nodes().stream()
				.filter(n -> n.isType(GraphAnalyzer.INIT_TYPE))
				.findFirst()
				.orElseThrow(() -> new ExecutionFault(FaultReason.NO_ENTRY_POINT,
						"Machine '%s' has no init node".formatted(machine.title())));
		RuntimeGraph graph = RuntimeGraph.of(machine);
		ExecutionState state = new ExecutionState(machine, graph, ContextStore.seededFrom(graph), entry.id());
		state.moveTo(entry.id());
		if (entry.isType(STATE_TYPE)) {
			state.activeState(entry.name());
		}
		logger.info("Started run of '{}' at {}", machine.title(), state.currentNodePath());
		completeIfTerminal(state);
		return state;
	}

	/**
	 * Tools offered at the current node: one transition per eligible outgoing edge, followed by
	 * the meta tools the node is permitted to use. A finished run has no tools.
	 */
	public ToolSet enumerateTools(ExecutionState state) {
		Objects.requireNonNull(state, "state must not be null");
		if (state.status().isTerminal()) {
			return ToolSet.empty();
		}
		ContextAccess access = contextAccess(state);
		ToolSet tools = new ToolSet(access);
		addTransitions(state, tools);
		addMetaTools(state, access, tools);
		return tools;
	}

	/**
	 * Applies one tool invocation to the run.
	 *
	 * @throws ExecutionFault with {@link FaultReason#UNKNOWN_TOOL} if the tool is not offered at
	 * the current node; the run is failed
	 * @throws IllegalStateException if the run already finished
	 */
	public StepOutcome applyDecision(ExecutionState state, ToolChoice choice) {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(choice, "choice must not be null");
		if (state.status().isTerminal()) {
			throw new IllegalStateException("Run already finished with status " + state.status());
		}
		ToolSet tools = enumerateTools(state);
		ToolBinding binding = tools.binding(choice.name()).orElse(null);
		if (binding == null) {
			ExecutionFault fault = new ExecutionFault(FaultReason.UNKNOWN_TOOL,
					"Tool '%s' is not available at %s; available: %s".formatted(choice.name(), state.currentNodePath(),
							tools.names()));
			state.fail(fault);
			logger.error("Run failed: {}", fault.getMessage());
			throw fault;
		}
		if (binding instanceof ToolBinding.Transition transition) {
			return transition(state, choice, transition);
		}
		return invokeMeta(state, choice, ((ToolBinding.Meta) binding).tool(), tools.access());
	}

	/**
	 * Completes a run whose current node offers no transition, e.g. after the decision-maker
	 * declined to use the remaining context tools.
	 *
	 * @throws IllegalStateException if transitions are still available
	 */
	public void finish(ExecutionState state) {
		Objects.requireNonNull(state, "state must not be null");
		if (state.status().isTerminal()) {
			return;
		}
		ToolSet tools = enumerateTools(state);
		if (tools.hasTransitions()) {
			throw new IllegalStateException("Node %s still offers transitions %s".formatted(state.currentNodePath(),
					tools.transitions().stream().map(ToolDefinition::name).toList()));
		}
		state.complete();
		logger.info("Run completed at {} after {} steps", state.currentNodePath(), state.stepCount());
	}

	/**
	 * Variables visible to edge guards: node attributes as the run currently sees them, the
	 * machine's own attributes and the built-ins.
	 */
	public EvaluationContext evaluationContext(ExecutionState state) {
		RuntimeGraph graph = state.graph();
		EvaluationContext.Builder builder = EvaluationContext.builder()
				.errorCount(state.errorCount())
				.activeState(state.activeState());
		List<MachineNode> nodes = graph.nodes();
		Map<NodeId, Map<String, Object>> values = new HashMap<>();
		for (MachineNode node : nodes) {
			String path = graph.qualifiedName(node.id());
			Map<String, Object> attributes = new LinkedHashMap<>();
			List<Attribute> current = state.context().contains(path) ? state.context().attributes(path) : node.attributes();
			for (Attribute attribute : current) {
				attributes.put(attribute.name(), attribute.value().toJava());
			}
			values.put(node.id(), attributes);
			builder.node(path, attributes);
		}
		for (MachineNode node : nodes) {
			builder.nodeIfAbsent(node.name(), values.get(node.id()));
		}
		for (Attribute attribute : graph.machineAttributes()) {
			builder.variableIfAbsent(attribute.name(), attribute.value().toJava());
		}
		return builder.build();
	}

	private StepOutcome transition(ExecutionState state, ToolChoice choice, ToolBinding.Transition transition) {
		String from = state.currentNodePath();
		state.moveTo(transition.target());
		MachineNode target = state.graph().require(transition.target());
		if (target.isType(STATE_TYPE)) {
			state.activeState(target.name());
		}
		JsonNode reason = choice.input().get("reason");
		String detail = reason == null || reason.isNull() ? "" : reason.asText();
		state.record(new StepRecord(state.stepCount() + 1, from, choice.name(), transition.targetPath(), true, detail));
		logger.info("Transition {} -> {}{}", from, transition.targetPath(), detail.isEmpty() ? "" : " (" + detail + ")");
		completeIfTerminal(state);
		ObjectNode output = JSON_MAPPER.createObjectNode().put("node", transition.targetPath());
		return new StepOutcome(state, ToolResult.ok(choice.name(), output, "Moved to " + transition.targetPath()));
	}

	private StepOutcome invokeMeta(ExecutionState state, ToolChoice choice, MetaTool tool, ContextAccess access) {
		String at = state.currentNodePath();
		ExecutionState.Checkpoint checkpoint = state.checkpoint();
		try {
			ToolResult result = MetaTools.apply(tool, state, access, choice.input());
			state.record(new StepRecord(state.stepCount() + 1, at, choice.name(), null, true, result.message()));
			logger.debug("{} at {}: {}", choice.name(), at, result.message());
			completeIfTerminal(state);
			return new StepOutcome(state, result);
		} catch (ToolInvocationException e) {
			state.rollback(checkpoint);
			state.incrementErrors();
			state.record(new StepRecord(state.stepCount() + 1, at, choice.name(), null, false, e.getMessage()));
			logger.warn("{} at {} rejected: {}", choice.name(), at, e.getMessage());
			return new StepOutcome(state, ToolResult.failed(choice.name(), e.getMessage()));
		}
	}

	private void completeIfTerminal(ExecutionState state) {
		if (enumerateTools(state).isEmpty()) {
			state.complete();
			logger.info("Run completed at terminal node {} after {} steps", state.currentNodePath(), state.stepCount());
		}
	}

	private void addTransitions(ExecutionState state, ToolSet tools) {
		RuntimeGraph graph = state.graph();
		NodeId current = state.currentNode();
		EvaluationContext context = evaluationContext(state);
		Map<NodeId, Edge> eligible = new LinkedHashMap<>();
		for (Edge edge : candidateEdges(graph, current)) {
			NodeId target = edge.source().equals(current) ? edge.target() : edge.source();
			MachineNode node = graph.node(target).orElse(null);
			if (node == null || eligible.containsKey(target) || !isTransitionTarget(node)) {
				continue;
			}
			if (EdgeConditions.isEligible(edge, evaluator, context)) {
				eligible.put(target, edge);
			}
		}

		Map<String, Integer> simpleNames = new HashMap<>();
		eligible.keySet().forEach(id -> simpleNames.merge(graph.require(id).name(), 1, Integer::sum));
		Set<String> used = new HashSet<>();
		for (Map.Entry<NodeId, Edge> entry : eligible.entrySet()) {
			MachineNode target = graph.require(entry.getKey());
			String path = graph.qualifiedName(target.id());
			String suffix = simpleNames.get(target.name()) > 1 ? path.replace('.', '_') : target.name();
			String name = TRANSITION_PREFIX + sanitize(suffix);
			if (!used.add(name)) {
				name = TRANSITION_PREFIX + sanitize(path.replace('.', '_')) + "_" + target.id().value();
				used.add(name);
			}
			tools.add(new ToolDefinition(name, transitionDescription(target, path, entry.getValue()), transitionSchema()),
					new ToolBinding.Transition(target.id(), path));
		}
	}

	private List<Edge> candidateEdges(RuntimeGraph graph, NodeId current) {
		List<Edge> edges = new ArrayList<>();
		for (Edge edge : graph.outgoing(current)) {
			if (edge.arrowType().isTraversable()) {
				edges.add(edge);
			}
		}
		for (Edge edge : graph.incoming(current)) {
			if (edge.arrowType().isBidirectional() && !edge.source().equals(current)) {
				edges.add(edge);
			}
		}
		return edges;
	}

	private boolean isTransitionTarget(MachineNode node) {
		return !node.isType(ContextStore.CONTEXT_TYPE) && !node.isType(QualifiedNameExpander.NOTE_TYPE);
	}

	private String transitionDescription(MachineNode target, String path, Edge edge) {
		StringBuilder sb = new StringBuilder("Transition to ").append(path);
		if (target.title() != null && !target.title().isBlank()) {
			sb.append(" (").append(target.title()).append(")");
		}
		if (edge.label() != null && !edge.label().isBlank() && !EdgeConditions.hasGuard(edge)) {
			sb.append(": ").append(edge.label());
		}
		EdgeConditions.combinedExpression(edge).ifPresent(c -> sb.append(" [when ").append(c).append("]"));
		return sb.toString();
	}

	private ObjectNode transitionSchema() {
		ObjectNode schema = JSON_MAPPER.createObjectNode();
		schema.put("type", "object");
		schema.putObject("properties").set("reason", MetaTools.stringProperty("Why this transition was chosen"));
		return schema;
	}

	private void addMetaTools(ExecutionState state, ContextAccess access, ToolSet tools) {
		if (access.unrestricted()) {
			for (MetaTool tool : MetaTool.values()) {
				tools.add(MetaTools.definition(tool, state, access), new ToolBinding.Meta(tool));
			}
			return;
		}
		if (access.hasRead()) {
			tools.add(MetaTools.definition(MetaTool.GET_CONTEXT_VALUE, state, access),
					new ToolBinding.Meta(MetaTool.GET_CONTEXT_VALUE));
			tools.add(MetaTools.definition(MetaTool.LIST_CONTEXT_NODES, state, access),
					new ToolBinding.Meta(MetaTool.LIST_CONTEXT_NODES));
		}
		if (access.hasWrite()) {
			tools.add(MetaTools.definition(MetaTool.SET_CONTEXT_VALUE, state, access),
					new ToolBinding.Meta(MetaTool.SET_CONTEXT_VALUE));
		}
	}

	/**
	 * Meta nodes may use every meta tool on every node; other nodes may read the context nodes
	 * they are connected to and write those whose edge says so.
	 */
	ContextAccess contextAccess(ExecutionState state) {
		RuntimeGraph graph = state.graph();
		MachineNode current = graph.require(state.currentNode());
		if (isMeta(current.attribute(META_ATTRIBUTE).map(Attribute::value).orElse(null))
				|| current.hasAnnotation(META_ATTRIBUTE)
				|| graph.machineAttributes().stream().anyMatch(a -> a.name().equals(META_ATTRIBUTE) && isMeta(a.value()))
				|| graph.machineAnnotations().stream().anyMatch(a -> a.name().equalsIgnoreCase(META_ATTRIBUTE))) {
			return ContextAccess.unrestrictedAccess();
		}
		Set<String> readable = new HashSet<>();
		Set<String> writable = new HashSet<>();
		List<Edge> incident = new ArrayList<>(graph.outgoing(current.id()));
		incident.addAll(graph.incoming(current.id()));
		for (Edge edge : incident) {
			NodeId other = edge.source().equals(current.id()) ? edge.target() : edge.source();
			MachineNode node = graph.node(other).orElse(null);
			if (node == null || !node.isType(ContextStore.CONTEXT_TYPE)) {
				continue;
			}
			String path = graph.qualifiedName(other);
			readable.add(path);
			if (mentionsWrite(edge)) {
				writable.add(path);
			}
		}
		if (readable.isEmpty()) {
			return ContextAccess.NONE;
		}
		return new ContextAccess(false, readable, writable);
	}

	private boolean mentionsWrite(Edge edge) {
		if (edge.label() != null && WRITE_INTENT.matcher(edge.label()).find()) {
			return true;
		}
		return edge.attributes().stream()
				.anyMatch(a -> WRITE_INTENT.matcher(a.name()).find() || WRITE_INTENT.matcher(a.value().asText()).find());
	}

	private static boolean isMeta(AttributeValue value) {
		if (value instanceof AttributeValue.Bool bool) {
			return bool.value();
		}
		return value instanceof AttributeValue.Text text && text.value().equalsIgnoreCase("true");
	}

	private static String sanitize(String name) {
		StringBuilder sb = new StringBuilder(name.length());
		name.codePoints().forEach(cp -> sb.appendCodePoint(Character.isLetterOrDigit(cp) || cp == '_' ? cp : '_'));
		return sb.toString();
	}
}
