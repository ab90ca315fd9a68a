package org.javai.dygram.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import org.javai.dygram.build.CompilationResult;
import org.javai.dygram.build.MachineCompiler;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.Machine;
import org.junit.jupiter.api.Test;

class ExecutionEngineTest {

	private static final ObjectMapper JSON = new ObjectMapper();

	private static final String COUNTER = """
			init start;
			context memory { count<number>: 0; summary: "none"; }
			state high;
			state low;
			start -"store results"-> memory;
			start -when: "memory.count > 3"-> high;
			start -unless: "memory.count > 3"-> low;
			""";

	private final ExecutionEngine engine = new ExecutionEngine();

	@Test
	void startsAtTheInitNode() {
		ExecutionState state = engine.start(compile("init start; state done; start -> done;"));

		assertThat(state.currentNodePath()).isEqualTo("start");
		assertThat(state.visitCount(state.currentNode())).isEqualTo(1);
		assertThat(state.status()).isEqualTo(RunStatus.RUNNING);
		assertThat(state.activeState()).isNull();
	}

	@Test
	void machineWithoutInitNodeCannotStart() {
		assertThatThrownBy(() -> engine.start(compile("task a; task b; a -> b;")))
				.isInstanceOf(ExecutionFault.class)
				.satisfies(e -> assertThat(((ExecutionFault) e).reason()).isEqualTo(FaultReason.NO_ENTRY_POINT));
	}

	@Test
	void falseGuardHidesTransition() {
		ExecutionState state = engine.start(compile("""
				init start;
				state a;
				state b;
				start -when: "errorCount > 0"-> a;
				start -> b;
				"""));

		ToolSet tools = engine.enumerateTools(state);

		assertThat(tools.transitions()).extracting(ToolDefinition::name).containsExactly("transition_to_b");
		assertThat(tools.size()).isEqualTo(1);
	}

	@Test
	void transitionToolsAcceptAReason() {
		ExecutionState state = engine.start(compile("init start; state done \"Done\"; start -\"finish up\"-> done;"));

		ToolDefinition transition = engine.enumerateTools(state).transitions().get(0);

		assertThat(transition.description()).isEqualTo("Transition to done (Done): finish up");
		assertThat(transition.inputSchema().get("properties").has("reason")).isTrue();
	}

	@Test
	void transitionMovesRecordsAndCompletesAtTerminalNode() {
		ExecutionState state = engine.start(compile("init start; state done; start -> done;"));

		StepOutcome outcome = engine.applyDecision(state, choice("transition_to_done", "{\"reason\": \"all good\"}"));

		assertThat(outcome.result().success()).isTrue();
		assertThat(state.currentNodePath()).isEqualTo("done");
		assertThat(state.activeState()).isEqualTo("done");
		assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
		assertThat(state.history()).singleElement().satisfies(step -> {
			assertThat(step.node()).isEqualTo("start");
			assertThat(step.target()).isEqualTo("done");
			assertThat(step.detail()).isEqualTo("all good");
		});
		assertThat(engine.enumerateTools(state).isEmpty()).isTrue();
	}

	@Test
	void contextNodesAndStructuralEdgesAreNotTransitions() {
		ExecutionState state = engine.start(compile("""
				init start;
				context settings { limit: 1; }
				task base;
				state next;
				start -> settings;
				start <|-- base;
				start -> next;
				"""));

		assertThat(engine.enumerateTools(state).transitions()).extracting(ToolDefinition::name)
				.containsExactly("transition_to_next");
	}

	@Test
	void sameSimpleNameUsesQualifiedToolNames() {
		ExecutionState state = engine.start(compile("""
				init start;
				A { state done; }
				B { state done; }
				start -> A.done;
				start -> B.done;
				"""));

		assertThat(engine.enumerateTools(state).names()).containsExactly("transition_to_A_done", "transition_to_B_done");
	}

	@Test
	void bidirectionalEdgesCanBeFollowedBackwards() {
		ExecutionState state = engine.start(compile("""
				init start;
				state a;
				state b;
				start -> a;
				a <--> b;
				"""));

		engine.applyDecision(state, ToolChoice.of("transition_to_a"));
		engine.applyDecision(state, ToolChoice.of("transition_to_b"));

		assertThat(engine.enumerateTools(state).names()).containsExactly("transition_to_a");
		engine.applyDecision(state, ToolChoice.of("transition_to_a"));
		assertThat(state.visitCount(state.currentNode())).isEqualTo(2);
	}

	@Test
	void unknownToolFailsTheRun() {
		ExecutionState state = engine.start(compile("init start; state done; start -> done;"));

		assertThatThrownBy(() -> engine.applyDecision(state, ToolChoice.of("transition_to_nowhere")))
				.isInstanceOf(ExecutionFault.class)
				.hasMessageContaining("transition_to_nowhere");
		assertThat(state.status()).isEqualTo(RunStatus.FAILED);
		assertThat(state.fault().reason()).isEqualTo(FaultReason.UNKNOWN_TOOL);
	}

	@Test
	void finishedRunRejectsFurtherDecisions() {
		ExecutionState state = engine.start(compile("init start; state done; start -> done;"));
		engine.applyDecision(state, ToolChoice.of("transition_to_done"));

		assertThatThrownBy(() -> engine.applyDecision(state, ToolChoice.of("transition_to_done")))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void connectedContextNodeGrantsReadAndWriteTools() {
		ExecutionState state = engine.start(compile(COUNTER));

		ToolSet tools = engine.enumerateTools(state);

		assertThat(tools.names()).containsExactly("transition_to_low", "get_context_value", "list_context_nodes",
				"set_context_value");
		assertThat(tools.access().canWrite("memory")).isTrue();
	}

	@Test
	void readOnlyEdgeGrantsOnlyReadTools() {
		ExecutionState state = engine.start(compile("""
				init start;
				context memory { count: 0; }
				state done;
				start -"reads"-> memory;
				start -> done;
				"""));

		assertThat(engine.enumerateTools(state).names()).containsExactly("transition_to_done", "get_context_value",
				"list_context_nodes");
	}

	@Test
	void writtenContextValueCanBeReadBack() {
		ExecutionState state = engine.start(compile(COUNTER));

		StepOutcome write = engine.applyDecision(state, choice("set_context_value",
				"{\"node\": \"memory\", \"values\": {\"count\": 5, \"summary\": \"busy\"}}"));
		StepOutcome read = engine.applyDecision(state, choice("get_context_value",
				"{\"node\": \"memory\", \"attribute\": \"count\"}"));

		assertThat(write.result().success()).isTrue();
		assertThat(read.result().success()).isTrue();
		assertThat(read.result().output().decimalValue()).isEqualByComparingTo(BigDecimal.valueOf(5));
		assertThat(state.context().get("memory", "summary")).contains(AttributeValue.text("busy"));
	}

	@Test
	void contextWritesFeedGuards() {
		ExecutionState state = engine.start(compile(COUNTER));

		engine.applyDecision(state, choice("set_context_value", "{\"node\": \"memory\", \"values\": {\"count\": 5}}"));

		assertThat(engine.enumerateTools(state).transitions()).extracting(ToolDefinition::name)
				.containsExactly("transition_to_high");
	}

	@Test
	void legacySingleValueWriteIsAccepted() {
		ExecutionState state = engine.start(compile(COUNTER));

		engine.applyDecision(state, choice("set_context_value", "{\"node\": \"memory\", \"attribute\": \"count\", \"value\": \"7\"}"));

		assertThat(state.context().get("memory", "count")).contains(AttributeValue.number(7));
	}

	@Test
	void rejectedWriteRollsBackAndCountsAnError() {
		ExecutionState state = engine.start(compile(COUNTER + """
				state recovery;
				start -when: "errorCount > 0"-> recovery;
				"""));

		StepOutcome outcome = engine.applyDecision(state, choice("set_context_value",
				"{\"node\": \"memory\", \"values\": {\"summary\": \"changed\", \"count\": \"lots\"}}"));

		assertThat(outcome.result().success()).isFalse();
		assertThat(outcome.result().message()).contains("count");
		assertThat(state.errorCount()).isEqualTo(1);
		assertThat(state.context().get("memory", "summary")).contains(AttributeValue.text("none"));
		assertThat(state.context().get("memory", "count")).contains(AttributeValue.number(0));
		assertThat(state.history()).singleElement().satisfies(step -> assertThat(step.success()).isFalse());
		assertThat(state.status()).isEqualTo(RunStatus.RUNNING);
		assertThat(engine.enumerateTools(state).names()).contains("transition_to_recovery");
	}

	@Test
	void writeWithoutAccessIsRejected() {
		ExecutionState state = engine.start(compile("""
				init start;
				context memory { count: 0; }
				context other { count: 0; }
				state done;
				start -"update"-> memory;
				start -> done;
				"""));

		StepOutcome outcome = engine.applyDecision(state, choice("set_context_value",
				"{\"node\": \"other\", \"values\": {\"count\": 1}}"));

		assertThat(outcome.result().success()).isFalse();
		assertThat(outcome.result().message()).contains("No write access to 'other'");
	}

	@Test
	void metaNodesCanReshapeTheRunningGraph() {
		Machine machine = compile("""
				machine "Dynamic"
				meta: true;
				init start;
				state done;
				start -> done;
				""");
		ExecutionState state = engine.start(machine);

		assertThat(engine.enumerateTools(state).names()).contains("add_node", "remove_node", "modify_edge");
		engine.applyDecision(state, choice("add_node", "{\"name\": \"review\", \"type\": \"state\"}"));
		engine.applyDecision(state, choice("modify_edge", "{\"action\": \"add\", \"target\": \"review\", \"label\": \"check\"}"));
		engine.applyDecision(state, ToolChoice.of("transition_to_review"));

		assertThat(state.currentNodePath()).isEqualTo("review");
		assertThat(state.status()).isEqualTo(RunStatus.RUNNING);
		assertThat(machine.findByPath("review")).isEmpty();
		engine.finish(state);
		assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
	}

	@Test
	void removingTheCurrentNodeIsRejected() {
		ExecutionState state = engine.start(compile("""
				init start @meta;
				state done;
				start -> done;
				"""));

		StepOutcome outcome = engine.applyDecision(state, choice("remove_node", "{\"node\": \"start\"}"));

		assertThat(outcome.result().success()).isFalse();
		assertThat(state.graph().find("start")).isPresent();
		assertThat(state.errorCount()).isEqualTo(1);
	}

	@Test
	void failedEdgeRemovalLeavesGraphUntouched() {
		ExecutionState state = engine.start(compile("""
				init start @meta;
				state done;
				state other;
				start -> done;
				"""));
		int edges = state.graph().edges().size();

		StepOutcome outcome = engine.applyDecision(state, choice("modify_edge", "{\"action\": \"remove\", \"target\": \"other\"}"));

		assertThat(outcome.result().success()).isFalse();
		assertThat(state.graph().edges()).hasSize(edges);
	}

	@Test
	void finishRequiresNoRemainingTransitions() {
		ExecutionState state = engine.start(compile("init start; state done; start -> done;"));

		assertThatThrownBy(() -> engine.finish(state))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("transition_to_done");
	}

	@Test
	void evaluationContextExposesNodeAndMachineAttributes() {
		ExecutionState state = engine.start(compile("""
				machine "Ctx"
				threshold: 4;
				init start;
				Settings { context limits { max: 10; } }
				state done;
				start -> done;
				"""));

		var context = engine.evaluationContext(state);

		assertThat(context.lookup("threshold")).contains(BigDecimal.valueOf(4));
		assertThat(context.lookup("Settings.limits.max")).contains(BigDecimal.TEN);
		assertThat(context.lookup("limits.max")).contains(BigDecimal.TEN);
		assertThat(context.lookup("errorCount")).contains(BigDecimal.ZERO);
	}

	private static ToolChoice choice(String name, String input) {
		try {
			return new ToolChoice(name, (ObjectNode) JSON.readTree(input));
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException(e);
		}
	}

	private static Machine compile(String source) {
		CompilationResult result = new MachineCompiler().compile(source);
		assertThat(result.errors()).isEmpty();
		return result.machine();
	}
}
