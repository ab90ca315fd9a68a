package org.javai.dygram.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.Level;
import org.javai.dygram.build.CompilationResult;
import org.javai.dygram.build.MachineCompiler;
import org.javai.dygram.model.Machine;
import org.javai.dygram.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class MachineRunnerTest {

	private static final String LINEAR = """
			machine "Linear"
			init start;
			state mid;
			state done;
			start -> mid;
			mid -> done;
			""";

	@Test
	void runsScriptedDecisionsToCompletion() {
		ScriptedDecisionMaker decisions = ScriptedDecisionMaker.of("transition_to_mid", "transition_to_done");

		ExecutionResult result = new MachineRunner(decisions).run(compile(LINEAR));

		assertThat(result.completed()).isTrue();
		assertThat(result.finalNode()).isEqualTo("done");
		assertThat(result.path()).containsExactly("start", "mid", "done");
		assertThat(result.fault()).isNull();
		assertThat(decisions.requests()).hasSize(2);
		assertThat(decisions.remaining()).isZero();
	}

	@Test
	void requestDescribesCurrentNodeToolsAndContext() {
		ScriptedDecisionMaker decisions = ScriptedDecisionMaker.of("transition_to_done");

		new MachineRunner(decisions).run(compile("""
				init start "Kick off";
				context memory { count: 2; }
				state done;
				start -"reads"-> memory;
				start -> done;
				"""));

		DecisionRequest request = decisions.requests().get(0);
		assertThat(request.systemPrompt()).contains("Current node: start", "Title: Kick off", "transition_to_done");
		assertThat(request.tools()).extracting(ToolDefinition::name)
				.containsExactly("transition_to_done", "get_context_value", "list_context_nodes");
		assertThat(request.context()).containsKey("memory");
	}

	@Test
	void stepLimitStopsCyclingRun() {
		MachineRunner runner = new MachineRunner(new ExecutionEngine(), new FirstTransitionDecisionMaker(),
				ExecutionConfig.builder().maxSteps(5).build());

		ExecutionResult result = runner.run(compile("""
				init start;
				state a;
				state b;
				start -> a;
				a -> b;
				b -> a;
				"""));

		assertThat(result.status()).isEqualTo(RunStatus.FAILED);
		assertThat(result.fault().reason()).isEqualTo(FaultReason.STEP_LIMIT_EXCEEDED);
		assertThat(result.history()).hasSize(5);
	}

	@Test
	void unansweredDecisionTimesOutAfterRetries() {
		AtomicInteger calls = new AtomicInteger();
		DecisionMaker silent = request -> {
			calls.incrementAndGet();
			return new CompletableFuture<>();
		};
		MachineRunner runner = new MachineRunner(new ExecutionEngine(), silent, ExecutionConfig.builder()
				.decisionTimeout(Duration.ofMillis(50))
				.decisionRetries(1)
				.build());

		try (LogCaptorAppender appender = LogCaptorAppender.create(MachineRunner.class, Level.WARN)) {
			ExecutionResult result = runner.run(compile(LINEAR));

			assertThat(result.status()).isEqualTo(RunStatus.FAILED);
			assertThat(result.fault().reason()).isEqualTo(FaultReason.DECISION_TIMEOUT);
			assertThat(result.finalNode()).isEqualTo("start");
			assertThat(calls).hasValue(2);
			assertThat(appender.messages()).anyMatch(message -> message.contains("retrying"));
		}
	}

	@Test
	void failedDecisionIsRetried() {
		AtomicInteger calls = new AtomicInteger();
		DecisionMaker flaky = request -> {
			if (calls.getAndIncrement() == 0) {
				return CompletableFuture.failedFuture(new IllegalStateException("service unavailable"));
			}
			return new FirstTransitionDecisionMaker().decide(request);
		};
		MachineRunner runner = new MachineRunner(new ExecutionEngine(), flaky, ExecutionConfig.builder()
				.decisionRetries(1)
				.build());

		ExecutionResult result = runner.run(compile(LINEAR));

		assertThat(result.completed()).isTrue();
		assertThat(calls).hasValue(3);
	}

	@Test
	void throwingDecisionMakerFailsTheRun() {
		DecisionMaker broken = request -> {
			throw new IllegalStateException("boom");
		};
		MachineRunner runner = new MachineRunner(new ExecutionEngine(), broken, ExecutionConfig.builder()
				.decisionRetries(0)
				.build());

		ExecutionResult result = runner.run(compile(LINEAR));

		assertThat(result.status()).isEqualTo(RunStatus.FAILED);
		assertThat(result.fault().reason()).isEqualTo(FaultReason.DECISION_FAILED);
		assertThat(result.fault()).hasMessageContaining("boom");
	}

	@Test
	void declinedDecisionWithTransitionsAvailableFails() {
		DecisionMaker declining = request -> CompletableFuture.completedFuture(DecisionResponse.text("I am done"));

		ExecutionResult result = new MachineRunner(declining).run(compile(LINEAR));

		assertThat(result.status()).isEqualTo(RunStatus.FAILED);
		assertThat(result.fault().reason()).isEqualTo(FaultReason.NO_ELIGIBLE_TOOL);
		assertThat(result.fault()).hasMessageContaining("transition_to_mid");
	}

	@Test
	void declinedDecisionWithOnlyContextToolsFinishes() {
		ScriptedDecisionMaker decisions = ScriptedDecisionMaker.of();

		ExecutionResult result = new MachineRunner(decisions).run(compile("""
				init start;
				context memory { count: 0; }
				start -"reads"-> memory;
				"""));

		assertThat(result.completed()).isTrue();
		assertThat(result.finalNode()).isEqualTo("start");
		assertThat(decisions.requests()).hasSize(1);
	}

	@Test
	void unknownToolEndsRunWithFault() {
		ExecutionResult result = new MachineRunner(ScriptedDecisionMaker.of("transition_to_elsewhere")).run(compile(LINEAR));

		assertThat(result.status()).isEqualTo(RunStatus.FAILED);
		assertThat(result.fault().reason()).isEqualTo(FaultReason.UNKNOWN_TOOL);
		assertThat(result.history()).isEmpty();
	}

	@Test
	void rejectedToolIsCountedAndRunContinues() {
		ScriptedDecisionMaker decisions = new ScriptedDecisionMaker(List.of(
				new ToolChoice("set_context_value", new ObjectMapper().createObjectNode()
						.put("node", "memory").put("attribute", "count").put("value", "many")),
				ToolChoice.of("transition_to_retry")));

		ExecutionResult result = new MachineRunner(decisions).run(compile("""
				init start;
				context memory { count<number>: 0; }
				state retry;
				start -"update"-> memory;
				start -when: "errorCount > 0"-> retry;
				"""));

		assertThat(result.completed()).isTrue();
		assertThat(result.errorCount()).isEqualTo(1);
		assertThat(result.path()).containsExactly("start", "retry");
		assertThat(result.context().get("memory")).containsEntry("count", BigDecimal.ZERO);
	}

	@Test
	void machineWithoutInitNodeIsRejected() {
		MachineRunner runner = new MachineRunner(new FirstTransitionDecisionMaker());

		assertThatThrownBy(() -> runner.run(compile("state a; state b; a -> b;")))
				.isInstanceOf(ExecutionFault.class)
				.hasMessageContaining("no init node");
	}

	private static Machine compile(String source) {
		CompilationResult result = new MachineCompiler().compile(source);
		assertThat(result.errors()).isEmpty();
		return result.machine();
	}
}
