package org.javai.dygram.exec;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.javai.dygram.model.Machine;

/**
 * Outcome of a complete run.
 *
 * @param status final status, never {@link RunStatus#RUNNING}
 * @param finalNode qualified path of the node the run ended at
 * @param history applied steps in order
 * @param context final context values
 * @param errorCount number of rejected tool invocations
 * @param fault the fault that ended the run, or {@code null}
 * @param snapshot the runtime graph at the end of the run
 * @param startedAt when the run started
 * @param finishedAt when the result was taken
 */
public record ExecutionResult(RunStatus status, String finalNode, List<StepRecord> history,
		Map<String, Map<String, Object>> context, int errorCount, ExecutionFault fault, Machine snapshot,
		Instant startedAt, Instant finishedAt) {

	public ExecutionResult {
		history = List.copyOf(history);
	}

	public static ExecutionResult of(ExecutionState state) {
		return new ExecutionResult(state.status(), state.currentNodePath(), state.history(), state.context().asMap(),
				state.errorCount(), state.fault(), state.graph().toMachine(), state.startedAt(), Instant.now());
	}

	public boolean completed() {
		return status == RunStatus.COMPLETED;
	}

	/**
	 * Nodes moved through, starting with the entry node.
	 */
	public List<String> path() {
		List<String> moves = history.stream().filter(s -> s.target() != null).map(StepRecord::target).toList();
		if (history.isEmpty()) {
			return List.of(finalNode);
		}
		return Stream.concat(Stream.of(history.get(0).node()), moves.stream()).toList();
	}
}
