package org.javai.dygram.exec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Replays predetermined tool choices in order. Once the script is used up every decision is a
 * plain text response without a tool.
 */
public class ScriptedDecisionMaker implements DecisionMaker {

	private final Deque<ToolChoice> script;
	private final List<DecisionRequest> requests = Collections.synchronizedList(new ArrayList<>());

	public ScriptedDecisionMaker(List<ToolChoice> choices) {
		this.script = new ArrayDeque<>(choices);
	}

	public static ScriptedDecisionMaker of(String... toolNames) {
		List<ToolChoice> choices = new ArrayList<>();
		for (String name : toolNames) {
			choices.add(ToolChoice.of(name));
		}
		return new ScriptedDecisionMaker(choices);
	}

	@Override
	public synchronized CompletionStage<DecisionResponse> decide(DecisionRequest request) {
		requests.add(request);
		ToolChoice next = script.poll();
		if (next == null) {
			return CompletableFuture.completedFuture(DecisionResponse.text("Script exhausted"));
		}
		return CompletableFuture.completedFuture(DecisionResponse.toolUse(next.name(), next.input(), "scripted"));
	}

	/**
	 * Requests received so far, for inspection.
	 */
	public List<DecisionRequest> requests() {
		return List.copyOf(requests);
	}

	public synchronized int remaining() {
		return script.size();
	}
}
