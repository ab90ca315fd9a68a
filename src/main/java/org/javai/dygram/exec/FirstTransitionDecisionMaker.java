package org.javai.dygram.exec;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Deterministic policy: always takes the first offered transition and never uses meta tools.
 */
public class FirstTransitionDecisionMaker implements DecisionMaker {

	@Override
	public CompletionStage<DecisionResponse> decide(DecisionRequest request) {
		return request.tools().stream()
				.filter(t -> t.name().startsWith(ExecutionEngine.TRANSITION_PREFIX))
				.findFirst()
				.map(t -> DecisionResponse.toolUse(t.name(), null, "first available transition"))
				.map(CompletableFuture::completedFuture)
				.orElseGet(() -> CompletableFuture.completedFuture(DecisionResponse.text("No transition available")));
	}
}
