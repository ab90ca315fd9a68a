package org.javai.dygram.exec;

import java.util.concurrent.CompletionStage;

/**
 * Chooses the next tool for a suspended run. Implementations may answer synchronously by
 * returning a completed stage.
 */
@FunctionalInterface
public interface DecisionMaker {

	CompletionStage<DecisionResponse> decide(DecisionRequest request);
}
