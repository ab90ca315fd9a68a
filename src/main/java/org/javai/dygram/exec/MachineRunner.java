package org.javai.dygram.exec;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.javai.dygram.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a run to completion: enumerate tools, wait for a decision, apply it, repeat.
 * <p>
 * Waiting for a decision is bounded by {@link ExecutionConfig#decisionTimeout()}; a timed out
 * or failed decision is retried {@link ExecutionConfig#decisionRetries()} times before the run
 * fails. Nothing is applied while waiting, so a failed run keeps its last committed context.
 */
public class MachineRunner {

	private static final Logger logger = LoggerFactory.getLogger(MachineRunner.class);

	private final ExecutionEngine engine;
	private final DecisionMaker decisionMaker;
	private final ExecutionConfig config;
	private final ExecutionPromptBuilder promptBuilder;

	public MachineRunner(DecisionMaker decisionMaker) {
		this(new ExecutionEngine(), decisionMaker, ExecutionConfig.defaults());
	}

	public MachineRunner(ExecutionEngine engine, DecisionMaker decisionMaker, ExecutionConfig config) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
		this.decisionMaker = Objects.requireNonNull(decisionMaker, "decisionMaker must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.promptBuilder = new ExecutionPromptBuilder(engine);
	}

	public ExecutionResult run(Machine machine) {
		ExecutionState state;
		try {
			state = engine.start(machine);
		} catch (ExecutionFault fault) {
			logger.error("Cannot start run: {}", fault.getMessage());
			throw fault;
		}
		return run(state);
	}

	/**
	 * Continues an already started run until it completes or fails.
	 */
	public ExecutionResult run(ExecutionState state) {
		while (!state.status().isTerminal()) {
			if (state.stepCount() >= config.maxSteps()) {
				fail(state, new ExecutionFault(FaultReason.STEP_LIMIT_EXCEEDED,
						"Run exceeded %d steps at %s".formatted(config.maxSteps(), state.currentNodePath())));
				break;
			}
			ToolSet tools = engine.enumerateTools(state);
			DecisionRequest request = new DecisionRequest(promptBuilder.build(state, tools), tools.definitions(),
					state.context().asMap());
			DecisionResponse response;
			try {
				response = awaitDecision(request, state.currentNodePath());
			} catch (ExecutionFault fault) {
				fail(state, fault);
				break;
			}
			if (response.selectedTool().isEmpty()) {
				if (tools.hasTransitions()) {
					fail(state, new ExecutionFault(FaultReason.NO_ELIGIBLE_TOOL,
							"Decision at %s selected no tool although transitions %s are available"
									.formatted(state.currentNodePath(), tools.transitions().stream().map(ToolDefinition::name).toList())));
					break;
				}
				engine.finish(state);
				break;
			}
			try {
				StepOutcome outcome = engine.applyDecision(state, response.toChoice());
				if (!outcome.result().success()) {
					logger.debug("Tool {} failed; errorCount is now {}", outcome.result().toolName(), state.errorCount());
				}
			} catch (ExecutionFault fault) {
				// the engine has already failed the run
				break;
			}
		}
		return ExecutionResult.of(state);
	}

	private DecisionResponse awaitDecision(DecisionRequest request, String node) {
		int attempts = config.decisionRetries() + 1;
		ExecutionFault last = null;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			CompletableFuture<DecisionResponse> pending = null;
			try {
				pending = decisionMaker.decide(request).toCompletableFuture();
				DecisionResponse response = pending.get(config.decisionTimeout().toMillis(), TimeUnit.MILLISECONDS);
				if (response != null) {
					return response;
				}
				last = new ExecutionFault(FaultReason.DECISION_FAILED, "Decision-maker returned no response at " + node);
			} catch (TimeoutException e) {
				pending.cancel(true);
				last = new ExecutionFault(FaultReason.DECISION_TIMEOUT,
						"No decision at %s within %d ms".formatted(node, config.decisionTimeout().toMillis()), e);
			} catch (ExecutionException e) {
				Throwable cause = e.getCause() != null ? e.getCause() : e;
				last = new ExecutionFault(FaultReason.DECISION_FAILED,
						"Decision at %s failed: %s".formatted(node, cause.getMessage()), cause);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				if (pending != null) {
					pending.cancel(true);
				}
				throw new ExecutionFault(FaultReason.DECISION_FAILED, "Interrupted while waiting for a decision at " + node, e);
			} catch (RuntimeException e) {
				last = new ExecutionFault(FaultReason.DECISION_FAILED,
						"Decision at %s failed: %s".formatted(node, e.getMessage()), e);
			}
			if (attempt < attempts) {
				logger.warn("{}; retrying ({}/{})", last.getMessage(), attempt, attempts - 1);
			}
		}
		throw last;
	}

	private void fail(ExecutionState state, ExecutionFault fault) {
		state.fail(fault);
		logger.error("Run failed at {}: {}", state.currentNodePath(), fault.getMessage());
	}
}
