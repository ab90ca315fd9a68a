package org.javai.dygram.exec;

/**
 * State after applying a decision, and what the tool returned.
 */
public record StepOutcome(ExecutionState state, ToolResult result) {
}
