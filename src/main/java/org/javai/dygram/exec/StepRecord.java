package org.javai.dygram.exec;

/**
 * One entry of a run's history.
 *
 * @param step 1-based step number
 * @param node node the tool was invoked at
 * @param tool invoked tool
 * @param target node moved to, or {@code null} for meta tools
 * @param success whether the invocation was applied
 * @param detail result message
 */
public record StepRecord(int step, String node, String tool, String target, boolean success, String detail) {
}
