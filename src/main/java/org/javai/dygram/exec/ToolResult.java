package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of one tool invocation.
 *
 * @param toolName invoked tool
 * @param success whether the invocation was applied
 * @param output tool output, or {@code null}
 * @param message human readable summary or error
 */
public record ToolResult(String toolName, boolean success, JsonNode output, String message) {

	public static ToolResult ok(String toolName, JsonNode output, String message) {
		return new ToolResult(toolName, true, output, message);
	}

	public static ToolResult failed(String toolName, String message) {
		return new ToolResult(toolName, false, null, message);
	}
}
