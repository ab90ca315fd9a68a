package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A tool offered to the decision-maker.
 *
 * @param name unique tool name, e.g. {@code transition_to_review}
 * @param description what the tool does
 * @param inputSchema JSON schema of the tool input
 */
public record ToolDefinition(String name, String description, ObjectNode inputSchema) {

	public ToolDefinition {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(description, "description must not be null");
		Objects.requireNonNull(inputSchema, "inputSchema must not be null");
	}
}
