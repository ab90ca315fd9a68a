package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * The tool selected by the decision-maker and its input.
 */
public record ToolChoice(String name, ObjectNode input) {

	public ToolChoice {
		Objects.requireNonNull(name, "name must not be null");
		input = input == null ? JsonNodeFactory.instance.objectNode() : input;
	}

	public static ToolChoice of(String name) {
		return new ToolChoice(name, null);
	}
}
