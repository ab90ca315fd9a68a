package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A decision: optional reasoning plus content blocks, at most one of which is used as the
 * tool invocation.
 */
public record DecisionResponse(String reasoning, List<ContentBlock> content, String stopReason) {

	public static final String STOP_TOOL_USE = "tool_use";
	public static final String STOP_END_TURN = "end_turn";

	public DecisionResponse {
		content = List.copyOf(content);
	}

	public sealed interface ContentBlock {
	}

	public record Text(String text) implements ContentBlock {
	}

	public record ToolUse(String name, ObjectNode input) implements ContentBlock {
		public ToolUse {
			Objects.requireNonNull(name, "name must not be null");
		}
	}

	public static DecisionResponse toolUse(String name, ObjectNode input, String reasoning) {
		return new DecisionResponse(reasoning, List.of(new ToolUse(name, input)), STOP_TOOL_USE);
	}

	public static DecisionResponse text(String text) {
		return new DecisionResponse(null, List.of(new Text(text)), STOP_END_TURN);
	}

	/**
	 * The first tool-use block, if any.
	 */
	public Optional<ToolUse> selectedTool() {
		return content.stream()
				.filter(ToolUse.class::isInstance)
				.map(ToolUse.class::cast)
				.findFirst();
	}

	public ToolChoice toChoice() {
		ToolUse use = selectedTool().orElseThrow(() -> new IllegalStateException("Response selects no tool"));
		return new ToolChoice(use.name(), use.input());
	}
}
