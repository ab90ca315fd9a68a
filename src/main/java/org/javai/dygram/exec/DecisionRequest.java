package org.javai.dygram.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a decision-maker is shown: the rendered system prompt, the tools it may pick from and
 * the context values visible to the run.
 */
public record DecisionRequest(String systemPrompt, List<ToolDefinition> tools, Map<String, Map<String, Object>> context) {

	public DecisionRequest {
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		tools = List.copyOf(tools);
		context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
	}
}
