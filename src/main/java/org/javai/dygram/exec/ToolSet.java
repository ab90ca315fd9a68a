package org.javai.dygram.exec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools available at the current node, in the order they are offered.
 */
public final class ToolSet {

	private final Map<String, ToolDefinition> definitions = new LinkedHashMap<>();
	private final Map<String, ToolBinding> bindings = new LinkedHashMap<>();
	private final ContextAccess access;

	ToolSet(ContextAccess access) {
		this.access = access;
	}

	public static ToolSet empty() {
		return new ToolSet(ContextAccess.NONE);
	}

	void add(ToolDefinition definition, ToolBinding binding) {
		definitions.put(definition.name(), definition);
		bindings.put(definition.name(), binding);
	}

	public List<ToolDefinition> definitions() {
		return List.copyOf(definitions.values());
	}

	public List<String> names() {
		return List.copyOf(definitions.keySet());
	}

	public Optional<ToolDefinition> definition(String name) {
		return Optional.ofNullable(definitions.get(name));
	}

	public Optional<ToolBinding> binding(String name) {
		return Optional.ofNullable(bindings.get(name));
	}

	public List<ToolDefinition> transitions() {
		return definitions.values().stream()
				.filter(d -> bindings.get(d.name()) instanceof ToolBinding.Transition)
				.toList();
	}

	public boolean hasTransitions() {
		return !transitions().isEmpty();
	}

	public ContextAccess access() {
		return access;
	}

	public boolean isEmpty() {
		return definitions.isEmpty();
	}

	public int size() {
		return definitions.size();
	}
}
