package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.MachineNode;

/**
 * Mutable context values of one run, keyed by qualified node path and attribute name.
 * Seeded from the attributes of {@code context} nodes; writes are checked against the
 * declared attribute types and applied all-or-nothing.
 */
public final class ContextStore {

	public static final String CONTEXT_TYPE = "context";

	private final Map<String, LinkedHashMap<String, Attribute>> values;

	private ContextStore(Map<String, LinkedHashMap<String, Attribute>> values) {
		this.values = values;
	}

	public static ContextStore empty() {
		return new ContextStore(new LinkedHashMap<>());
	}

	public static ContextStore seededFrom(RuntimeGraph graph) {
		ContextStore store = empty();
		for (MachineNode node : graph.nodes()) {
			if (node.isType(CONTEXT_TYPE)) {
				LinkedHashMap<String, Attribute> attributes = new LinkedHashMap<>();
				node.attributes().forEach(a -> attributes.put(a.name(), a));
				store.values.put(graph.qualifiedName(node.id()), attributes);
			}
		}
		return store;
	}

	public List<String> nodes() {
		return List.copyOf(values.keySet());
	}

	public boolean contains(String nodePath) {
		return values.containsKey(nodePath);
	}

	public Optional<AttributeValue> get(String nodePath, String attribute) {
		Map<String, Attribute> attributes = values.get(nodePath);
		if (attributes == null || !attributes.containsKey(attribute)) {
			return Optional.empty();
		}
		return Optional.of(attributes.get(attribute).value());
	}

	/**
	 * Current attributes of a node, in insertion order.
	 */
	public List<Attribute> attributes(String nodePath) {
		Map<String, Attribute> attributes = values.get(nodePath);
		return attributes == null ? List.of() : List.copyOf(attributes.values());
	}

	public Optional<String> declaredType(String nodePath, String attribute) {
		Map<String, Attribute> attributes = values.get(nodePath);
		if (attributes == null || !attributes.containsKey(attribute)) {
			return Optional.empty();
		}
		return Optional.ofNullable(attributes.get(attribute).type());
	}

	/**
	 * Coerces every value first and only then commits them, so a failing value leaves the
	 * store untouched.
	 *
	 * @throws ToolInvocationException if any value does not fit its declared type
	 */
	public Map<String, AttributeValue> writeAll(String nodePath, Map<String, JsonNode> updates) {
		if (updates.isEmpty()) {
			throw new ToolInvocationException("No values to write to '" + nodePath + "'");
		}
		Map<String, AttributeValue> coerced = new LinkedHashMap<>();
		List<String> failures = new ArrayList<>();
		for (Map.Entry<String, JsonNode> update : updates.entrySet()) {
			String type = declaredType(nodePath, update.getKey()).orElse(null);
			try {
				coerced.put(update.getKey(), ValueCoercion.coerce(type, update.getValue()));
			} catch (ToolInvocationException e) {
				failures.add(update.getKey() + ": " + e.getMessage());
			}
		}
		if (!failures.isEmpty()) {
			throw new ToolInvocationException("Rejected write to '%s': %s".formatted(nodePath, String.join("; ", failures)));
		}
		LinkedHashMap<String, Attribute> attributes = values.computeIfAbsent(nodePath, k -> new LinkedHashMap<>());
		coerced.forEach((name, value) -> {
			Attribute existing = attributes.get(name);
			attributes.put(name, existing != null ? existing.withValue(value) : Attribute.of(name, value));
		});
		return coerced;
	}

	/**
	 * Registers a node with its declared attributes unless the store already holds it.
	 */
	public void seed(String nodePath, List<Attribute> attributes) {
		values.computeIfAbsent(nodePath, k -> {
			LinkedHashMap<String, Attribute> seeded = new LinkedHashMap<>();
			attributes.forEach(a -> seeded.put(a.name(), a));
			return seeded;
		});
	}

	public void remove(String nodePath) {
		values.remove(nodePath);
	}

	/**
	 * Deep copy for checkpointing.
	 */
	public ContextStore snapshot() {
		Map<String, LinkedHashMap<String, Attribute>> copy = new LinkedHashMap<>();
		values.forEach((node, attributes) -> copy.put(node, new LinkedHashMap<>(attributes)));
		return new ContextStore(copy);
	}

	/**
	 * Plain Java view: node path to attribute name to value.
	 */
	public Map<String, Map<String, Object>> asMap() {
		Map<String, Map<String, Object>> result = new LinkedHashMap<>();
		values.forEach((node, attributes) -> {
			Map<String, Object> plain = new HashMap<>();
			attributes.forEach((name, attribute) -> plain.put(name, attribute.value().toJava()));
			result.put(node, plain);
		});
		return result;
	}
}
