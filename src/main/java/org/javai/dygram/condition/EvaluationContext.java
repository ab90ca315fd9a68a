package org.javai.dygram.condition;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;

/**
 * Variable environment for guard evaluation: the built-ins {@code errorCount} (alias
 * {@code errors}) and {@code activeState}, plus node attributes addressable as
 * {@code node.attribute} by simple name or qualified path.
 */
public final class EvaluationContext {

	public static final String ERROR_COUNT = "errorCount";
	public static final String ERRORS = "errors";
	public static final String ACTIVE_STATE = "activeState";

	public static final List<String> BUILT_INS = List.of(ERROR_COUNT, ERRORS, ACTIVE_STATE);

	private static final Object MISSING = new Object();

	private final Map<String, Object> variables;

	private EvaluationContext(Map<String, Object> variables) {
		this.variables = Collections.unmodifiableMap(new HashMap<>(variables));
	}

	public static EvaluationContext empty() {
		return builder().build();
	}

	/**
	 * Context built from the static attribute values of a machine.
	 */
	public static EvaluationContext of(Machine machine, int errorCount, String activeState) {
		Builder builder = builder().errorCount(errorCount).activeState(activeState);
		for (MachineNode node : machine.nodes()) {
			Map<String, Object> attributes = new LinkedHashMap<>();
			for (Attribute attribute : node.attributes()) {
				attributes.put(attribute.name(), attribute.value().toJava());
			}
			builder.node(machine.qualifiedName(node.id()), attributes);
			builder.nodeIfAbsent(node.name(), attributes);
		}
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Looks a dotted path up: first as a whole variable name, then by descending into the
	 * longest variable prefix that holds a map. A variable holding {@code null} is empty.
	 */
	public Optional<Object> lookup(String path) {
		Object value = find(path);
		return value == MISSING ? Optional.empty() : Optional.ofNullable(normalize(value));
	}

	/**
	 * Distinguishes a present variable holding {@code null} from a missing one.
	 */
	public boolean has(String path) {
		return find(path) != MISSING;
	}

	private Object find(String path) {
		if (variables.containsKey(path)) {
			return variables.get(path);
		}
		String[] segments = path.split("\\.");
		for (int split = segments.length - 1; split >= 1; split--) {
			Object cursor = variables.get(String.join(".", Arrays.copyOfRange(segments, 0, split)));
			if (!(cursor instanceof Map<?, ?>)) {
				continue;
			}
			boolean found = true;
			for (int i = split; i < segments.length && found; i++) {
				if (cursor instanceof Map<?, ?> map && map.containsKey(segments[i])) {
					cursor = map.get(segments[i]);
				} else {
					found = false;
				}
			}
			if (found) {
				return cursor;
			}
		}
		return MISSING;
	}

	private static Object normalize(Object value) {
		if (value instanceof BigDecimal || value == null) {
			return value;
		}
		if (value instanceof Number n) {
			return new BigDecimal(n.toString());
		}
		return value;
	}

	public static final class Builder {
		private final Map<String, Object> variables = new HashMap<>();

		private Builder() {
		}

		public Builder variable(String name, Object value) {
			variables.put(name, value);
			return this;
		}

		public Builder variableIfAbsent(String name, Object value) {
			variables.putIfAbsent(name, value);
			return this;
		}

		public Builder errorCount(int count) {
			variables.put(ERROR_COUNT, count);
			variables.put(ERRORS, count);
			return this;
		}

		public Builder activeState(String state) {
			variables.put(ACTIVE_STATE, state == null ? "" : state);
			return this;
		}

		public Builder node(String path, Map<String, Object> attributes) {
			variables.put(path, new HashMap<>(attributes));
			return this;
		}

		public Builder nodeIfAbsent(String name, Map<String, Object> attributes) {
			variables.putIfAbsent(name, new HashMap<>(attributes));
			return this;
		}

		public EvaluationContext build() {
			return new EvaluationContext(variables);
		}
	}
}
