package org.javai.dygram.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.dygram.model.ArrowType;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Input schemas and implementations of the {@link MetaTool}s.
 */
final class MetaTools {

	private static final Logger logger = LoggerFactory.getLogger(MetaTools.class);
	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private MetaTools() {
	}

	static ToolDefinition definition(MetaTool tool, ExecutionState state, ContextAccess access) {
		ObjectNode schema = objectSchema();
		ObjectNode properties = (ObjectNode) schema.get("properties");
		ArrayNode required = schema.putArray("required");
		switch (tool) {
			case ADD_NODE -> {
				properties.set("name", stringProperty("Simple name of the new node"));
				properties.set("type", stringProperty("Node type, e.g. task or state"));
				properties.set("parent", stringProperty("Qualified path of the parent node; omit for a root node"));
				properties.set("title", stringProperty("Display title"));
				ObjectNode attributes = properties.putObject("attributes");
				attributes.put("type", "object");
				attributes.put("description", "Initial attribute values");
				required.add("name");
			}
			case REMOVE_NODE -> {
				properties.set("node", stringProperty("Qualified path of the node to remove"));
				required.add("node");
			}
			case MODIFY_EDGE -> {
				ObjectNode action = properties.putObject("action");
				action.put("type", "string");
				action.putArray("enum").add("add").add("remove").add("retarget");
				properties.set("source", stringProperty("Source node; defaults to the current node"));
				properties.set("target", stringProperty("Target node"));
				properties.set("newTarget", stringProperty("New target node for action 'retarget'"));
				properties.set("label", stringProperty("Label of an added edge"));
				properties.set("condition", stringProperty("Guard expression of an added edge"));
				required.add("action").add("target");
			}
			case GET_CONTEXT_VALUE -> {
				properties.set("node", nodeProperty(access.unrestricted() ? List.of() : readable(access)));
				properties.set("attribute", stringProperty("Attribute to read; omit to read all attributes"));
				required.add("node");
			}
			case SET_CONTEXT_VALUE -> {
				properties.set("node", nodeProperty(access.unrestricted() ? List.of() : access.writableSorted()));
				ObjectNode values = properties.putObject("values");
				values.put("type", "object");
				values.put("description", "Attribute values to write");
				values.set("properties", declaredValueProperties(state, access));
				required.add("node").add("values");
			}
			case LIST_CONTEXT_NODES -> {
				// no input
			}
		}
		return new ToolDefinition(tool.toolName(), tool.description(), schema);
	}

	static ToolResult apply(MetaTool tool, ExecutionState state, ContextAccess access, ObjectNode input) {
		return switch (tool) {
			case ADD_NODE -> addNode(state, input);
			case REMOVE_NODE -> removeNode(state, input);
			case MODIFY_EDGE -> modifyEdge(state, input);
			case GET_CONTEXT_VALUE -> getContextValue(state, access, input);
			case SET_CONTEXT_VALUE -> setContextValue(state, access, input);
			case LIST_CONTEXT_NODES -> listContextNodes(state, access);
		};
	}

	private static ToolResult addNode(ExecutionState state, ObjectNode input) {
		RuntimeGraph graph = state.graph();
		String name = requiredText(input, "name");
		String type = optionalText(input, "type");
		NodeId parent = optionalText(input, "parent") == null ? null : graph.resolve(optionalText(input, "parent"));
		List<Attribute> attributes = new ArrayList<>();
		JsonNode values = input.get("attributes");
		if (values != null && values.isObject()) {
			Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				attributes.add(Attribute.of(field.getKey(), ValueCoercion.coerce(null, field.getValue())));
			}
		}
		NodeId id = graph.addNode(name, type, optionalText(input, "title"), parent, attributes);
		String path = graph.qualifiedName(id);
		if (type != null && type.equalsIgnoreCase(ContextStore.CONTEXT_TYPE)) {
			state.context().seed(path, attributes);
		}
		logger.debug("add_node created {}", path);
		return ToolResult.ok(MetaTool.ADD_NODE.toolName(), JSON_MAPPER.createObjectNode().put("node", path),
				"Added node " + path);
	}

	private static ToolResult removeNode(ExecutionState state, ObjectNode input) {
		RuntimeGraph graph = state.graph();
		NodeId id = graph.resolve(requiredText(input, "node"));
		NodeId cursor = state.currentNode();
		while (cursor != null) {
			if (cursor.equals(id)) {
				throw new ToolInvocationException("Cannot remove the current node or one of its ancestors");
			}
			cursor = graph.require(cursor).parent();
		}
		List<String> removedPaths = new ArrayList<>();
		for (MachineNode node : graph.nodes()) {
			if (node.id().equals(id) || isDescendant(graph, node.id(), id)) {
				removedPaths.add(graph.qualifiedName(node.id()));
			}
		}
		graph.removeNode(id);
		removedPaths.forEach(state.context()::remove);
		ArrayNode output = JSON_MAPPER.createArrayNode();
		removedPaths.forEach(output::add);
		return ToolResult.ok(MetaTool.REMOVE_NODE.toolName(), output, "Removed " + String.join(", ", removedPaths));
	}

	private static ToolResult modifyEdge(ExecutionState state, ObjectNode input) {
		RuntimeGraph graph = state.graph();
		String action = requiredText(input, "action");
		NodeId source = optionalText(input, "source") == null ? state.currentNode() : graph.resolve(optionalText(input, "source"));
		NodeId target = graph.resolve(requiredText(input, "target"));
		String description = graph.qualifiedName(source) + " -> " + graph.qualifiedName(target);
		switch (action) {
			case "add" -> {
				List<Attribute> attributes = new ArrayList<>();
				String condition = optionalText(input, "condition");
				if (condition != null) {
					attributes.add(Attribute.of("if", AttributeValue.text(condition)));
				}
				graph.addEdge(new Edge(source, target, ArrowType.ASSOCIATION, optionalText(input, "label"), attributes,
						null, null));
				return ToolResult.ok(MetaTool.MODIFY_EDGE.toolName(), null, "Added edge " + description);
			}
			case "remove" -> {
				if (graph.removeEdges(source, target) == 0) {
					throw new ToolInvocationException("No edge " + description);
				}
				return ToolResult.ok(MetaTool.MODIFY_EDGE.toolName(), null, "Removed edge " + description);
			}
			case "retarget" -> {
				NodeId newTarget = graph.resolve(requiredText(input, "newTarget"));
				if (graph.retarget(source, target, newTarget) == 0) {
					throw new ToolInvocationException("No edge " + description);
				}
				return ToolResult.ok(MetaTool.MODIFY_EDGE.toolName(), null,
						"Retargeted edge %s to %s".formatted(description, graph.qualifiedName(newTarget)));
			}
			default -> throw new ToolInvocationException("Unknown modify_edge action '" + action + "'");
		}
	}

	private static ToolResult getContextValue(ExecutionState state, ContextAccess access, ObjectNode input) {
		String node = contextNode(state, requiredText(input, "node"));
		if (!access.canRead(node)) {
			throw new ToolInvocationException("No read access to '" + node + "'");
		}
		List<Attribute> attributes = currentAttributes(state, node);
		String attribute = optionalText(input, "attribute");
		if (attribute == null) {
			ObjectNode output = JSON_MAPPER.createObjectNode();
			attributes.forEach(a -> output.set(a.name(), ValueCoercion.toJson(a.value())));
			return ToolResult.ok(MetaTool.GET_CONTEXT_VALUE.toolName(), output, "Read " + node);
		}
		Attribute found = attributes.stream()
				.filter(a -> a.name().equals(attribute))
				.findFirst()
				.orElseThrow(() -> new ToolInvocationException("'%s' has no value '%s'".formatted(node, attribute)));
		return ToolResult.ok(MetaTool.GET_CONTEXT_VALUE.toolName(), ValueCoercion.toJson(found.value()),
				"Read %s.%s".formatted(node, attribute));
	}

	private static ToolResult setContextValue(ExecutionState state, ContextAccess access, ObjectNode input) {
		String node = contextNode(state, requiredText(input, "node"));
		if (!access.canWrite(node)) {
			throw new ToolInvocationException("No write access to '" + node + "'");
		}
		Map<String, JsonNode> updates = new LinkedHashMap<>();
		JsonNode values = input.get("values");
		if (values != null && values.isObject()) {
			values.fields().forEachRemaining(field -> updates.put(field.getKey(), field.getValue()));
		} else if (input.hasNonNull("attribute")) {
			updates.put(input.get("attribute").asText(), input.get("value"));
		}
		state.context().seed(node, currentAttributes(state, node));
		Map<String, AttributeValue> written = state.context().writeAll(node, updates);
		ObjectNode output = JSON_MAPPER.createObjectNode();
		written.forEach((name, value) -> output.set(name, ValueCoercion.toJson(value)));
		return ToolResult.ok(MetaTool.SET_CONTEXT_VALUE.toolName(), output,
				"Wrote %s to %s".formatted(String.join(", ", written.keySet()), node));
	}

	private static ToolResult listContextNodes(ExecutionState state, ContextAccess access) {
		ArrayNode output = JSON_MAPPER.createArrayNode();
		for (String node : state.context().nodes()) {
			if (!access.canRead(node)) {
				continue;
			}
			ObjectNode entry = output.addObject();
			entry.put("node", node);
			ObjectNode values = entry.putObject("values");
			state.context().attributes(node).forEach(a -> values.set(a.name(), ValueCoercion.toJson(a.value())));
		}
		return ToolResult.ok(MetaTool.LIST_CONTEXT_NODES.toolName(), output, output.size() + " context nodes");
	}

	/**
	 * Values of a node as the run currently sees them: the context store when it holds the
	 * node, the runtime graph otherwise.
	 */
	static List<Attribute> currentAttributes(ExecutionState state, String nodePath) {
		if (state.context().contains(nodePath)) {
			return state.context().attributes(nodePath);
		}
		return state.graph().require(state.graph().resolve(nodePath)).attributes();
	}

	private static String contextNode(ExecutionState state, String reference) {
		if (state.context().contains(reference)) {
			return reference;
		}
		return state.graph().qualifiedName(state.graph().resolve(reference));
	}

	private static List<String> readable(ContextAccess access) {
		List<String> nodes = new ArrayList<>(access.readableSorted());
		access.writableSorted().stream().filter(n -> !nodes.contains(n)).forEach(nodes::add);
		return nodes;
	}

	private static ObjectNode declaredValueProperties(ExecutionState state, ContextAccess access) {
		ObjectNode properties = JSON_MAPPER.createObjectNode();
		List<String> nodes = access.unrestricted() ? state.context().nodes() : access.writableSorted();
		for (String node : nodes) {
			for (Attribute attribute : currentAttributes(state, node)) {
				String schemaType = ValueCoercion.schemaType(attribute.type());
				if (properties.has(attribute.name())) {
					JsonNode existing = properties.get(attribute.name()).get("type");
					if (existing != null && (schemaType == null || !existing.asText().equals(schemaType))) {
						((ObjectNode) properties.get(attribute.name())).remove("type");
					}
					continue;
				}
				ObjectNode property = properties.putObject(attribute.name());
				if (schemaType != null) {
					property.put("type", schemaType);
				}
			}
		}
		return properties;
	}

	private static boolean isDescendant(RuntimeGraph graph, NodeId candidate, NodeId ancestor) {
		NodeId cursor = graph.require(candidate).parent();
		while (cursor != null) {
			if (cursor.equals(ancestor)) {
				return true;
			}
			cursor = graph.require(cursor).parent();
		}
		return false;
	}

	private static ObjectNode objectSchema() {
		ObjectNode schema = JSON_MAPPER.createObjectNode();
		schema.put("type", "object");
		schema.putObject("properties");
		return schema;
	}

	static ObjectNode stringProperty(String description) {
		ObjectNode property = JSON_MAPPER.createObjectNode();
		property.put("type", "string");
		property.put("description", description);
		return property;
	}

	private static ObjectNode nodeProperty(List<String> allowed) {
		ObjectNode property = stringProperty("Qualified path of the context node");
		if (!allowed.isEmpty()) {
			ArrayNode values = property.putArray("enum");
			allowed.forEach(values::add);
		}
		return property;
	}

	private static String requiredText(ObjectNode input, String field) {
		String value = optionalText(input, field);
		if (value == null) {
			throw new ToolInvocationException("Missing required input '" + field + "'");
		}
		return value;
	}

	private static String optionalText(ObjectNode input, String field) {
		JsonNode value = input.get(field);
		if (value == null || value.isNull() || value.asText().isBlank()) {
			return null;
		}
		return value.asText();
	}
}
