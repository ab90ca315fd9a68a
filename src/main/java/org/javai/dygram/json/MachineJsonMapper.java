package org.javai.dygram.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.dygram.exec.ExecutionResult;
import org.javai.dygram.exec.StepRecord;
import org.javai.dygram.model.Annotation;
import org.javai.dygram.model.ArrowType;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.InferredDependency;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.javai.dygram.model.Note;

/**
 * Converts between {@link Machine} and its canonical JSON form. Reading what was written
 * yields an equal machine: nodes are listed in id order, which is pre-order, so every parent
 * precedes its children.
 */
public class MachineJsonMapper {

	private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

	private final ObjectMapper mapper;

	public MachineJsonMapper() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.enable(SerializationFeature.INDENT_OUTPUT)
				.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
				.setNodeFactory(NODES);
		this.mapper.getFactory().enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
	}

	public String toJson(Machine machine) {
		try {
			return mapper.writeValueAsString(toMachineJson(machine));
		} catch (JsonProcessingException e) {
			throw new MachineJsonException("Failed to write machine '%s' as JSON".formatted(machine.title()), e);
		}
	}

	public Machine fromJson(String json) {
		MachineJson parsed;
		try {
			parsed = mapper.readValue(json, MachineJson.class);
		} catch (JsonProcessingException e) {
			throw new MachineJsonException("Failed to read machine JSON: " + e.getOriginalMessage(), e);
		}
		return fromMachineJson(parsed);
	}

	public MachineJson toMachineJson(Machine machine) {
		List<MachineJson.NodeJson> nodes = new ArrayList<>();
		for (MachineNode node : machine.nodes()) {
			nodes.add(new MachineJson.NodeJson(node.name(), node.type(), node.title(),
					node.parent() == null ? null : machine.qualifiedName(node.parent()),
					attributeJson(node.attributes()), annotationJson(node.annotations())));
		}
		List<MachineJson.EdgeJson> edges = new ArrayList<>();
		for (Edge edge : machine.edges()) {
			edges.add(new MachineJson.EdgeJson(machine.qualifiedName(edge.source()), machine.qualifiedName(edge.target()),
					edge.arrowType().symbol(), edge.label(), edgeValue(edge), attributeJson(edge.attributes()),
					edge.sourceMultiplicity(), edge.targetMultiplicity()));
		}
		List<MachineJson.NoteJson> notes = new ArrayList<>();
		for (Note note : machine.notes()) {
			notes.add(new MachineJson.NoteJson(machine.qualifiedName(note.target()), note.content(),
					attributeJson(note.attributes()), annotationJson(note.annotations())));
		}
		List<MachineJson.DependencyJson> dependencies = new ArrayList<>();
		for (InferredDependency dependency : machine.inferredDependencies()) {
			dependencies.add(new MachineJson.DependencyJson(machine.qualifiedName(dependency.source()),
					machine.qualifiedName(dependency.target()), dependency.reason(), dependency.path()));
		}
		return new MachineJson(machine.title(), attributeJson(machine.attributes()), annotationJson(machine.annotations()),
				nullIfEmpty(nodes), nullIfEmpty(edges), nullIfEmpty(notes), nullIfEmpty(dependencies));
	}

	/**
	 * @throws MachineJsonException if a parent or endpoint path names no node, or a parent is
	 * listed after its child
	 */
	public Machine fromMachineJson(MachineJson json) {
		Map<String, NodeId> byPath = new HashMap<>();
		List<String> paths = new ArrayList<>();
		List<List<NodeId>> children = new ArrayList<>();
		List<MachineJson.NodeJson> nodeJsons = orEmpty(json.nodes());
		for (int i = 0; i < nodeJsons.size(); i++) {
			MachineJson.NodeJson node = nodeJsons.get(i);
			if (node.name() == null) {
				throw new MachineJsonException("Node at index %d has no name".formatted(i));
			}
			String path = node.parent() == null ? node.name() : node.parent() + "." + node.name();
			if (node.parent() != null) {
				NodeId parent = byPath.get(node.parent());
				if (parent == null) {
					throw new MachineJsonException("Parent '%s' of '%s' must be listed before it".formatted(node.parent(), path));
				}
				children.get(parent.value()).add(new NodeId(i));
			}
			if (byPath.putIfAbsent(path, new NodeId(i)) != null) {
				throw new MachineJsonException("Duplicate node '%s'".formatted(path));
			}
			paths.add(path);
			children.add(new ArrayList<>());
		}

		List<MachineNode> nodes = new ArrayList<>();
		for (int i = 0; i < nodeJsons.size(); i++) {
			MachineJson.NodeJson node = nodeJsons.get(i);
			nodes.add(new MachineNode(new NodeId(i), node.name(), node.type(), node.title(),
					node.parent() == null ? null : byPath.get(node.parent()), children.get(i),
					toAttributes(node.attributes()), toAnnotations(node.annotations())));
		}

		List<Edge> edges = new ArrayList<>();
		for (MachineJson.EdgeJson edge : orEmpty(json.edges())) {
			ArrowType arrowType = edge.arrowType() == null ? ArrowType.ASSOCIATION
					: ArrowType.fromSymbol(edge.arrowType())
							.orElseThrow(() -> new MachineJsonException("Unknown arrow type '%s'".formatted(edge.arrowType())));
			edges.add(new Edge(endpoint(byPath, edge.source()), endpoint(byPath, edge.target()), arrowType, edge.label(),
					toAttributes(edge.attributes()), edge.sourceMultiplicity(), edge.targetMultiplicity()));
		}
		List<Note> notes = new ArrayList<>();
		for (MachineJson.NoteJson note : orEmpty(json.notes())) {
			NodeId target = endpoint(byPath, note.target());
			notes.add(new Note(target, paths.get(target.value()), note.content(), toAttributes(note.attributes()),
					toAnnotations(note.annotations())));
		}
		List<InferredDependency> dependencies = new ArrayList<>();
		for (MachineJson.DependencyJson dependency : orEmpty(json.inferredDependencies())) {
			dependencies.add(new InferredDependency(endpoint(byPath, dependency.source()),
					endpoint(byPath, dependency.target()), dependency.reason(), dependency.path()));
		}
		return new Machine(json.title(), toAttributes(json.attributes()), toAnnotations(json.annotations()), nodes, edges,
				notes, dependencies);
	}

	/**
	 * Summary of a finished run: status, path, history, final context and the runtime graph.
	 */
	public String toJson(ExecutionResult result) {
		ObjectNode report = mapper.createObjectNode();
		report.put("status", result.status().name());
		report.put("finalNode", result.finalNode());
		report.put("errorCount", result.errorCount());
		report.set("startedAt", mapper.valueToTree(result.startedAt()));
		report.set("finishedAt", mapper.valueToTree(result.finishedAt()));
		if (result.fault() != null) {
			ObjectNode fault = report.putObject("fault");
			fault.put("reason", result.fault().reason().name());
			fault.put("message", result.fault().getMessage());
		}
		ArrayNode history = report.putArray("history");
		for (StepRecord step : result.history()) {
			history.add(mapper.valueToTree(step));
		}
		ObjectNode context = report.putObject("context");
		result.context().forEach((node, values) -> {
			ObjectNode entry = context.putObject(node);
			values.forEach((name, value) -> entry.set(name, valueToJson(AttributeValue.fromJava(value))));
		});
		report.set("machine", mapper.valueToTree(toMachineJson(result.snapshot())));
		try {
			return mapper.writeValueAsString(report);
		} catch (JsonProcessingException e) {
			throw new MachineJsonException("Failed to write run report", e);
		}
	}

	static JsonNode valueToJson(AttributeValue value) {
		if (value instanceof AttributeValue.Number number) {
			return NODES.numberNode(number.value());
		}
		if (value instanceof AttributeValue.Bool bool) {
			return NODES.booleanNode(bool.value());
		}
		if (value instanceof AttributeValue.ListValue list) {
			ArrayNode array = NODES.arrayNode();
			list.items().forEach(item -> array.add(valueToJson(item)));
			return array;
		}
		return NODES.textNode(value.asText());
	}

	static AttributeValue valueFromJson(JsonNode node) {
		if (node == null || node.isNull()) {
			throw new MachineJsonException("Attribute value must not be null");
		}
		if (node.isNumber()) {
			return AttributeValue.number(node.decimalValue());
		}
		if (node.isBoolean()) {
			return AttributeValue.bool(node.booleanValue());
		}
		if (node.isArray()) {
			List<AttributeValue> items = new ArrayList<>();
			node.forEach(item -> items.add(valueFromJson(item)));
			return AttributeValue.list(items);
		}
		if (node.isTextual()) {
			return AttributeValue.text(node.textValue());
		}
		return AttributeValue.text(node.toString());
	}

	private Map<String, JsonNode> edgeValue(Edge edge) {
		Map<String, JsonNode> value = new LinkedHashMap<>();
		if (edge.label() != null) {
			value.put("text", NODES.textNode(edge.label()));
		}
		edge.attributes().forEach(a -> value.put(a.name(), valueToJson(a.value())));
		return value.isEmpty() ? null : value;
	}

	private static List<MachineJson.AttributeJson> attributeJson(List<Attribute> attributes) {
		return nullIfEmpty(attributes.stream()
				.map(a -> new MachineJson.AttributeJson(a.name(), a.type(), valueToJson(a.value())))
				.toList());
	}

	private static List<Attribute> toAttributes(List<MachineJson.AttributeJson> attributes) {
		return orEmpty(attributes).stream()
				.map(a -> new Attribute(a.name(), a.type(), valueFromJson(a.value())))
				.toList();
	}

	private static List<MachineJson.AnnotationJson> annotationJson(List<Annotation> annotations) {
		return nullIfEmpty(annotations.stream().map(a -> new MachineJson.AnnotationJson(a.name(), a.value())).toList());
	}

	private static List<Annotation> toAnnotations(List<MachineJson.AnnotationJson> annotations) {
		return orEmpty(annotations).stream().map(a -> new Annotation(a.name(), a.value())).toList();
	}

	private static NodeId endpoint(Map<String, NodeId> byPath, String path) {
		NodeId id = path == null ? null : byPath.get(path);
		if (id == null) {
			throw new MachineJsonException("Unknown node '%s'".formatted(path));
		}
		return id;
	}

	private static <T> List<T> nullIfEmpty(List<T> list) {
		return list.isEmpty() ? null : list;
	}

	private static <T> List<T> orEmpty(List<T> list) {
		return list == null ? List.of() : list;
	}
}
