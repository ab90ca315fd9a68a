package org.javai.dygram.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON form of a machine. Node parents and all edge, note and dependency endpoints
 * are written as qualified paths.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "title": "Review",
 *   "nodes": [
 *     { "name": "start", "type": "init" },
 *     { "name": "Draft", "type": "task", "parent": "Flow", "attributes": [ { "name": "prompt", "value": "..." } ] }
 *   ],
 *   "edges": [
 *     { "source": "start", "target": "Flow.Draft", "arrowType": "->", "label": "begin", "value": { "text": "begin" } }
 *   ]
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MachineJson(
		@JsonProperty("title") String title,
		@JsonProperty("attributes") List<AttributeJson> attributes,
		@JsonProperty("annotations") List<AnnotationJson> annotations,
		@JsonProperty("nodes") List<NodeJson> nodes,
		@JsonProperty("edges") List<EdgeJson> edges,
		@JsonProperty("notes") List<NoteJson> notes,
		@JsonProperty("inferredDependencies") List<DependencyJson> inferredDependencies
) {

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record AttributeJson(
			@JsonProperty("name") String name,
			@JsonProperty("type") String type,
			@JsonProperty("value") JsonNode value
	) {
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record AnnotationJson(
			@JsonProperty("name") String name,
			@JsonProperty("value") String value
	) {
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record NodeJson(
			@JsonProperty("name") String name,
			@JsonProperty("type") String type,
			@JsonProperty("title") String title,
			@JsonProperty("parent") String parent,
			@JsonProperty("attributes") List<AttributeJson> attributes,
			@JsonProperty("annotations") List<AnnotationJson> annotations
	) {
	}

	/**
	 * {@code value} repeats the label as {@code text} together with the attribute values, for
	 * consumers that read edges as a single map. It is not read back.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record EdgeJson(
			@JsonProperty("source") String source,
			@JsonProperty("target") String target,
			@JsonProperty("arrowType") String arrowType,
			@JsonProperty("label") String label,
			@JsonProperty("value") Map<String, JsonNode> value,
			@JsonProperty("attributes") List<AttributeJson> attributes,
			@JsonProperty("sourceMultiplicity") String sourceMultiplicity,
			@JsonProperty("targetMultiplicity") String targetMultiplicity
	) {
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record NoteJson(
			@JsonProperty("target") String target,
			@JsonProperty("content") String content,
			@JsonProperty("attributes") List<AttributeJson> attributes,
			@JsonProperty("annotations") List<AnnotationJson> annotations
	) {
	}

	public record DependencyJson(
			@JsonProperty("source") String source,
			@JsonProperty("target") String target,
			@JsonProperty("reason") String reason,
			@JsonProperty("path") String path
	) {
	}
}
