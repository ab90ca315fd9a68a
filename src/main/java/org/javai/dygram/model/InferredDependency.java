package org.javai.dygram.model;

import java.util.Objects;

/**
 * Relation derived from a template reference such as {@code {{ config.apiKey }}}.
 *
 * @param source node whose attribute contains the reference
 * @param target node that owns the referenced attribute
 * @param reason why the dependency exists, e.g. {@code reads prompt}
 * @param path the referenced path, e.g. {@code config.apiKey}
 */
public record InferredDependency(NodeId source, NodeId target, String reason, String path) {

	public InferredDependency {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(reason, "reason must not be null");
		Objects.requireNonNull(path, "path must not be null");
	}
}
