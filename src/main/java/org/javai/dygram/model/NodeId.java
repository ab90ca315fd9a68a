package org.javai.dygram.model;

/**
 * Stable arena index of a node inside a {@link Machine}.
 */
public record NodeId(int value) implements Comparable<NodeId> {

	public NodeId {
		if (value < 0) {
			throw new IllegalArgumentException("node id must be non-negative");
		}
	}

	@Override
	public int compareTo(NodeId other) {
		return Integer.compare(value, other.value);
	}

	@Override
	public String toString() {
		return "#" + value;
	}
}
