package org.javai.dygram.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of relationship kinds an edge can express.
 */
public enum ArrowType {
	ASSOCIATION("->"),
	DEPENDENCY("-->"),
	INHERITANCE("<|--"),
	COMPOSITION("*-->"),
	AGGREGATION("o-->"),
	BIDIRECTIONAL("<-->"),
	EMPHASIS("=>");

	private final String symbol;

	ArrowType(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public static Optional<ArrowType> fromSymbol(String symbol) {
		return Arrays.stream(values()).filter(t -> t.symbol.equals(symbol)).findFirst();
	}

	/**
	 * Whether traversal from source to target represents control flow. Structural
	 * relationships (inheritance, composition, aggregation) do not move execution.
	 */
	public boolean isTraversable() {
		return switch (this) {
			case ASSOCIATION, DEPENDENCY, BIDIRECTIONAL, EMPHASIS -> true;
			case INHERITANCE, COMPOSITION, AGGREGATION -> false;
		};
	}

	/**
	 * Whether the edge may also be followed from target to source.
	 */
	public boolean isBidirectional() {
		return this == BIDIRECTIONAL;
	}

	/**
	 * Whether multiplicities on this kind of edge carry meaning.
	 */
	public boolean supportsMultiplicity() {
		return switch (this) {
			case ASSOCIATION, DEPENDENCY, COMPOSITION, AGGREGATION, BIDIRECTIONAL -> true;
			case INHERITANCE, EMPHASIS -> false;
		};
	}
}
