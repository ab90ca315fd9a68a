package org.javai.dygram.resolve;

import java.util.List;
import org.javai.dygram.model.NodeId;

/**
 * Outcome of resolving a node reference.
 */
public sealed interface Resolution {

	String reference();

	record Resolved(String reference, NodeId node) implements Resolution {
	}

	/**
	 * Several nodes match and no enclosing scope singles one out.
	 *
	 * @param candidates qualified paths of every match
	 */
	record Ambiguous(String reference, List<String> candidates) implements Resolution {
		public Ambiguous {
			candidates = List.copyOf(candidates);
		}
	}

	record Unresolved(String reference) implements Resolution {
	}

	default boolean isResolved() {
		return this instanceof Resolved;
	}
}
