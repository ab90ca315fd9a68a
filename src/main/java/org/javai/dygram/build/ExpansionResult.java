package org.javai.dygram.build;

import java.util.List;

/**
 * Output of {@link QualifiedNameExpander}: the merged node tree plus the edge and note
 * declarations still to be resolved against it.
 */
public record ExpansionResult(NodeTree tree, List<ScopedEdge> edges, List<ScopedNote> notes,
		List<TypeConflict> typeConflicts) {

	public ExpansionResult {
		edges = List.copyOf(edges);
		notes = List.copyOf(notes);
		typeConflicts = List.copyOf(typeConflicts);
	}
}
