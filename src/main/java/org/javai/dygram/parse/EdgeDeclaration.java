package org.javai.dygram.parse;

import java.util.List;
import org.javai.dygram.diagnostics.SourcePosition;

/**
 * {@code a, b -> c -label-> d;} as written. Each segment's sources are the previous
 * segment's targets (or {@link #sources()} for the first one).
 */
public record EdgeDeclaration(List<String> sources, List<EdgeSegment> segments, SourcePosition position) {

	public EdgeDeclaration {
		sources = List.copyOf(sources);
		segments = List.copyOf(segments);
		if (segments.isEmpty()) {
			throw new IllegalArgumentException("an edge declaration needs at least one segment");
		}
	}
}
