package org.javai.dygram.parse;

import java.util.List;
import org.javai.dygram.diagnostics.Diagnostic;

/**
 * Raw declaration list for one document plus the syntax errors found while parsing it.
 */
public record ParsedDocument(
		String title,
		List<AnnotationDeclaration> annotations,
		List<AttributeDeclaration> attributes,
		List<NodeDeclaration> nodes,
		List<EdgeDeclaration> edges,
		List<NoteDeclaration> notes,
		List<Diagnostic> syntaxErrors
) {

	public ParsedDocument {
		annotations = List.copyOf(annotations);
		attributes = List.copyOf(attributes);
		nodes = List.copyOf(nodes);
		edges = List.copyOf(edges);
		notes = List.copyOf(notes);
		syntaxErrors = List.copyOf(syntaxErrors);
	}

	public boolean hasSyntaxErrors() {
		return !syntaxErrors.isEmpty();
	}
}
