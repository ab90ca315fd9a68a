package org.javai.dygram.diagnostics;

/**
 * Error taxonomy for compile-time diagnostics.
 */
public enum DiagnosticKind {
	/** Lexer or parser failure. Blocks all later phases for the document. */
	SYNTAX_ERROR,
	/** Node-tree construction ambiguity that was resolved by the merge rules. */
	MERGE_CONFLICT,
	/** Edge, note or template reference that could not be resolved. */
	REFERENCE_ERROR,
	/** Attribute value that does not match its declared type. */
	TYPE_MISMATCH,
	/** Annotation compatibility or node-type rule breach. */
	SEMANTIC_VIOLATION,
	/** Structural graph findings: cycles, unreachable and orphan nodes, multiplicities. */
	GRAPH
}
