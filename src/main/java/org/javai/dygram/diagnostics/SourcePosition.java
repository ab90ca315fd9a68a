package org.javai.dygram.diagnostics;

/**
 * A 1-based line/column location in DyGram source text.
 */
public record SourcePosition(int line, int column) {

	public SourcePosition {
		if (line < 1 || column < 1) {
			throw new IllegalArgumentException("line and column are 1-based");
		}
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
