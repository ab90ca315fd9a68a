package org.javai.dygram.parse;

import org.javai.dygram.diagnostics.SourcePosition;

/**
 * Raised for a syntax error in DyGram source. The parser catches it per statement and
 * turns it into a diagnostic.
 */
public class DygramParseException extends RuntimeException {

	private final SourcePosition position;

	public DygramParseException(String message, SourcePosition position) {
		super(message);
		this.position = position;
	}

	public DygramParseException(String message, SourcePosition position, Throwable cause) {
		super(message, cause);
		this.position = position;
	}

	public SourcePosition position() {
		return position;
	}
}
