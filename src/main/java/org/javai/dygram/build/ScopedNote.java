package org.javai.dygram.build;

import org.javai.dygram.parse.NoteDeclaration;

/**
 * A note declaration together with the path of the block it was written in
 * ({@code null} at document level).
 */
public record ScopedNote(NoteDeclaration declaration, String scopePath) {
}
