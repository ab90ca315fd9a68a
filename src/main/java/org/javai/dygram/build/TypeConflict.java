package org.javai.dygram.build;

import org.javai.dygram.diagnostics.SourcePosition;

/**
 * Two declarations of the same node path with different explicit types.
 *
 * @param path qualified path of the node
 * @param existingType type held before the later declaration
 * @param declaredType type of the later declaration
 * @param keptType type the node ended up with
 * @param strict whether the machine was in strict mode
 * @param position position of the later declaration
 */
public record TypeConflict(String path, String existingType, String declaredType, String keptType, boolean strict,
		SourcePosition position) {
}
