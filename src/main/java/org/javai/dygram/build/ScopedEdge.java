package org.javai.dygram.build;

import org.javai.dygram.parse.EdgeDeclaration;

/**
 * An edge declaration together with the path of the block it was written in
 * ({@code null} at document level).
 */
public record ScopedEdge(EdgeDeclaration declaration, String scopePath) {
}
