package org.javai.dygram.validate;

/**
 * Size and shape of a machine graph.
 *
 * @param nodeCount all nodes
 * @param edgeCount all edges
 * @param entryPoints init nodes
 * @param exitPoints nodes taking part in control flow without outgoing edges
 * @param cycleCount distinct cycles
 */
public record GraphStatistics(int nodeCount, int edgeCount, int entryPoints, int exitPoints, int cycleCount) {
}
