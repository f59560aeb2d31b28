package com.vidnyan.storygraph.domain.graph;

/**
 * Directed edge between two label nodes.
 */
public record RouteEdge(
    String id,
    String sourceId,
    String targetId,
    EdgeKind kind
) {

    public enum EdgeKind {
        JUMP,
        CALL,
        IMPLICIT    // falls through into the next label of the same unit
    }
}
