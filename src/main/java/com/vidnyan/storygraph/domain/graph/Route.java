package com.vidnyan.storygraph.domain.graph;

import java.util.List;

/**
 * One distinct narrative path from an entry label to a terminal label.
 * Edge and node ids are in traversal order.
 */
public record Route(
    int id,
    String color,
    List<String> edgeIds,
    List<String> nodeIds
) {

    /**
     * Format the route as a readable string.
     */
    public String format() {
        return String.join(" → ", nodeIds);
    }
}
