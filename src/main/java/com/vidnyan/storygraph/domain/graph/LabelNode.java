package com.vidnyan.storygraph.domain.graph;

/**
 * A node of the label-level graph: one plain label of one unit.
 */
public record LabelNode(
    String id,
    String unitId,
    String label,
    String containerName,
    int startLine,
    double width,
    double height
) {

    public static final double DEFAULT_WIDTH = 180;
    public static final double DEFAULT_HEIGHT = 40;

    public static String idOf(String unitId, String label) {
        return unitId + ":" + label;
    }
}
