package com.vidnyan.storygraph.domain.model;

/**
 * A named entry point inside a script unit.
 * Line and column are 1-based.
 */
public record Label(
    String name,
    String unitId,
    int line,
    int column,
    LabelKind kind
) {

    public enum LabelKind {
        LABEL,  // label name:
        MENU    // menu name:
    }

    public boolean isMenu() {
        return kind == LabelKind.MENU;
    }

    /**
     * Id of the label-graph node for this label.
     */
    public String nodeId() {
        return unitId + ":" + name;
    }
}
