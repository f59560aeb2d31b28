package com.vidnyan.storygraph.domain.layout;

/**
 * Canvas geometry of a script unit. Layout only ever replaces the position.
 */
public record UnitBox(
    String id,
    double width,
    double height,
    Position position
) {

    public UnitBox withPosition(Position position) {
        return new UnitBox(id, width, height, position);
    }
}
