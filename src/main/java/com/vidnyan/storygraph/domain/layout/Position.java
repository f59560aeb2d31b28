package com.vidnyan.storygraph.domain.layout;

public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);
}
