package com.vidnyan.storygraph.domain.model;

/**
 * A {@code screen name(params):} definition. Parameters keep their parentheses.
 */
public record ScreenDef(
    String name,
    String parameters,
    String unitId,
    int line
) {}
