package com.vidnyan.storygraph.domain.model;

/**
 * A line spoken by a known character.
 */
public record DialogueLine(String unitId, int line, String tag) {}
