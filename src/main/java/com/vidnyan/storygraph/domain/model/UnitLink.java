package com.vidnyan.storygraph.domain.model;

/**
 * Deduplicated edge between two different script units.
 * Carries the label name of the first transfer that produced it.
 */
public record UnitLink(
    String sourceId,
    String targetId,
    String targetLabel
) {}
