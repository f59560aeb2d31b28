package com.vidnyan.storygraph.domain.graph;

import java.util.Set;

/**
 * Role of each script unit in the unit graph, used for diagram styling.
 * A unit may be in several of root, leaf and branching; story, screenOnly and
 * config partition the units.
 */
public record UnitClassification(
    Set<String> roots,
    Set<String> leaves,
    Set<String> branching,
    Set<String> story,
    Set<String> screenOnly,
    Set<String> config
) {}
