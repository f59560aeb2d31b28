package com.vidnyan.storygraph.domain.graph;

import com.vidnyan.storygraph.domain.model.*;

import java.util.*;

/**
 * Unit-level graph: one deduplicated link per pair of script units connected by
 * a jump or call, plus the role classification of every unit.
 * Immutable; built once per analysis pass.
 */
public final class UnitGraph {

    private final List<UnitLink> links;
    private final Map<String, List<String>> invalidJumps;
    private final Map<String, Set<String>> successors;   // unit → units it links to
    private final Map<String, Set<String>> predecessors; // unit → units linking to it
    private final UnitClassification classification;

    private UnitGraph(
            List<UnitLink> links,
            Map<String, List<String>> invalidJumps,
            Map<String, Set<String>> successors,
            Map<String, Set<String>> predecessors,
            UnitClassification classification
    ) {
        this.links = Collections.unmodifiableList(links);
        this.invalidJumps = Collections.unmodifiableMap(invalidJumps);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.classification = classification;
    }

    /**
     * Build the unit graph from extracted facts.
     * @param model Extracted facts
     * @param storyPaths File paths always treated as story units
     */
    public static UnitGraph build(ScriptModel model, Collection<String> storyPaths) {
        List<UnitLink> links = new ArrayList<>();
        Set<String> linkKeys = new HashSet<>();
        Map<String, List<String>> invalid = new LinkedHashMap<>();
        Map<String, Set<String>> successors = new LinkedHashMap<>();
        Map<String, Set<String>> predecessors = new LinkedHashMap<>();

        for (Map.Entry<String, List<Transfer>> entry : model.transfers().entrySet()) {
            String unitId = entry.getKey();
            for (Transfer transfer : entry.getValue()) {
                Optional<Label> target = model.getLabel(transfer.target());
                if (target.isPresent()) {
                    String targetUnit = target.get().unitId();
                    if (!unitId.equals(targetUnit) && linkKeys.add(unitId + "\u0000" + targetUnit)) {
                        links.add(new UnitLink(unitId, targetUnit, transfer.target()));
                        successors.computeIfAbsent(unitId, k -> new LinkedHashSet<>()).add(targetUnit);
                        predecessors.computeIfAbsent(targetUnit, k -> new LinkedHashSet<>()).add(unitId);
                    }
                } else if (!transfer.dynamic()) {
                    List<String> names = invalid.computeIfAbsent(unitId, k -> new ArrayList<>());
                    if (!names.contains(transfer.target())) {
                        names.add(transfer.target());
                    }
                }
            }
        }

        invalid.replaceAll((k, v) -> List.copyOf(v));
        UnitClassification classification = classify(model, links, storyPaths);
        return new UnitGraph(links, invalid, successors, predecessors, classification);
    }

    private static UnitClassification classify(ScriptModel model, List<UnitLink> links,
                                               Collection<String> storyPaths) {
        Set<String> targets = new HashSet<>();
        links.forEach(l -> targets.add(l.targetId()));

        Set<String> roots = new LinkedHashSet<>();
        Set<String> leaves = new LinkedHashSet<>();
        Set<String> branching = new LinkedHashSet<>();

        for (ScriptUnit unit : model.units()) {
            List<Transfer> transfers = model.transfersOf(unit.id());
            if (!targets.contains(unit.id())) {
                roots.add(unit.id());
            }
            if (transfers.isEmpty()) {
                leaves.add(unit.id());
            }
            Set<String> targetUnits = new HashSet<>();
            for (Transfer t : transfers) {
                model.getLabel(t.target()).ifPresent(l -> targetUnits.add(l.unitId()));
            }
            if (model.hasContent(unit.id(), ContentType.MENU) || targetUnits.size() > 1) {
                branching.add(unit.id());
            }
        }

        Set<String> screenUnits = new LinkedHashSet<>();
        model.screens().values().forEach(s -> screenUnits.add(s.unitId()));

        Set<String> story = new LinkedHashSet<>();
        model.labels().values().forEach(l -> story.add(l.unitId()));
        for (ScriptUnit unit : model.units()) {
            if (unit.filePath() != null && storyPaths.contains(unit.filePath())) {
                story.add(unit.id());
            }
        }

        Set<String> screenOnly = new LinkedHashSet<>(screenUnits);
        screenOnly.removeAll(story);

        Set<String> config = new LinkedHashSet<>();
        for (ScriptUnit unit : model.units()) {
            if (!story.contains(unit.id()) && !screenUnits.contains(unit.id())) {
                config.add(unit.id());
            }
        }

        return new UnitClassification(
                Collections.unmodifiableSet(roots),
                Collections.unmodifiableSet(leaves),
                Collections.unmodifiableSet(branching),
                Collections.unmodifiableSet(story),
                Collections.unmodifiableSet(screenOnly),
                Collections.unmodifiableSet(config));
    }

    /**
     * Get all unit links in discovery order.
     */
    public List<UnitLink> getLinks() {
        return links;
    }

    /**
     * Get unresolved jump targets per unit.
     */
    public Map<String, List<String>> getInvalidJumps() {
        return invalidJumps;
    }

    /**
     * Get units a unit transfers control to.
     */
    public Set<String> getSuccessors(String unitId) {
        return successors.getOrDefault(unitId, Set.of());
    }

    /**
     * Get units that transfer control into a unit.
     */
    public Set<String> getPredecessors(String unitId) {
        return predecessors.getOrDefault(unitId, Set.of());
    }

    public UnitClassification getClassification() {
        return classification;
    }

    /**
     * Get graph statistics.
     */
    public Stats stats() {
        return new Stats(
                links.size(),
                invalidJumps.values().stream().mapToInt(List::size).sum(),
                classification.roots().size(),
                classification.leaves().size()
        );
    }

    public record Stats(int linkCount, int invalidJumpCount, int rootCount, int leafCount) {}
}
