package com.vidnyan.storygraph.application.service;

import com.vidnyan.storygraph.domain.model.ScriptUnit;
import com.vidnyan.storygraph.domain.model.UnitLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Gathers the script that can lead into a unit, for use as writing-assistant context.
 */
@Slf4j
@Service
public class StoryContextService {

    /**
     * Ancestors of a unit and the framed script text of those ancestors.
     */
    public record StoryContext(
        String unitId,
        List<String> ancestorIds,
        String promptContext
    ) {

        public boolean hasAncestors() {
            return !ancestorIds.isEmpty();
        }
    }

    /**
     * Walk the unit links backwards from a unit, breadth first.
     * @throws IllegalArgumentException if the unit is not among the given units
     */
    public StoryContext buildContext(List<ScriptUnit> units, List<UnitLink> links, String unitId) {
        Map<String, ScriptUnit> byId = new LinkedHashMap<>();
        units.forEach(u -> byId.put(u.id(), u));
        if (!byId.containsKey(unitId)) {
            throw new IllegalArgumentException("Unknown unit: " + unitId);
        }

        List<String> ancestors = findAncestors(links, unitId);
        log.debug("Unit {} has {} ancestor units", unitId, ancestors.size());

        StringJoiner context = new StringJoiner("\n\n");
        for (String id : ancestors) {
            ScriptUnit unit = byId.get(id);
            if (unit != null) {
                String name = (unit.filePath() != null ? unit.filePath() : unit.id()) + ".rpy";
                context.add("### START FILE: " + name + " ###\n" + unit.text() + "\n### END FILE: " + name + " ###");
            }
        }
        return new StoryContext(unitId, ancestors, context.toString());
    }

    /**
     * Units from which the given unit can be reached, in discovery order.
     */
    public List<String> findAncestors(List<UnitLink> links, String unitId) {
        Map<String, Set<String>> reverse = new HashMap<>();
        for (UnitLink link : links) {
            reverse.computeIfAbsent(link.targetId(), k -> new LinkedHashSet<>()).add(link.sourceId());
        }

        List<String> ancestors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new LinkedList<>();
        queue.add(unitId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (!current.equals(unitId)) {
                ancestors.add(current);
            }
            for (String predecessor : reverse.getOrDefault(current, Set.of())) {
                if (!visited.contains(predecessor)) {
                    queue.add(predecessor);
                }
            }
        }
        return ancestors;
    }
}
