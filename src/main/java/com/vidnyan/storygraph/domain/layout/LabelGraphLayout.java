package com.vidnyan.storygraph.domain.layout;

import com.vidnyan.storygraph.domain.graph.LabelNode;
import com.vidnyan.storygraph.domain.graph.RouteEdge;

import java.util.*;

/**
 * Breadth-first layout for the route diagram.
 * Nodes without incoming edges start at depth 0; each remaining island
 * (typically a cycle) starts two columns right of the deepest column so far.
 */
public final class LabelGraphLayout {

    private static final double MARGIN = 50;

    private final double columnSpacing;
    private final double rowSpacing;

    public LabelGraphLayout(double columnSpacing, double rowSpacing) {
        this.columnSpacing = columnSpacing;
        this.rowSpacing = rowSpacing;
    }

    /**
     * @return Position per node id, in node order
     */
    public Map<String, Position> layout(List<LabelNode> nodes, List<RouteEdge> edges) {
        Map<String, List<String>> outgoing = new HashMap<>();
        Set<String> hasIncoming = new HashSet<>();
        Set<String> known = new HashSet<>();
        nodes.forEach(n -> known.add(n.id()));
        for (RouteEdge edge : edges) {
            if (known.contains(edge.sourceId()) && known.contains(edge.targetId())) {
                outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge.targetId());
                hasIncoming.add(edge.targetId());
            }
        }

        Set<String> visited = new HashSet<>();
        NavigableMap<Integer, List<String>> layers = new TreeMap<>();

        List<String> roots = nodes.stream()
                .map(LabelNode::id)
                .filter(id -> !hasIncoming.contains(id))
                .toList();
        visitFrom(roots, 0, outgoing, visited, layers);

        for (LabelNode node : nodes) {
            if (visited.contains(node.id())) {
                continue;
            }
            int maxDepth = layers.isEmpty() ? -1 : layers.lastKey();
            visitFrom(List.of(node.id()), maxDepth + 2, outgoing, visited, layers);
        }

        Map<String, Position> positions = new HashMap<>();
        layers.forEach((depth, ids) -> {
            for (int i = 0; i < ids.size(); i++) {
                positions.put(ids.get(i), new Position(depth * columnSpacing + MARGIN, i * rowSpacing + MARGIN));
            }
        });

        Map<String, Position> ordered = new LinkedHashMap<>();
        nodes.forEach(n -> ordered.put(n.id(), positions.get(n.id())));
        return ordered;
    }

    private void visitFrom(List<String> starts, int baseDepth, Map<String, List<String>> outgoing,
                           Set<String> visited, Map<Integer, List<String>> layers) {
        Deque<Map.Entry<String, Integer>> queue = new ArrayDeque<>();
        for (String id : starts) {
            visited.add(id);
            queue.add(Map.entry(id, baseDepth));
        }
        while (!queue.isEmpty()) {
            Map.Entry<String, Integer> current = queue.poll();
            layers.computeIfAbsent(current.getValue(), k -> new ArrayList<>()).add(current.getKey());
            for (String next : outgoing.getOrDefault(current.getKey(), List.of())) {
                if (visited.add(next)) {
                    queue.add(Map.entry(next, current.getValue() + 1));
                }
            }
        }
    }
}
