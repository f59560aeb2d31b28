package com.vidnyan.storygraph.domain.layout;

import com.vidnyan.storygraph.domain.model.UnitLink;

import java.util.*;

/**
 * Left-to-right layered layout of the unit graph.
 *
 * Layers come from Kahn's algorithm. A fully cyclic graph is seeded with the unit
 * of smallest in-degree, and units never reached are appended as one last layer,
 * so cyclic input always terminates.
 */
public final class LayeredLayout {

    private final double horizontalPadding;
    private final double verticalPadding;

    public LayeredLayout(double horizontalPadding, double verticalPadding) {
        this.horizontalPadding = horizontalPadding;
        this.verticalPadding = verticalPadding;
    }

    /**
     * Assign units to layers. Every input unit appears in exactly one layer.
     */
    public List<List<String>> computeLayers(List<UnitBox> boxes, List<UnitLink> links) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (UnitBox box : boxes) {
            adjacency.put(box.id(), new ArrayList<>());
            inDegree.put(box.id(), 0);
        }
        for (UnitLink link : links) {
            if (adjacency.containsKey(link.sourceId()) && inDegree.containsKey(link.targetId())) {
                adjacency.get(link.sourceId()).add(link.targetId());
                inDegree.merge(link.targetId(), 1, Integer::sum);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });
        if (queue.isEmpty() && !boxes.isEmpty()) {
            inDegree.entrySet().stream()
                    .min(Map.Entry.comparingByValue())
                    .ifPresent(e -> queue.add(e.getKey()));
        }

        List<List<String>> layers = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            int layerSize = queue.size();
            List<String> layer = new ArrayList<>();
            for (int i = 0; i < layerSize; i++) {
                String id = queue.poll();
                if (!visited.add(id)) {
                    continue;
                }
                layer.add(id);
                for (String next : adjacency.get(id)) {
                    if (inDegree.merge(next, -1, Integer::sum) == 0) {
                        queue.add(next);
                    }
                }
            }
            if (!layer.isEmpty()) {
                layers.add(layer);
            }
        }

        if (visited.size() < boxes.size()) {
            List<String> stragglers = new ArrayList<>();
            for (UnitBox box : boxes) {
                if (!visited.contains(box.id())) {
                    stragglers.add(box.id());
                }
            }
            layers.add(stragglers);
        }
        return layers;
    }

    /**
     * Position every unit. Each layer is a column, centred on y = 0, with units
     * centred horizontally within the widest unit of the column.
     * @return Boxes in input order with new positions
     */
    public List<UnitBox> layout(List<UnitBox> boxes, List<UnitLink> links) {
        Map<String, UnitBox> byId = new LinkedHashMap<>();
        boxes.forEach(b -> byId.put(b.id(), b));
        Map<String, Position> positions = new HashMap<>();

        double x = 0;
        for (List<String> layer : computeLayers(boxes, links)) {
            double maxWidth = 0;
            double totalHeight = 0;
            for (String id : layer) {
                maxWidth = Math.max(maxWidth, byId.get(id).width());
                totalHeight += byId.get(id).height();
            }
            double y = -(totalHeight + (layer.size() - 1) * verticalPadding) / 2;
            for (String id : layer) {
                UnitBox box = byId.get(id);
                positions.put(id, new Position(x + (maxWidth - box.width()) / 2, y));
                y += box.height() + verticalPadding;
            }
            x += maxWidth + horizontalPadding;
        }

        return boxes.stream()
                .map(b -> b.withPosition(positions.getOrDefault(b.id(), b.position())))
                .toList();
    }
}
