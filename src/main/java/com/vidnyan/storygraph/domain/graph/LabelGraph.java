package com.vidnyan.storygraph.domain.graph;

import com.vidnyan.storygraph.domain.model.Label;
import com.vidnyan.storygraph.domain.model.ScriptModel;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import com.vidnyan.storygraph.domain.model.Transfer;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Label-level flow graph used for route discovery.
 * Nodes are plain labels; edges are explicit jumps/calls and implicit
 * fall-through into the next label of the same unit.
 * Immutable; built once per analysis pass.
 */
public final class LabelGraph {

    private static final Pattern TERMINAL = Pattern.compile("\\b(jump|call|return)\\b");
    private static final Pattern RETURN = Pattern.compile("\\breturn\\b");
    private static final String START_LABEL = "start";

    private final Map<String, LabelNode> nodes;
    private final List<RouteEdge> edges;
    private final Map<String, List<RouteEdge>> outgoing;
    private final Map<String, List<RouteEdge>> incoming;
    private final Map<String, LabelSpan> spans;
    private final List<String> entryNodes;
    private final Set<String> terminalNodes;

    private LabelGraph(
            Map<String, LabelNode> nodes,
            List<RouteEdge> edges,
            Map<String, List<RouteEdge>> outgoing,
            Map<String, List<RouteEdge>> incoming,
            Map<String, LabelSpan> spans,
            List<String> entryNodes,
            Set<String> terminalNodes
    ) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
        this.spans = Collections.unmodifiableMap(spans);
        this.entryNodes = Collections.unmodifiableList(entryNodes);
        this.terminalNodes = Collections.unmodifiableSet(terminalNodes);
    }

    /**
     * Line range of a label's body and the control keywords found in it.
     * Lines are 1-based; the body runs from the line after the header to endLine.
     */
    public record LabelSpan(
        String label,
        int startLine,
        int endLine,
        boolean hasTerminal,
        boolean hasReturn
    ) {}

    /**
     * Build the label graph from extracted facts.
     */
    public static LabelGraph build(ScriptModel model) {
        Map<String, LabelNode> nodes = new LinkedHashMap<>();
        Map<String, LabelSpan> spans = new LinkedHashMap<>();
        Map<String, List<LabelSpan>> unitSpans = new LinkedHashMap<>();

        for (ScriptUnit unit : model.units()) {
            List<Label> labels = model.plainLabelsIn(unit.id());
            if (labels.isEmpty()) {
                continue;
            }
            String[] lines = unit.text().split("\r?\n", -1);
            List<LabelSpan> inUnit = new ArrayList<>();

            for (int i = 0; i < labels.size(); i++) {
                Label label = labels.get(i);
                int endLine = i + 1 < labels.size() ? labels.get(i + 1).line() - 1 : lines.length;
                String body = joinLines(lines, label.line(), endLine);
                LabelSpan span = new LabelSpan(label.name(), label.line(), endLine,
                        TERMINAL.matcher(body).find(), RETURN.matcher(body).find());
                inUnit.add(span);

                String nodeId = LabelNode.idOf(unit.id(), label.name());
                nodes.put(nodeId, new LabelNode(nodeId, unit.id(), label.name(), unit.displayName(),
                        label.line(), LabelNode.DEFAULT_WIDTH, LabelNode.DEFAULT_HEIGHT));
                spans.put(nodeId, span);
            }
            unitSpans.put(unit.id(), inUnit);
        }

        List<RouteEdge> edges = new ArrayList<>();
        int edgeCounter = 0;
        for (ScriptUnit unit : model.units()) {
            List<LabelSpan> inUnit = unitSpans.getOrDefault(unit.id(), List.of());

            for (Transfer transfer : model.transfersOf(unit.id())) {
                LabelSpan source = enclosingSpan(inUnit, transfer.line());
                if (source == null) {
                    continue;
                }
                Label target = model.labels().get(transfer.target());
                if (target == null || target.isMenu()) {
                    continue;
                }
                RouteEdge.EdgeKind kind = transfer.kind() == Transfer.TransferKind.CALL
                        ? RouteEdge.EdgeKind.CALL : RouteEdge.EdgeKind.JUMP;
                edges.add(new RouteEdge("rlink-" + edgeCounter++,
                        LabelNode.idOf(unit.id(), source.label()), target.nodeId(), kind));
            }

            for (int i = 0; i < inUnit.size() - 1; i++) {
                LabelSpan current = inUnit.get(i);
                if (!current.hasTerminal()) {
                    edges.add(new RouteEdge("rlink-" + edgeCounter++,
                            LabelNode.idOf(unit.id(), current.label()),
                            LabelNode.idOf(unit.id(), inUnit.get(i + 1).label()),
                            RouteEdge.EdgeKind.IMPLICIT));
                }
            }
        }

        Map<String, List<RouteEdge>> outgoing = new LinkedHashMap<>();
        Map<String, List<RouteEdge>> incoming = new LinkedHashMap<>();
        for (RouteEdge edge : edges) {
            outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        }

        List<String> entries = new ArrayList<>();
        Label start = model.labels().get(START_LABEL);
        if (start != null && !start.isMenu() && nodes.containsKey(start.nodeId())) {
            entries.add(start.nodeId());
        }
        if (entries.isEmpty()) {
            nodes.keySet().stream()
                    .filter(id -> !incoming.containsKey(id))
                    .forEach(entries::add);
        }

        // A body containing "return" always has a terminal keyword too, so
        // out-degree zero is the only condition that ends a route.
        Set<String> terminals = new LinkedHashSet<>();
        nodes.keySet().stream()
                .filter(id -> !outgoing.containsKey(id))
                .forEach(terminals::add);

        return new LabelGraph(nodes, edges, outgoing, incoming, spans, entries, terminals);
    }

    private static String joinLines(String[] lines, int from, int to) {
        int end = Math.min(to, lines.length);
        if (from >= end) {
            return "";
        }
        return String.join("\n", Arrays.asList(lines).subList(from, end));
    }

    /**
     * Nearest label at or above the given line.
     */
    private static LabelSpan enclosingSpan(List<LabelSpan> spans, int line) {
        LabelSpan found = null;
        for (LabelSpan span : spans) {
            if (span.startLine() <= line) {
                found = span;
            }
        }
        return found;
    }

    /**
     * Enumerate every distinct simple path from the entry nodes to a terminal node.
     * Cycles are cut per path, so one node may appear on several routes.
     * Routes are numbered and coloured in discovery order.
     */
    public List<Route> findRoutes() {
        Map<String, FoundPath> unique = new LinkedHashMap<>();
        for (String entry : entryNodes) {
            findRoutesRecursive(entry, new ArrayList<>(), new ArrayList<>(), new HashSet<>(), unique);
        }

        List<Route> routes = new ArrayList<>();
        for (FoundPath path : unique.values()) {
            int index = routes.size();
            routes.add(new Route(index, Palette.forIndex(index), path.edgeIds(), path.nodeIds()));
        }
        return routes;
    }

    private record FoundPath(List<String> nodeIds, List<String> edgeIds) {}

    private void findRoutesRecursive(
            String current,
            List<String> edgePath,
            List<String> nodePath,
            Set<String> onPath,
            Map<String, FoundPath> unique
    ) {
        if (onPath.contains(current)) {
            return;
        }
        onPath.add(current);
        nodePath.add(current);

        List<RouteEdge> next = getOutgoing(current);
        if (terminalNodes.contains(current) || next.isEmpty()) {
            if (!edgePath.isEmpty()) {
                unique.putIfAbsent(String.join("->", nodePath),
                        new FoundPath(List.copyOf(nodePath), List.copyOf(edgePath)));
            }
        } else {
            for (RouteEdge edge : next) {
                edgePath.add(edge.id());
                findRoutesRecursive(edge.targetId(), edgePath, nodePath, onPath, unique);
                edgePath.remove(edgePath.size() - 1);
            }
        }

        nodePath.remove(nodePath.size() - 1);
        onPath.remove(current);
    }

    /**
     * Get all label nodes in unit and line order.
     */
    public List<LabelNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<LabelNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<RouteEdge> getEdges() {
        return edges;
    }

    public List<RouteEdge> getOutgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<RouteEdge> getIncoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public Optional<LabelSpan> getSpan(String nodeId) {
        return Optional.ofNullable(spans.get(nodeId));
    }

    public List<String> getEntryNodes() {
        return entryNodes;
    }

    public Set<String> getTerminalNodes() {
        return terminalNodes;
    }

    /**
     * Get graph statistics.
     */
    public Stats stats() {
        return new Stats(nodes.size(), edges.size(), entryNodes.size(), terminalNodes.size());
    }

    public record Stats(int nodeCount, int edgeCount, int entryCount, int terminalCount) {}
}
