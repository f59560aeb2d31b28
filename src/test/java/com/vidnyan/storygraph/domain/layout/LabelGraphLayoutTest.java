package com.vidnyan.storygraph.domain.layout;

import com.vidnyan.storygraph.domain.graph.LabelNode;
import com.vidnyan.storygraph.domain.graph.RouteEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LabelGraphLayoutTest {

    private static LabelNode node(String id) {
        return new LabelNode(id, "u", id, "script.rpy", 1, LabelNode.DEFAULT_WIDTH, LabelNode.DEFAULT_HEIGHT);
    }

    private static RouteEdge edge(String id, String from, String to) {
        return new RouteEdge(id, from, to, RouteEdge.EdgeKind.JUMP);
    }

    @Test
    void layout_ShouldPlaceIslandsRightOfMainGraph() {
        LabelGraphLayout layout = new LabelGraphLayout(250, 100);
        List<LabelNode> nodes = List.of(node("n1"), node("n2"), node("n3"), node("n4"), node("n5"));
        List<RouteEdge> edges = List.of(
                edge("e0", "n1", "n2"),
                edge("e1", "n1", "n3"),
                edge("e2", "n4", "n5"),
                edge("e3", "n5", "n4"));

        Map<String, Position> positions = layout.layout(nodes, edges);

        assertEquals(new Position(50, 50), positions.get("n1"));
        assertEquals(new Position(300, 50), positions.get("n2"));
        assertEquals(new Position(300, 150), positions.get("n3"));
        assertEquals(new Position(800, 50), positions.get("n4"));
        assertEquals(new Position(1050, 50), positions.get("n5"));
        assertEquals(List.of("n1", "n2", "n3", "n4", "n5"), List.copyOf(positions.keySet()));
    }

    @Test
    void layout_ShouldHandleEmptyGraph() {
        assertTrue(new LabelGraphLayout(250, 100).layout(List.of(), List.of()).isEmpty());
    }
}
