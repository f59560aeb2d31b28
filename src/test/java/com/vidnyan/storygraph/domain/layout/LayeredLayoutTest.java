package com.vidnyan.storygraph.domain.layout;

import com.vidnyan.storygraph.domain.model.UnitLink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayeredLayoutTest {

    private final LayeredLayout layout = new LayeredLayout(150, 50);

    private static UnitBox box(String id, double width, double height) {
        return new UnitBox(id, width, height, Position.ORIGIN);
    }

    private static UnitLink link(String from, String to) {
        return new UnitLink(from, to, to);
    }

    @Test
    void computeLayers_ShouldPlaceChainInConsecutiveLayers() {
        List<UnitBox> boxes = List.of(box("a", 100, 50), box("b", 100, 50), box("c", 100, 50));

        List<List<String>> layers = layout.computeLayers(boxes, List.of(link("a", "b"), link("b", "c")));

        assertEquals(List.of(List.of("a"), List.of("b"), List.of("c")), layers);
    }

    @Test
    void computeLayers_ShouldTerminateOnFullyCyclicGraph() {
        List<UnitBox> boxes = List.of(box("a", 100, 50), box("b", 100, 50));

        List<List<String>> layers = layout.computeLayers(boxes, List.of(link("a", "b"), link("b", "a")));

        assertEquals(List.of(List.of("a"), List.of("b")), layers);
    }

    @Test
    void computeLayers_ShouldAppendUnreachedCycleAsLastLayer() {
        List<UnitBox> boxes = List.of(box("a", 100, 50), box("b", 100, 50), box("c", 100, 50));

        List<List<String>> layers = layout.computeLayers(boxes, List.of(link("a", "b"), link("b", "a")));

        assertEquals(List.of(List.of("c"), List.of("a", "b")), layers);
        assertEquals(3, layers.stream().mapToInt(List::size).sum());
    }

    @Test
    void computeLayers_ShouldIgnoreLinksToUnknownUnits() {
        List<List<String>> layers = layout.computeLayers(List.of(box("a", 100, 50)), List.of(link("a", "ghost")));

        assertEquals(List.of(List.of("a")), layers);
    }

    @Test
    void layout_ShouldSpaceColumnsByWidestUnit() {
        List<UnitBox> result = layout.layout(
                List.of(box("a", 100, 50), box("b", 100, 50), box("c", 100, 50)),
                List.of(link("a", "b"), link("b", "c")));

        assertEquals(new Position(0, -25), result.get(0).position());
        assertEquals(new Position(250, -25), result.get(1).position());
        assertEquals(new Position(500, -25), result.get(2).position());
    }

    @Test
    void layout_ShouldCentreUnitsWithoutVerticalOverlap() {
        List<UnitBox> result = layout.layout(
                List.of(box("root", 100, 50), box("tall", 200, 100), box("short", 100, 60)),
                List.of(link("root", "tall"), link("root", "short")));

        UnitBox tall = result.get(1);
        UnitBox shortBox = result.get(2);
        assertEquals(250, tall.position().x());
        assertEquals(300, shortBox.position().x());
        assertEquals(-105, tall.position().y());
        assertEquals(45, shortBox.position().y());
        assertTrue(shortBox.position().y() >= tall.position().y() + tall.height());
        assertEquals(200, tall.width());
    }

    @Test
    void layout_ShouldKeepInputOrder() {
        List<UnitBox> result = layout.layout(
                List.of(box("z", 100, 50), box("y", 100, 50)),
                List.of(link("y", "z")));

        assertEquals(List.of("z", "y"), result.stream().map(UnitBox::id).toList());
        assertTrue(result.get(0).position().x() > result.get(1).position().x());
    }
}
