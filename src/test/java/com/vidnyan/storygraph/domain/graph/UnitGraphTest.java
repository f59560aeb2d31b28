package com.vidnyan.storygraph.domain.graph;

import com.vidnyan.storygraph.StoryGraphProperties;
import com.vidnyan.storygraph.adapter.out.parser.RenpyScriptExtractor;
import com.vidnyan.storygraph.domain.model.ScriptModel;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import com.vidnyan.storygraph.domain.model.UnitLink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UnitGraphTest {

    private final StoryGraphProperties properties = StoryGraphProperties.defaults();
    private final RenpyScriptExtractor extractor = new RenpyScriptExtractor(properties);

    private UnitGraph build(ScriptUnit... units) {
        ScriptModel model = extractor.extract(List.of(units));
        return UnitGraph.build(model, properties.getAnalysis().getStoryPaths());
    }

    @Test
    void build_ShouldLinkUnitsAndClassifyRootAndLeaf() {
        UnitGraph graph = build(
                ScriptUnit.of("A", "label start:\n jump b"),
                ScriptUnit.of("B", "label b:\n return"));

        assertEquals(List.of(new UnitLink("A", "B", "b")), graph.getLinks());
        assertEquals(Set.of("A"), graph.getClassification().roots());
        assertEquals(Set.of("B"), graph.getClassification().leaves());
        assertEquals(Set.of("B"), graph.getSuccessors("A"));
        assertEquals(Set.of("A"), graph.getPredecessors("B"));
        assertTrue(graph.getInvalidJumps().isEmpty());
    }

    @Test
    void build_ShouldDeduplicateLinksBetweenSameUnits() {
        UnitGraph graph = build(
                ScriptUnit.of("A", "label start:\n    jump one\n    jump two\n    jump one"),
                ScriptUnit.of("B", "label one:\n    return\nlabel two:\n    return"));

        assertEquals(1, graph.getLinks().size());
        assertEquals("one", graph.getLinks().get(0).targetLabel());
    }

    @Test
    void build_ShouldNotLinkUnitToItself() {
        UnitGraph graph = build(ScriptUnit.of("A", "label x:\n    jump x"));

        assertTrue(graph.getLinks().isEmpty());
        assertEquals(Set.of("A"), graph.getClassification().roots());
        assertFalse(graph.getClassification().leaves().contains("A"));
    }

    @Test
    void build_ShouldRecordInvalidJumpsOnce() {
        UnitGraph graph = build(ScriptUnit.of("A",
                "label start:\n    jump nowhere\n    jump nowhere\n    call expression missing_too"));

        assertEquals(List.of("nowhere"), graph.getInvalidJumps().get("A"));
        assertEquals(1, graph.stats().invalidJumpCount());
    }

    @Test
    void build_ShouldLinkResolvedDynamicTargets() {
        UnitGraph graph = build(
                ScriptUnit.of("A", "label start:\n    call expression chapter2\n    jump expression ending_var"),
                ScriptUnit.of("B", "label chapter2:\n    return"));

        assertEquals(List.of(new UnitLink("A", "B", "chapter2")), graph.getLinks());
        assertTrue(graph.getInvalidJumps().isEmpty());
    }

    @Test
    void build_ShouldClassifyBranchingUnits() {
        UnitGraph graph = build(
                ScriptUnit.of("hub", "label start:\n    jump left\n    jump right"),
                ScriptUnit.of("menu", "label ask:\n    menu:\n        \"Yes\":\n            return"),
                ScriptUnit.of("L", "label left:\n    return"),
                ScriptUnit.of("R", "label right:\n    return"));

        Set<String> branching = graph.getClassification().branching();
        assertTrue(branching.contains("hub"));
        assertTrue(branching.contains("menu"));
        assertFalse(branching.contains("L"));
    }

    @Test
    void build_ShouldClassifyStoryScreenAndConfigUnits() {
        UnitGraph graph = build(
                new ScriptUnit("story", "label start:\n    return", "game/script.rpy", null),
                new ScriptUnit("screens", "screen hud():\n    text \"HP\"", "game/screens.rpy", null),
                new ScriptUnit("options", "define config.name = \"Demo\"", "game/options.rpy", null),
                new ScriptUnit("vars", "default points = 0", "game/variables.rpy", null));

        UnitClassification classification = graph.getClassification();
        assertEquals(Set.of("story", "vars"), classification.story());
        assertEquals(Set.of("screens"), classification.screenOnly());
        assertEquals(Set.of("options"), classification.config());
    }
}
