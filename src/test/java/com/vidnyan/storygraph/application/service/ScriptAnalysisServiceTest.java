package com.vidnyan.storygraph.application.service;

import com.vidnyan.storygraph.StoryGraphProperties;
import com.vidnyan.storygraph.adapter.out.parser.RenpyScriptExtractor;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisRequest;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisResult;
import com.vidnyan.storygraph.application.port.out.ScriptExtractor;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScriptAnalysisServiceTest {

    private static final List<ScriptUnit> UNITS = List.of(
            ScriptUnit.of("A", "label start:\n jump b"),
            ScriptUnit.of("B", "label b:\n return"));

    private StoryGraphProperties properties;
    private ScriptAnalysisService service;

    @BeforeEach
    void setUp() {
        properties = StoryGraphProperties.defaults();
        service = new ScriptAnalysisService(new RenpyScriptExtractor(properties), properties);
    }

    @Test
    void analyze_ShouldDeriveLinksClassificationAndRoutes() {
        AnalysisResult result = service.analyze(AnalysisRequest.of(UNITS));

        assertEquals(1, result.links().size());
        assertEquals(Set.of("A"), result.rootUnitIds());
        assertEquals(Set.of("B"), result.leafUnitIds());
        assertFalse(result.hasInvalidJumps());
        assertEquals(1, result.routes().size());
        assertEquals(List.of("A:start", "B:b"), result.routes().get(0).nodeIds());
        assertEquals(2, result.labelNodes().size());
        assertEquals(2, result.stats().unitsAnalyzed());
        assertEquals(1, result.stats().routesFound());
    }

    @Test
    void analyze_ShouldReuseResultForIdenticalRequest() {
        AnalysisResult first = service.analyze(new AnalysisRequest(UNITS, 3));
        AnalysisResult second = service.analyze(new AnalysisRequest(List.copyOf(UNITS), 3));

        assertSame(first, second);
    }

    @Test
    void analyze_ShouldRecomputeWhenRevisionOrTextChanges() {
        AnalysisResult first = service.analyze(new AnalysisRequest(UNITS, 0));
        AnalysisResult bumped = service.analyze(new AnalysisRequest(UNITS, 1));
        AnalysisResult edited = service.analyze(new AnalysisRequest(List.of(
                ScriptUnit.of("A", "label start:\n jump c"),
                ScriptUnit.of("B", "label b:\n return")), 1));

        assertNotSame(first, bumped);
        assertNotSame(bumped, edited);
        assertEquals(List.of("c"), edited.invalidJumps().get("A"));
        assertTrue(edited.links().isEmpty());
    }

    @Test
    void analyze_ShouldRecomputeWhenUnitsOnlyLookAlikeWhenJoined() {
        AnalysisResult twoUnits = service.analyze(AnalysisRequest.of(UNITS));
        AnalysisResult oneUnit = service.analyze(AnalysisRequest.of(List.of(
                ScriptUnit.of("A", "label start:\n jump b||B:null:null:label b:\n return"))));

        assertNotSame(twoUnits, oneUnit);
        assertEquals(1, oneUnit.stats().unitsAnalyzed());
        assertTrue(oneUnit.links().isEmpty());
    }

    @Test
    void analyze_ShouldHandOutResultThatCallersCannotModify() {
        AnalysisResult first = service.analyze(AnalysisRequest.of(UNITS));

        assertThrows(UnsupportedOperationException.class, () -> first.transfers().get("A").clear());
        assertThrows(UnsupportedOperationException.class, () -> first.links().clear());
        assertThrows(UnsupportedOperationException.class, () -> first.routes().get(0).nodeIds().clear());

        AnalysisResult again = service.analyze(AnalysisRequest.of(UNITS));
        assertSame(first, again);
        assertEquals(1, again.transfers().get("A").size());
    }

    @Test
    void analyze_ShouldKeepPreviousResultWhenPassFails() {
        AtomicInteger calls = new AtomicInteger();
        RenpyScriptExtractor real = new RenpyScriptExtractor(properties);
        ScriptExtractor flaky = units -> {
            if (calls.incrementAndGet() == 2) {
                throw new IllegalStateException("boom");
            }
            return real.extract(units);
        };
        ScriptAnalysisService flakyService = new ScriptAnalysisService(flaky, properties);

        AnalysisResult first = flakyService.analyze(new AnalysisRequest(UNITS, 0));
        assertThrows(IllegalStateException.class, () -> flakyService.analyze(new AnalysisRequest(UNITS, 1)));
        AnalysisResult again = flakyService.analyze(new AnalysisRequest(UNITS, 0));

        assertSame(first, again);
        assertEquals(2, calls.get());
    }

    @Test
    void analyze_ShouldHandleEmptyInput() {
        AnalysisResult result = service.analyze(AnalysisRequest.of(List.of()));

        assertTrue(result.links().isEmpty());
        assertTrue(result.routes().isEmpty());
        assertEquals(0, result.stats().unitsAnalyzed());
    }

    @Test
    void analyze_ShouldPassStoryPathsToClassification() {
        properties.getAnalysis().setStoryPaths(List.of("game/lore.rpy"));

        AnalysisResult result = service.analyze(AnalysisRequest.of(List.of(
                new ScriptUnit("lore", "default lore_seen = False", "game/lore.rpy", null))));

        assertTrue(result.classification().story().contains("lore"));
    }
}
