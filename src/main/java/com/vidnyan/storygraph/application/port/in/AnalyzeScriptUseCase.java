package com.vidnyan.storygraph.application.port.in;

import com.vidnyan.storygraph.domain.graph.*;
import com.vidnyan.storygraph.domain.model.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Primary use case: analyze a collection of script units.
 * This is the main entry point to the engine.
 */
public interface AnalyzeScriptUseCase {

    /**
     * Run a full analysis pass. Identical requests return the previous result.
     * @param request Units to analyze and the caller's recompute counter
     * @return Fully derived analysis result
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        List<ScriptUnit> units,
        long revision       // bump to force a recompute of unchanged units
    ) {
        public AnalysisRequest {
            units = units != null ? List.copyOf(units) : List.of();
        }

        public static AnalysisRequest of(List<ScriptUnit> units) {
            return new AnalysisRequest(units, 0);
        }
    }

    /**
     * Everything derived from one pass over the units.
     */
    record AnalysisResult(
        List<UnitLink> links,
        Map<String, List<String>> invalidJumps,
        Map<String, String> firstLabels,
        Map<String, Label> labels,
        Map<String, List<Transfer>> transfers,
        UnitClassification classification,
        Map<String, CharacterDef> characters,
        Map<String, List<DialogueLine>> dialogueLines,
        Map<String, Integer> characterUsage,
        Map<String, VariableDef> variables,
        Map<String, List<VariableUsage>> variableUsages,
        Map<String, ScreenDef> screens,
        Set<String> definedImages,
        Map<String, Set<ContentType>> contentTypes,
        List<LabelNode> labelNodes,
        List<RouteEdge> routeEdges,
        List<Route> routes,
        AnalysisStats stats
    ) {

        public static AnalysisResult of(ScriptModel model, UnitGraph unitGraph, LabelGraph labelGraph,
                                        List<Route> routes, AnalysisStats stats) {
            return new AnalysisResult(
                    unitGraph.getLinks(),
                    unitGraph.getInvalidJumps(),
                    model.firstLabels(),
                    model.labels(),
                    model.transfers(),
                    unitGraph.getClassification(),
                    model.characters(),
                    model.dialogueLines(),
                    model.characterUsage(),
                    model.variables(),
                    model.variableUsages(),
                    model.screens(),
                    model.definedImages(),
                    model.contentTypes(),
                    labelGraph.getNodes(),
                    labelGraph.getEdges(),
                    List.copyOf(routes),
                    stats
            );
        }

        public boolean hasInvalidJumps() {
            return !invalidJumps.isEmpty();
        }

        public Set<String> rootUnitIds() {
            return classification.roots();
        }

        public Set<String> leafUnitIds() {
            return classification.leaves();
        }

        public Set<String> branchingUnitIds() {
            return classification.branching();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int unitsAnalyzed,
        int labelsFound,
        int transfersFound,
        int linksBuilt,
        int routesFound,
        long totalDurationMs
    ) {}
}
