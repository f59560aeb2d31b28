package com.vidnyan.storygraph.api;

import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisRequest;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisResult;
import com.vidnyan.storygraph.application.service.PunchlistScanner;
import com.vidnyan.storygraph.application.service.PunchlistScanner.AssetInventory;
import com.vidnyan.storygraph.application.service.PunchlistScanner.PunchlistTask;
import com.vidnyan.storygraph.application.service.StoryContextService;
import com.vidnyan.storygraph.application.service.StoryContextService.StoryContext;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for script analysis and the views derived from it.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalyzeScriptUseCase analyzeScriptUseCase;
    private final StoryContextService storyContextService;
    private final PunchlistScanner punchlistScanner;

    @PostMapping("/analysis")
    public AnalysisResult analyze(@RequestBody AnalysisRequest request) {
        log.info("Received analysis request: {} units, revision {}", request.units().size(), request.revision());
        return analyzeScriptUseCase.analyze(request);
    }

    @GetMapping("/analysis/health")
    public String health() {
        return "OK - StoryGraph narrative graph engine";
    }

    @PostMapping("/context")
    public StoryContext context(@RequestBody ContextRequest request) {
        log.info("Received context request for unit {}", request.unitId());
        AnalysisResult result = analyzeScriptUseCase.analyze(new AnalysisRequest(request.units(), request.revision()));
        return storyContextService.buildContext(request.safeUnits(), result.links(), request.unitId());
    }

    @PostMapping("/punchlist")
    public List<PunchlistTask> punchlist(@RequestBody PunchlistRequest request) {
        log.info("Received punch list request: {} units", request.safeUnits().size());
        AnalysisResult result = analyzeScriptUseCase.analyze(new AnalysisRequest(request.units(), request.revision()));
        return punchlistScanner.scan(
                request.safeUnits(),
                result.definedImages(),
                result.variables().keySet(),
                new AssetInventory(
                        request.images() != null ? request.images() : List.of(),
                        request.audio() != null ? request.audio() : List.of()));
    }

    public record ContextRequest(
        List<ScriptUnit> units,
        long revision,
        String unitId
    ) {
        List<ScriptUnit> safeUnits() {
            return units != null ? units : List.of();
        }
    }

    public record PunchlistRequest(
        List<ScriptUnit> units,
        long revision,
        List<String> images,    // image tags known from the asset folder
        List<String> audio      // audio file paths known from the asset folder
    ) {
        List<ScriptUnit> safeUnits() {
            return units != null ? units : List.of();
        }
    }
}
