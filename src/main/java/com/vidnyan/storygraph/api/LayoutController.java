package com.vidnyan.storygraph.api;

import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisRequest;
import com.vidnyan.storygraph.application.port.in.LayoutUseCase;
import com.vidnyan.storygraph.domain.layout.Position;
import com.vidnyan.storygraph.domain.layout.UnitBox;
import com.vidnyan.storygraph.domain.model.UnitLink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for automatic diagram layout.
 */
@Slf4j
@RestController
@RequestMapping("/api/layout")
@RequiredArgsConstructor
public class LayoutController {

    private final LayoutUseCase layoutUseCase;
    private final AnalyzeScriptUseCase analyzeScriptUseCase;

    @PostMapping
    public List<UnitBox> layoutUnits(@RequestBody UnitLayoutRequest request) {
        if (request.boxes() == null) {
            throw new IllegalArgumentException("boxes must be provided");
        }
        log.info("Received layout request: {} boxes", request.boxes().size());
        return layoutUseCase.layoutUnits(request.boxes(), request.links() != null ? request.links() : List.of());
    }

    @PostMapping("/routes")
    public Map<String, Position> layoutRoutes(@RequestBody AnalysisRequest request) {
        log.info("Received route layout request: {} units", request.units().size());
        return layoutUseCase.layoutRoutes(analyzeScriptUseCase.analyze(request));
    }

    public record UnitLayoutRequest(
        List<UnitBox> boxes,
        List<UnitLink> links
    ) {}
}
