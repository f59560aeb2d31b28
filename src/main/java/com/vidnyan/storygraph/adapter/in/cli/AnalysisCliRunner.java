package com.vidnyan.storygraph.adapter.in.cli;

import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisRequest;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisResult;
import com.vidnyan.storygraph.domain.graph.Route;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import com.vidnyan.storygraph.scanner.ScriptProjectScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI Runner for analyzing a project folder.
 * Runs analysis when storygraph.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_ROUTES_SHOWN = 50;

    private final AnalyzeScriptUseCase analyzeScriptUseCase;
    private final ScriptProjectScanner projectScanner;
    private final ConfigurableApplicationContext context;

    @Value("${storygraph.analyze.path:}")
    private String projectPath;

    @Override
    public void run(String... args) throws Exception {
        if (projectPath == null || projectPath.isBlank()) {
            log.info("No project path specified. Set storygraph.analyze.path property.");
            return;
        }

        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              StoryGraph - Narrative Graph Engine              ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(projectPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<ScriptUnit> units = projectScanner.loadUnits(Path.of(projectPath));
            AnalysisResult result = analyzeScriptUseCase.analyze(AnalysisRequest.of(units));

            printResults(result);

            log.info("");
            log.info("Analysis complete!");
        } finally {
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printResults(AnalysisResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Units analyzed:   {}", result.stats().unitsAnalyzed());
        log.info(" Labels:           {}", result.stats().labelsFound());
        log.info(" Jumps and calls:  {}", result.stats().transfersFound());
        log.info(" Unit links:       {}", result.stats().linksBuilt());
        log.info(" Characters:       {}", result.characters().size());
        log.info(" Variables:        {}", result.variables().size());
        log.info(" Screens:          {}", result.screens().size());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" UNITS:");
        log.info("   Root:        {}", result.classification().roots().size());
        log.info("   Leaf:        {}", result.classification().leaves().size());
        log.info("   Branching:   {}", result.classification().branching().size());
        log.info("   Story:       {}", result.classification().story().size());
        log.info("   Screen-only: {}", result.classification().screenOnly().size());
        log.info("   Config:      {}", result.classification().config().size());
        log.info("═══════════════════════════════════════════════════════════════");

        if (result.hasInvalidJumps()) {
            log.info("");
            log.info(" INVALID JUMPS:");
            for (Map.Entry<String, List<String>> entry : result.invalidJumps().entrySet()) {
                log.info("   ⚠️  {} → {}", entry.getKey(), String.join(", ", entry.getValue()));
            }
        }

        log.info("");
        log.info(" ROUTES: {}", result.routes().size());
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (Route route : result.routes()) {
            count++;
            if (count > MAX_ROUTES_SHOWN) {
                log.info(" ... and {} more routes", result.routes().size() - MAX_ROUTES_SHOWN);
                break;
            }
            log.info(" [{}] {} {}", route.id(), route.color(), route.format());
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
