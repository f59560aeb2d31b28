package com.vidnyan.storygraph.scanner;

import com.vidnyan.storygraph.domain.model.ScriptUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scans a project folder for .rpy script files.
 * Looks under game/ when the folder has one, otherwise under the folder itself.
 */
@Slf4j
@Component
public class ScriptProjectScanner {

    private static final String SCRIPT_EXTENSION = ".rpy";
    private static final String GAME_DIR = "game";

    /**
     * Scan and return all script files, sorted by path.
     */
    public List<Path> scanScriptFiles(Path projectRoot) throws IOException {
        Path scriptRoot = resolveScriptRoot(projectRoot);
        List<Path> scriptFiles = new ArrayList<>();

        try (Stream<Path> paths = Files.walk(scriptRoot)) {
            paths.filter(Files::isRegularFile)
                 .filter(p -> p.getFileName().toString().endsWith(SCRIPT_EXTENSION))
                 .sorted()
                 .forEach(scriptFiles::add);
        }

        return scriptFiles;
    }

    /**
     * Load every script file as a unit. The unit id and file path are the
     * path relative to the project root, with forward slashes.
     * Files that cannot be read are skipped.
     */
    public List<ScriptUnit> loadUnits(Path projectRoot) throws IOException {
        List<ScriptUnit> units = new ArrayList<>();
        for (Path file : scanScriptFiles(projectRoot)) {
            String relative = projectRoot.relativize(file).toString().replace('\\', '/');
            try {
                units.add(ScriptUnit.of(relative, Files.readString(file, StandardCharsets.UTF_8), relative));
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", file, e.getMessage());
            }
        }
        log.info("Loaded {} script units from {}", units.size(), projectRoot);
        return units;
    }

    private Path resolveScriptRoot(Path projectRoot) {
        Path game = projectRoot.resolve(GAME_DIR);
        return Files.isDirectory(game) ? game : projectRoot;
    }
}
