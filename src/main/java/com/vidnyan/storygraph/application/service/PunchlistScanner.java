package com.vidnyan.storygraph.application.service;

import com.vidnyan.storygraph.domain.model.ScriptUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags images and audio referenced by the script but not defined in code or
 * present among the project assets.
 */
@Slf4j
@Service
public class PunchlistScanner {

    private static final Pattern SHOW = Pattern.compile("^\\s*(?:show|scene)\\s+([a-zA-Z0-9_ ]+)");
    private static final Pattern PLAY = Pattern.compile("^\\s*(?:play|queue)\\s+\\w+\\s+(.+)");
    private static final Pattern QUOTED = Pattern.compile("^[\"']([^\"']+)[\"']");
    private static final Set<String> IMAGE_KEYWORDS = Set.of("expression", "layer");

    public enum TaskType {
        IMAGE,
        AUDIO
    }

    /**
     * One missing asset, with every unit that references it.
     * The line is where it was first seen.
     */
    public record PunchlistTask(
        String id,
        TaskType type,
        String name,
        String description,
        Set<String> unitIds,
        int line
    ) {}

    /**
     * Assets known outside the script: image tags and audio file paths.
     */
    public record AssetInventory(Collection<String> imageTags, Collection<String> audioFiles) {

        public static AssetInventory empty() {
            return new AssetInventory(List.of(), List.of());
        }
    }

    /**
     * Scan every unit for show/scene and play/queue statements with unknown targets.
     * @param definedImages Image tags defined in code
     * @param variables Variable names; a bare audio name matching one counts as defined
     */
    public List<PunchlistTask> scan(List<ScriptUnit> units, Set<String> definedImages,
                                    Set<String> variables, AssetInventory inventory) {
        Set<String> imageTags = new HashSet<>(definedImages);
        imageTags.addAll(inventory.imageTags());
        Set<String> audioPaths = audioVariants(inventory.audioFiles());

        Map<String, TaskBuilder> tasks = new LinkedHashMap<>();
        for (ScriptUnit unit : units) {
            String[] lines = unit.text().split("\r?\n", -1);
            for (int i = 0; i < lines.length; i++) {
                checkImage(lines[i], unit.id(), i + 1, imageTags, tasks);
                checkAudio(lines[i], unit.id(), i + 1, audioPaths, variables, tasks);
            }
        }

        List<PunchlistTask> result = tasks.values().stream().map(TaskBuilder::build).toList();
        log.debug("Punch list scan found {} missing assets", result.size());
        return result;
    }

    private void checkImage(String line, String unitId, int lineNo, Set<String> imageTags,
                            Map<String, TaskBuilder> tasks) {
        Matcher m = SHOW.matcher(line);
        if (!m.find()) {
            return;
        }
        String tag = m.group(1).trim();
        if (tag.isEmpty()) {
            return;
        }
        String[] parts = tag.split(" +");
        if (IMAGE_KEYWORDS.contains(parts[0])) {
            return;
        }
        // Attributes follow the image name, so any defined prefix counts
        StringBuilder prefix = new StringBuilder();
        for (String part : parts) {
            if (prefix.length() > 0) prefix.append(' ');
            prefix.append(part);
            if (imageTags.contains(prefix.toString())) {
                return;
            }
        }
        tasks.computeIfAbsent("image:" + tag,
                id -> new TaskBuilder(id, TaskType.IMAGE, tag, "Missing image asset: " + tag, lineNo))
                .unitIds.add(unitId);
    }

    private void checkAudio(String line, String unitId, int lineNo, Set<String> audioPaths,
                            Set<String> variables, Map<String, TaskBuilder> tasks) {
        Matcher m = PLAY.matcher(line);
        if (!m.find()) {
            return;
        }
        String content = m.group(1).trim();
        Matcher quoted = QUOTED.matcher(content);
        String target;
        boolean defined;
        if (quoted.find()) {
            target = quoted.group(1);
            defined = audioPaths.stream().anyMatch(p -> p.endsWith(target) || target.endsWith(p));
        } else {
            target = content.split("\\s+")[0];
            if (target.equals("expression")) {
                return;
            }
            defined = audioPaths.contains(target) || variables.contains(target);
        }
        if (target.isEmpty() || defined) {
            return;
        }
        tasks.computeIfAbsent("audio:" + target,
                id -> new TaskBuilder(id, TaskType.AUDIO, target, "Missing audio: " + target, lineNo))
                .unitIds.add(unitId);
    }

    private static Set<String> audioVariants(Collection<String> files) {
        Set<String> variants = new HashSet<>();
        for (String file : files) {
            String path = file.replace('\\', '/');
            String fileName = path.substring(path.lastIndexOf('/') + 1);
            variants.add(path);
            variants.add(fileName);
            int dot = fileName.lastIndexOf('.');
            if (dot > 0) {
                variants.add(fileName.substring(0, dot));
            }
        }
        variants.remove("");
        return variants;
    }

    private static final class TaskBuilder {
        private final String id;
        private final TaskType type;
        private final String name;
        private final String description;
        private final int line;
        private final Set<String> unitIds = new LinkedHashSet<>();

        private TaskBuilder(String id, TaskType type, String name, String description, int line) {
            this.id = id;
            this.type = type;
            this.name = name;
            this.description = description;
            this.line = line;
        }

        private PunchlistTask build() {
            return new PunchlistTask(id, type, name, description, Collections.unmodifiableSet(unitIds), line);
        }
    }
}
