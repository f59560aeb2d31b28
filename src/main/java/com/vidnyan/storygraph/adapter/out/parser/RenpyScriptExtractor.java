package com.vidnyan.storygraph.adapter.out.parser;

import com.vidnyan.storygraph.StoryGraphProperties;
import com.vidnyan.storygraph.application.port.out.ScriptExtractor;
import com.vidnyan.storygraph.domain.graph.Palette;
import com.vidnyan.storygraph.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extractor for Ren'Py script text.
 *
 * Runs three passes over the units:
 * 1. whole-text scan for {@code Character(...)} definitions
 * 2. line scan for labels, menus, screens, variables and images
 * 3. line scan for jumps/calls, dialogue and variable usages (needs the tables from 1 and 2)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RenpyScriptExtractor implements ScriptExtractor {

    private static final Pattern CHARACTER = Pattern.compile(
            "^[ \\t]*define\\s+([a-zA-Z0-9_]+)\\s*=\\s*Character\\s*\\(", Pattern.MULTILINE);
    private static final Pattern LABEL = Pattern.compile("^\\s*label\\s+([a-zA-Z0-9_]+):");
    private static final Pattern MENU = Pattern.compile("^\\s*menu:");
    private static final Pattern MENU_LABEL = Pattern.compile("^\\s*menu\\s+([a-zA-Z0-9_]+):");
    private static final Pattern SCREEN = Pattern.compile("^\\s*screen\\s+([a-zA-Z0-9_]+)\\s*(\\(.*\\))?:");
    private static final Pattern DEFINE_DEFAULT = Pattern.compile(
            "^\\s*(define|default)\\s+([a-zA-Z0-9_.]+)\\s*=\\s*+(?!Character\\s*\\()(.+)");
    private static final Pattern IMAGE = Pattern.compile("^\\s*image\\s+([a-zA-Z0-9_ ]+?)\\s*=");
    private static final Pattern TRANSFER_EXPRESSION = Pattern.compile(
            "\\b(jump|call)\\s+expression\\s+(?:\"([a-zA-Z0-9_]+)\"|'([a-zA-Z0-9_]+)'|([a-zA-Z0-9_.]+))");
    private static final Pattern TRANSFER = Pattern.compile("\\b(jump|call)\\s+([a-zA-Z0-9_]+)");
    private static final Pattern DIALOGUE = Pattern.compile("^\\s*([a-zA-Z0-9_]+)\\s+\"");
    private static final Pattern NARRATION = Pattern.compile("^\\s*\"(?!:)");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'[^'\\\\]*(?:\\\\.[^'\\\\]*)*'");
    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final String PROFILE_PREFIX = "# profile:";

    private final StoryGraphProperties properties;

    @Override
    public ScriptModel extract(List<ScriptUnit> units) {
        long startTime = System.currentTimeMillis();
        Tables tables = new Tables();

        List<ScriptUnit> analyzed = units.stream()
                .filter(unit -> !isPlaceholder(unit))
                .toList();
        if (analyzed.size() < units.size()) {
            log.debug("Skipping {} placeholder units", units.size() - analyzed.size());
        }

        for (ScriptUnit unit : analyzed) {
            extractCharacters(unit, tables);
            extractDefinitions(unit, tables);
        }

        // A character line can also look like a define; characters win
        tables.characters.keySet().forEach(tables.variables::remove);

        Map<String, Pattern> usagePatterns = new LinkedHashMap<>();
        tables.variables.keySet().forEach(name ->
                usagePatterns.put(name, Pattern.compile("\\b" + Pattern.quote(name) + "\\b")));

        for (ScriptUnit unit : analyzed) {
            extractStatements(unit, tables, usagePatterns);
        }

        Map<String, Integer> characterUsage = new LinkedHashMap<>();
        tables.characters.keySet().forEach(tag -> characterUsage.put(tag, 0));
        tables.dialogueLines.values().forEach(lines ->
                lines.forEach(d -> characterUsage.merge(d.tag(), 1, Integer::sum)));

        // Per-unit lists are frozen along with the maps holding them
        tables.transfers.replaceAll((k, v) -> List.copyOf(v));
        tables.dialogueLines.replaceAll((k, v) -> List.copyOf(v));
        tables.variableUsages.replaceAll((k, v) -> List.copyOf(v));

        ScriptModel model = ScriptModel.builder()
                .units(List.copyOf(units))
                .labels(Collections.unmodifiableMap(tables.labels))
                .firstLabels(Collections.unmodifiableMap(tables.firstLabels))
                .transfers(Collections.unmodifiableMap(tables.transfers))
                .characters(Collections.unmodifiableMap(tables.characters))
                .variables(Collections.unmodifiableMap(tables.variables))
                .variableUsages(Collections.unmodifiableMap(tables.variableUsages))
                .screens(Collections.unmodifiableMap(tables.screens))
                .definedImages(Collections.unmodifiableSet(tables.definedImages))
                .dialogueLines(Collections.unmodifiableMap(tables.dialogueLines))
                .characterUsage(Collections.unmodifiableMap(characterUsage))
                .contentTypes(Collections.unmodifiableMap(tables.contentTypes))
                .build();

        log.debug("Extraction complete: {} in {}ms", model.stats(), System.currentTimeMillis() - startTime);
        return model;
    }

    private boolean isPlaceholder(ScriptUnit unit) {
        String suffix = properties.getAnalysis().getPlaceholderSuffix();
        return unit.filePath() != null && suffix != null && !suffix.isEmpty()
                && unit.filePath().endsWith(suffix);
    }

    // --- Pass 1: Character(...) definitions, possibly spanning lines ---

    private void extractCharacters(ScriptUnit unit, Tables tables) {
        String text = unit.text();
        Matcher m = CHARACTER.matcher(text);
        while (m.find()) {
            String tag = m.group(1);
            int close = ArgumentListScanner.findClosingParen(text, m.end());
            ArgumentListScanner.Arguments args = ArgumentListScanner.parse(text.substring(m.end(), close));

            CharacterDef character = toCharacter(tag, args, unit.id(), findProfile(text, m.start()));
            tables.characters.put(tag, character);
        }
    }

    private CharacterDef toCharacter(String tag, ArgumentListScanner.Arguments args,
                                     String unitId, String profile) {
        String rawName = args.keyword("name") != null
                ? args.keyword("name")
                : args.positional().isEmpty() ? null : args.positional().get(0);
        String name = tag;
        if (rawName != null && !rawName.equalsIgnoreCase("none")) {
            String unquoted = ArgumentListScanner.unquote(rawName);
            if (unquoted != null && !unquoted.isEmpty()) {
                name = unquoted;
            }
        }
        String color = ArgumentListScanner.unquote(args.keyword("color"));

        return CharacterDef.builder()
                .tag(tag)
                .name(name)
                .color(color != null && !color.isEmpty() ? color : Palette.forTag(tag))
                .profile(profile)
                .unitId(unitId)
                .image(quoted(args, "image"))
                .whoStyle(quoted(args, "who_style"))
                .whoPrefix(quoted(args, "who_prefix"))
                .whoSuffix(quoted(args, "who_suffix"))
                .whatColor(quoted(args, "what_color"))
                .whatStyle(quoted(args, "what_style"))
                .whatPrefix(quoted(args, "what_prefix"))
                .whatSuffix(quoted(args, "what_suffix"))
                .slow(bool(args, "slow"))
                .slowSpeed(integer(args, "slow_speed"))
                .slowAbortable(bool(args, "slow_abortable"))
                .allAtOnce(bool(args, "all_at_once"))
                .windowStyle(quoted(args, "window_style"))
                .ctc(quoted(args, "ctc"))
                .ctcPosition(quoted(args, "ctc_position"))
                .interact(bool(args, "interact"))
                .afm(bool(args, "afm"))
                .whatProperties(args.keyword("what_properties"))
                .windowProperties(args.keyword("window_properties"))
                .build();
    }

    /**
     * Profile note from a {@code # profile:} comment on the nearest non-blank line above.
     */
    private String findProfile(String text, int definitionStart) {
        if (definitionStart <= 0) {
            return null;
        }
        String[] preceding = text.substring(0, definitionStart).split("\r?\n", -1);
        for (int i = preceding.length - 1; i >= 0; i--) {
            String line = preceding[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            return line.startsWith(PROFILE_PREFIX) ? line.substring(PROFILE_PREFIX.length()).trim() : null;
        }
        return null;
    }

    private static String quoted(ArgumentListScanner.Arguments args, String key) {
        return ArgumentListScanner.unquote(args.keyword(key));
    }

    private static Boolean bool(ArgumentListScanner.Arguments args, String key) {
        String value = args.keyword(key);
        if ("True".equals(value)) return true;
        if ("False".equals(value)) return false;
        return null;
    }

    private static Integer integer(ArgumentListScanner.Arguments args, String key) {
        String value = args.keyword(key);
        if (value == null) {
            return null;
        }
        Matcher m = LEADING_INT.matcher(value);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            log.debug("Ignoring out-of-range {} value: {}", key, value);
            return null;
        }
    }

    // --- Pass 2: line-level definitions ---

    private void extractDefinitions(ScriptUnit unit, Tables tables) {
        String[] lines = splitLines(unit.text());
        boolean firstLabel = true;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNo = i + 1;

            Matcher label = LABEL.matcher(line);
            if (label.find()) {
                String name = label.group(1);
                tables.labels.put(name, new Label(name, unit.id(), lineNo, label.start(1) + 1, Label.LabelKind.LABEL));
                if (firstLabel) {
                    tables.firstLabels.put(unit.id(), name);
                    firstLabel = false;
                }
            }

            Matcher menuLabel = MENU_LABEL.matcher(line);
            if (menuLabel.find()) {
                String name = menuLabel.group(1);
                tables.labels.putIfAbsent(name,
                        new Label(name, unit.id(), lineNo, menuLabel.start(1) + 1, Label.LabelKind.MENU));
            }

            Matcher screen = SCREEN.matcher(line);
            if (screen.find()) {
                String params = screen.group(2) != null ? screen.group(2).trim() : "";
                tables.screens.put(screen.group(1), new ScreenDef(screen.group(1), params, unit.id(), lineNo));
            }

            Matcher variable = DEFINE_DEFAULT.matcher(line);
            if (variable.find()) {
                tables.variables.put(variable.group(2), new VariableDef(
                        variable.group(2),
                        VariableDef.VariableKind.fromKeyword(variable.group(1)),
                        variable.group(3).trim(),
                        unit.id(),
                        lineNo));
            }

            Matcher image = IMAGE.matcher(line);
            if (image.find()) {
                tables.definedImages.add(image.group(1).trim());
            }
        }
    }

    // --- Pass 3: transfers, dialogue, variable usages ---

    private void extractStatements(ScriptUnit unit, Tables tables, Map<String, Pattern> usagePatterns) {
        List<Transfer> transfers = new ArrayList<>();
        tables.transfers.put(unit.id(), transfers);
        EnumSet<ContentType> types = EnumSet.noneOf(ContentType.class);
        if (unit.text().contains("python:")) {
            types.add(ContentType.PYTHON);
        }

        String[] lines = splitLines(unit.text());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNo = i + 1;
            String code = sanitize(line);

            boolean dynamicOnLine = false;
            Matcher expression = TRANSFER_EXPRESSION.matcher(code);
            while (expression.find()) {
                dynamicOnLine = true;
                types.add(ContentType.JUMP);
                int group = expression.group(2) != null ? 2 : expression.group(3) != null ? 3 : 4;
                String target = expression.group(group);
                if (target == null) {
                    continue;
                }
                transfers.add(new Transfer(unit.id(), target,
                        Transfer.TransferKind.fromKeyword(expression.group(1)), true, lineNo,
                        expression.start(group), expression.end(group)));
            }

            if (!dynamicOnLine) {
                Matcher transfer = TRANSFER.matcher(code);
                while (transfer.find()) {
                    types.add(ContentType.JUMP);
                    String target = transfer.group(2);
                    if ("expression".equals(target)) {
                        continue;
                    }
                    transfers.add(new Transfer(unit.id(), target,
                            Transfer.TransferKind.fromKeyword(transfer.group(1)), false, lineNo,
                            transfer.start(2), transfer.end(2)));
                }
            }

            if (LABEL.matcher(line).find()) types.add(ContentType.LABEL);
            if (MENU.matcher(line).find()) types.add(ContentType.MENU);

            Matcher dialogue = DIALOGUE.matcher(line);
            if (dialogue.find() && tables.characters.containsKey(dialogue.group(1))) {
                types.add(ContentType.DIALOGUE);
                tables.dialogueLines.computeIfAbsent(unit.id(), k -> new ArrayList<>())
                        .add(new DialogueLine(unit.id(), lineNo, dialogue.group(1)));
            } else if (NARRATION.matcher(line).find()) {
                types.add(ContentType.DIALOGUE);
            }

            for (Map.Entry<String, Pattern> entry : usagePatterns.entrySet()) {
                if (!entry.getValue().matcher(code).find()) {
                    continue;
                }
                VariableDef definition = tables.variables.get(entry.getKey());
                if (definition.isDefinedAt(unit.id(), lineNo)) {
                    continue;
                }
                tables.variableUsages.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(new VariableUsage(unit.id(), lineNo));
            }
        }

        if (!types.isEmpty()) {
            tables.contentTypes.put(unit.id(), Collections.unmodifiableSet(types));
        }
    }

    /**
     * Blank out string literals and drop trailing comments, so keywords inside
     * dialogue or comments are not taken for statements.
     */
    static String sanitize(String line) {
        String code = DOUBLE_QUOTED.matcher(line).replaceAll("\"\"");
        code = SINGLE_QUOTED.matcher(code).replaceAll("''");
        int comment = code.indexOf('#');
        return comment >= 0 ? code.substring(0, comment) : code;
    }

    static String[] splitLines(String text) {
        return text.split("\r?\n", -1);
    }

    /**
     * Mutable accumulators for one extraction pass.
     */
    private static final class Tables {
        final Map<String, Label> labels = new LinkedHashMap<>();
        final Map<String, String> firstLabels = new LinkedHashMap<>();
        final Map<String, List<Transfer>> transfers = new LinkedHashMap<>();
        final Map<String, CharacterDef> characters = new LinkedHashMap<>();
        final Map<String, VariableDef> variables = new LinkedHashMap<>();
        final Map<String, List<VariableUsage>> variableUsages = new LinkedHashMap<>();
        final Map<String, ScreenDef> screens = new LinkedHashMap<>();
        final Set<String> definedImages = new LinkedHashSet<>();
        final Map<String, List<DialogueLine>> dialogueLines = new LinkedHashMap<>();
        final Map<String, Set<ContentType>> contentTypes = new LinkedHashMap<>();
    }
}
