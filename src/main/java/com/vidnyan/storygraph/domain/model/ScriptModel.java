package com.vidnyan.storygraph.domain.model;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural facts extracted from a collection of script units.
 * Immutable aggregate root; rebuilt from scratch on every analysis pass.
 */
public record ScriptModel(
    List<ScriptUnit> units,
    Map<String, Label> labels,
    Map<String, String> firstLabels,
    Map<String, List<Transfer>> transfers,
    Map<String, CharacterDef> characters,
    Map<String, VariableDef> variables,
    Map<String, List<VariableUsage>> variableUsages,
    Map<String, ScreenDef> screens,
    Set<String> definedImages,
    Map<String, List<DialogueLine>> dialogueLines,
    Map<String, Integer> characterUsage,
    Map<String, Set<ContentType>> contentTypes
) {

    /**
     * Look up a label in the global index.
     */
    public Optional<Label> getLabel(String name) {
        return Optional.ofNullable(labels.get(name));
    }

    /**
     * Get the transfers found in a unit, in text order.
     */
    public List<Transfer> transfersOf(String unitId) {
        return transfers.getOrDefault(unitId, List.of());
    }

    /**
     * Get the plain (non-menu) labels of a unit ordered by line.
     */
    public List<Label> plainLabelsIn(String unitId) {
        return labels.values().stream()
                .filter(l -> l.unitId().equals(unitId) && !l.isMenu())
                .sorted(Comparator.comparingInt(Label::line))
                .toList();
    }

    public boolean hasContent(String unitId, ContentType type) {
        return contentTypes.getOrDefault(unitId, Set.of()).contains(type);
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(
                units.size(),
                labels.size(),
                transfers.values().stream().mapToInt(List::size).sum(),
                characters.size(),
                variables.size(),
                screens.size()
        );
    }

    public record Stats(
        int unitCount,
        int labelCount,
        int transferCount,
        int characterCount,
        int variableCount,
        int screenCount
    ) {}

    /**
     * Builder for constructing ScriptModel.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<ScriptUnit> units = List.of();
        private Map<String, Label> labels = Map.of();
        private Map<String, String> firstLabels = Map.of();
        private Map<String, List<Transfer>> transfers = Map.of();
        private Map<String, CharacterDef> characters = Map.of();
        private Map<String, VariableDef> variables = Map.of();
        private Map<String, List<VariableUsage>> variableUsages = Map.of();
        private Map<String, ScreenDef> screens = Map.of();
        private Set<String> definedImages = Set.of();
        private Map<String, List<DialogueLine>> dialogueLines = Map.of();
        private Map<String, Integer> characterUsage = Map.of();
        private Map<String, Set<ContentType>> contentTypes = Map.of();

        public Builder units(List<ScriptUnit> units) { this.units = units; return this; }
        public Builder labels(Map<String, Label> labels) { this.labels = labels; return this; }
        public Builder firstLabels(Map<String, String> firstLabels) { this.firstLabels = firstLabels; return this; }
        public Builder transfers(Map<String, List<Transfer>> transfers) { this.transfers = transfers; return this; }
        public Builder characters(Map<String, CharacterDef> characters) { this.characters = characters; return this; }
        public Builder variables(Map<String, VariableDef> variables) { this.variables = variables; return this; }
        public Builder variableUsages(Map<String, List<VariableUsage>> usages) { this.variableUsages = usages; return this; }
        public Builder screens(Map<String, ScreenDef> screens) { this.screens = screens; return this; }
        public Builder definedImages(Set<String> images) { this.definedImages = images; return this; }
        public Builder dialogueLines(Map<String, List<DialogueLine>> lines) { this.dialogueLines = lines; return this; }
        public Builder characterUsage(Map<String, Integer> usage) { this.characterUsage = usage; return this; }
        public Builder contentTypes(Map<String, Set<ContentType>> types) { this.contentTypes = types; return this; }

        public ScriptModel build() {
            return new ScriptModel(units, labels, firstLabels, transfers, characters, variables,
                    variableUsages, screens, definedImages, dialogueLines, characterUsage, contentTypes);
        }
    }
}
