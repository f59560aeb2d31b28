package com.vidnyan.storygraph.domain.model;

/**
 * A {@code define} or {@code default} statement that is not a character.
 */
public record VariableDef(
    String name,
    VariableKind kind,
    String initialValue,
    String unitId,
    int line
) {

    public enum VariableKind {
        DEFINE,
        DEFAULT;

        public static VariableKind fromKeyword(String keyword) {
            return "default".equals(keyword) ? DEFAULT : DEFINE;
        }
    }

    public boolean isDefinedAt(String unitId, int line) {
        return this.unitId.equals(unitId) && this.line == line;
    }
}
