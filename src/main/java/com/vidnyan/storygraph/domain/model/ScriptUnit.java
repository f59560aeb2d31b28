package com.vidnyan.storygraph.domain.model;

/**
 * One chunk of narrative script text with an identity, roughly one .rpy file.
 * Owned by the caller; the engine only reads it.
 */
public record ScriptUnit(
    String id,
    String text,
    String filePath,
    String title
) {

    public ScriptUnit {
        text = text != null ? text : "";
    }

    public static ScriptUnit of(String id, String text) {
        return new ScriptUnit(id, text, null, null);
    }

    public static ScriptUnit of(String id, String text, String filePath) {
        return new ScriptUnit(id, text, filePath, null);
    }

    /**
     * Name shown for the unit on diagrams: title, then file name, then "Untitled".
     */
    public String displayName() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (filePath != null && !filePath.isBlank()) {
            return filePath.substring(filePath.lastIndexOf('/') + 1);
        }
        return "Untitled";
    }
}
