package com.vidnyan.storygraph.domain.model;

/**
 * A speaking character, parsed from {@code define tag = Character(...)}.
 * Optional style attributes are null when the definition does not set them.
 */
public record CharacterDef(
    String tag,
    String name,
    String color,
    String profile,
    String unitId,
    String image,
    String whoStyle,
    String whoPrefix,
    String whoSuffix,
    String whatColor,
    String whatStyle,
    String whatPrefix,
    String whatSuffix,
    Boolean slow,
    Integer slowSpeed,
    Boolean slowAbortable,
    Boolean allAtOnce,
    String windowStyle,
    String ctc,
    String ctcPosition,
    Boolean interact,
    Boolean afm,
    String whatProperties,
    String windowProperties
) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String tag;
        private String name;
        private String color;
        private String profile;
        private String unitId;
        private String image;
        private String whoStyle;
        private String whoPrefix;
        private String whoSuffix;
        private String whatColor;
        private String whatStyle;
        private String whatPrefix;
        private String whatSuffix;
        private Boolean slow;
        private Integer slowSpeed;
        private Boolean slowAbortable;
        private Boolean allAtOnce;
        private String windowStyle;
        private String ctc;
        private String ctcPosition;
        private Boolean interact;
        private Boolean afm;
        private String whatProperties;
        private String windowProperties;

        public Builder tag(String tag) { this.tag = tag; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder color(String color) { this.color = color; return this; }
        public Builder profile(String profile) { this.profile = profile; return this; }
        public Builder unitId(String unitId) { this.unitId = unitId; return this; }
        public Builder image(String image) { this.image = image; return this; }
        public Builder whoStyle(String v) { this.whoStyle = v; return this; }
        public Builder whoPrefix(String v) { this.whoPrefix = v; return this; }
        public Builder whoSuffix(String v) { this.whoSuffix = v; return this; }
        public Builder whatColor(String v) { this.whatColor = v; return this; }
        public Builder whatStyle(String v) { this.whatStyle = v; return this; }
        public Builder whatPrefix(String v) { this.whatPrefix = v; return this; }
        public Builder whatSuffix(String v) { this.whatSuffix = v; return this; }
        public Builder slow(Boolean v) { this.slow = v; return this; }
        public Builder slowSpeed(Integer v) { this.slowSpeed = v; return this; }
        public Builder slowAbortable(Boolean v) { this.slowAbortable = v; return this; }
        public Builder allAtOnce(Boolean v) { this.allAtOnce = v; return this; }
        public Builder windowStyle(String v) { this.windowStyle = v; return this; }
        public Builder ctc(String v) { this.ctc = v; return this; }
        public Builder ctcPosition(String v) { this.ctcPosition = v; return this; }
        public Builder interact(Boolean v) { this.interact = v; return this; }
        public Builder afm(Boolean v) { this.afm = v; return this; }
        public Builder whatProperties(String v) { this.whatProperties = v; return this; }
        public Builder windowProperties(String v) { this.windowProperties = v; return this; }

        public CharacterDef build() {
            return new CharacterDef(tag, name, color, profile, unitId, image,
                    whoStyle, whoPrefix, whoSuffix, whatColor, whatStyle, whatPrefix, whatSuffix,
                    slow, slowSpeed, slowAbortable, allAtOnce, windowStyle, ctc, ctcPosition,
                    interact, afm, whatProperties, windowProperties);
        }
    }
}
