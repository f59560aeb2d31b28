package com.vidnyan.storygraph;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the narrative graph engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "storygraph")
public class StoryGraphProperties {

    private Analysis analysis = new Analysis();

    private Layout layout = new Layout();

    @Data
    public static class Analysis {

        /**
         * Units whose file path ends with this suffix are skipped by extraction.
         */
        private String placeholderSuffix = "debug_placeholders.rpy";

        /**
         * File paths always classified as story units, even without labels.
         * Default: the project's variables and characters files
         */
        private List<String> storyPaths = new ArrayList<>();
    }

    @Data
    public static class Layout {

        private double horizontalPadding = 150;

        private double verticalPadding = 50;

        /**
         * Size used for unit boxes that arrive without one.
         */
        private double defaultWidth = 300;

        private double defaultHeight = 150;

        private double routeColumnSpacing = 250;

        private double routeRowSpacing = 100;
    }

    @PostConstruct
    public void init() {
        if (analysis.getStoryPaths().isEmpty()) {
            analysis.getStoryPaths().add("game/variables.rpy");
            analysis.getStoryPaths().add("game/characters.rpy");
        }
    }

    /**
     * Properties with defaults applied, for use outside the Spring context.
     */
    public static StoryGraphProperties defaults() {
        StoryGraphProperties properties = new StoryGraphProperties();
        properties.init();
        return properties;
    }
}
