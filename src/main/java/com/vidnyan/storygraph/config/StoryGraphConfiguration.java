package com.vidnyan.storygraph.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.storygraph.StoryGraphProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for StoryGraph components.
 */
@Slf4j
@Configuration
public class StoryGraphConfiguration {

    /**
     * ObjectMapper for analysis payloads. Unit requests from editors may carry
     * extra canvas fields; character style attributes that a definition does not
     * set are left out of the response instead of being written as null.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log effective analysis settings on startup.
     */
    @Bean
    public String logAnalysisSettings(StoryGraphProperties properties) {
        log.info("Placeholder units: *{}", properties.getAnalysis().getPlaceholderSuffix());
        log.info("Always-story paths:");
        properties.getAnalysis().getStoryPaths().forEach(p -> log.info("  - {}", p));
        return "settings-logged";
    }
}
