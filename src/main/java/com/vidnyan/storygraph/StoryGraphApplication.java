package com.vidnyan.storygraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * StoryGraph - Narrative Graph Engine
 *
 * Extracts story structure from branching scripts and derives unit graphs,
 * routes and diagram layouts.
 */
@SpringBootApplication
public class StoryGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryGraphApplication.class, args);
    }
}
