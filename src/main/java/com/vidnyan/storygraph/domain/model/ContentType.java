package com.vidnyan.storygraph.domain.model;

/**
 * Kinds of content detected in a script unit.
 */
public enum ContentType {
    PYTHON,     // embedded python: block
    JUMP,       // jump or call statements
    LABEL,
    MENU,       // bare menu:
    DIALOGUE    // character dialogue or narration
}
