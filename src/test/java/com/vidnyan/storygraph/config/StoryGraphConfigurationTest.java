package com.vidnyan.storygraph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.storygraph.domain.model.CharacterDef;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoryGraphConfigurationTest {

    private final ObjectMapper objectMapper = new StoryGraphConfiguration().objectMapper();

    @Test
    void objectMapper_ShouldOmitUnsetCharacterAttributes() throws Exception {
        CharacterDef character = CharacterDef.builder()
                .tag("e")
                .name("Eileen")
                .color("#ff0000")
                .unitId("chars")
                .build();

        String json = objectMapper.writeValueAsString(character);

        assertTrue(json.contains("\"name\" : \"Eileen\""));
        assertFalse(json.contains("whoStyle"));
        assertFalse(json.contains("null"));
    }

    @Test
    void objectMapper_ShouldIgnoreUnknownUnitFields() throws Exception {
        ScriptUnit unit = objectMapper.readValue(
                "{\"id\":\"a\",\"text\":\"label start:\",\"position\":{\"x\":10,\"y\":20}}", ScriptUnit.class);

        assertEquals("a", unit.id());
        assertEquals("label start:", unit.text());
        assertNull(unit.filePath());
    }
}
