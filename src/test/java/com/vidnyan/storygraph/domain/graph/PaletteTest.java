package com.vidnyan.storygraph.domain.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaletteTest {

    @Test
    void forIndex_ShouldCycleThroughPalette() {
        assertEquals("#E57373", Palette.forIndex(0));
        assertEquals(Palette.forIndex(0), Palette.forIndex(Palette.COLORS.size()));
        assertEquals("#90A4AE", Palette.forIndex(-1));
    }

    @Test
    void forTag_ShouldBeStableAndInPalette() {
        // 'e' hashes to 101, and 101 % 18 == 11
        assertEquals("#DCE775", Palette.forTag("e"));
        assertEquals(Palette.forTag("sylvie"), Palette.forTag("sylvie"));
        assertTrue(Palette.COLORS.contains(Palette.forTag("a_very_long_character_tag_name")));
        assertEquals("#E57373", Palette.forTag(""));
    }
}
