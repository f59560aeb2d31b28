package com.vidnyan.storygraph.domain.graph;

import java.util.List;

/**
 * Fixed colour palette shared by characters and routes.
 */
public final class Palette {

    public static final List<String> COLORS = List.of(
            "#E57373", "#F06292", "#BA68C8", "#9575CD", "#7986CB", "#64B5F6",
            "#4FC3F7", "#4DD0E1", "#4DB6AC", "#81C784", "#AED581", "#DCE775",
            "#FFF176", "#FFD54F", "#FFB74D", "#FF8A65", "#A1887F", "#90A4AE"
    );

    private Palette() {
    }

    /**
     * Colour for the n-th discovered route; cycles through the palette.
     */
    public static String forIndex(int index) {
        return COLORS.get(Math.floorMod(index, COLORS.size()));
    }

    /**
     * Colour derived from a string hash, stable across runs for the same tag.
     * The shift in {@code hash = code + ((hash << 5) - hash)} works on the low 32 bits,
     * the subtraction does not wrap; this matches the colours the editor front end computes.
     */
    public static String forTag(String tag) {
        long hash = 0;
        for (int i = 0; i < tag.length(); i++) {
            int shifted = ((int) hash) << 5;
            hash = tag.charAt(i) + ((long) shifted - hash);
        }
        return COLORS.get((int) (Math.abs(hash) % COLORS.size()));
    }
}
