package com.vidnyan.storygraph.application.service;

import com.vidnyan.storygraph.application.service.PunchlistScanner.AssetInventory;
import com.vidnyan.storygraph.application.service.PunchlistScanner.PunchlistTask;
import com.vidnyan.storygraph.application.service.PunchlistScanner.TaskType;
import com.vidnyan.storygraph.domain.model.ScriptUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PunchlistScannerTest {

    private final PunchlistScanner scanner = new PunchlistScanner();

    @Test
    void scan_ShouldReportMissingImagesAndAudio() {
        ScriptUnit unit = ScriptUnit.of("story", String.join("\n",
                "label start:",
                "    scene bg park",
                "    show eileen happy",
                "    show sylvie",
                "    play music \"audio/theme.ogg\"",
                "    play sound door_slam",
                "    play music bgm_var",
                "    show expression portrait"));

        List<PunchlistTask> tasks = scanner.scan(
                List.of(unit),
                Set.of("bg park"),
                Set.of("bgm_var"),
                new AssetInventory(List.of("eileen"), List.of("game/audio/theme.ogg")));

        assertEquals(2, tasks.size());
        PunchlistTask image = tasks.get(0);
        assertEquals(TaskType.IMAGE, image.type());
        assertEquals("sylvie", image.name());
        assertEquals("image:sylvie", image.id());
        assertEquals(4, image.line());
        PunchlistTask audio = tasks.get(1);
        assertEquals(TaskType.AUDIO, audio.type());
        assertEquals("door_slam", audio.name());
    }

    @Test
    void scan_ShouldMergeReferencesAcrossUnits() {
        List<PunchlistTask> tasks = scanner.scan(
                List.of(ScriptUnit.of("a", "show lucy"), ScriptUnit.of("b", "show lucy")),
                Set.of(), Set.of(), AssetInventory.empty());

        assertEquals(1, tasks.size());
        assertEquals(Set.of("a", "b"), tasks.get(0).unitIds());
    }

    @Test
    void scan_ShouldMatchAudioByFileName() {
        List<PunchlistTask> tasks = scanner.scan(
                List.of(ScriptUnit.of("a", "play sound \"click.wav\"\nqueue music theme")),
                Set.of(), Set.of(),
                new AssetInventory(List.of(), List.of("game/sfx/click.wav", "game/music/theme.ogg")));

        assertTrue(tasks.isEmpty());
    }
}
