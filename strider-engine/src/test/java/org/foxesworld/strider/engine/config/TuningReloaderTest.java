package org.foxesworld.strider.engine.config;

import org.foxesworld.strider.core.config.PlayerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TuningReloaderTest {

    @TempDir
    Path dir;

    private final PlayerConfig cfg = new PlayerConfig();

    @Test
    void loadsJsonFile() throws IOException {
        Path f = Files.writeString(dir.resolve("player.json"), "{ \"jumpHeight\": 3.0, \"zoom\": { \"max\": 20 } }");
        TuningReloader r = new TuningReloader(f, cfg);

        assertTrue(r.reload());
        assertEquals(3f, cfg.jumpHeight, 0f);
        assertEquals(20f, cfg.zoomMaxDistance, 0f);
    }

    @Test
    void loadsJsModuleExpression() throws IOException {
        Path f = Files.writeString(dir.resolve("player.js"), "const base = 2;\n({ jumpHeight: base * 2 })");
        TuningReloader r = new TuningReloader(f, cfg);

        assertTrue(r.reload());
        assertEquals(4f, cfg.jumpHeight, 0f);
    }

    @Test
    void brokenSourceKeepsPreviousTuning() {
        TuningReloader r = new TuningReloader(dir.resolve("player.js"), cfg);
        assertTrue(r.apply("({ jumpHeight: 2 })", "player.js", false));

        assertFalse(r.apply("({ jumpHeight: ", "player.js", false));
        assertFalse(r.apply("42", "player.js", false));
        assertEquals(2f, cfg.jumpHeight, 0f);
    }

    @Test
    void missingFileFails() {
        TuningReloader r = new TuningReloader(dir.resolve("nope.json"), cfg);
        assertFalse(r.reload());
    }

    @Test
    void systemPropertyLocatesFile() throws IOException {
        String prev = System.getProperty(TuningReloader.DIR_PROPERTY);
        try {
            System.clearProperty(TuningReloader.DIR_PROPERTY);
            assertNull(TuningReloader.fromSystemProperty(cfg));

            Files.writeString(dir.resolve("player.json"), "{}");
            System.setProperty(TuningReloader.DIR_PROPERTY, dir.toString());
            TuningReloader r = TuningReloader.fromSystemProperty(cfg);
            assertEquals(dir.resolve("player.json").toAbsolutePath().normalize(), r.file());
        } finally {
            if (prev == null) System.clearProperty(TuningReloader.DIR_PROPERTY);
            else System.setProperty(TuningReloader.DIR_PROPERTY, prev);
        }
    }
}
