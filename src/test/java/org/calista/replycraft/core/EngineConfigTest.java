package org.calista.replycraft.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.replycraft.io.FileIO;
import org.calista.replycraft.score.ScoringConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testMissingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(tempDir);
        Path file = tempDir.resolve("config").resolve("replycraft.json");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);

        assertTrue(Files.exists(file));
        assertEquals("data", cfg.baseDir);
        assertEquals(5000, cfg.storage.flushDelayMs);
        assertEquals(0.1, cfg.defaults.coldStartConfidence, 1e-12);

        EngineConfig reread = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals(cfg.storage.dir, reread.storage.dir);
        assertEquals(cfg.scoring.weights.usage, reread.scoring.weights.usage, 1e-12);
    }

    @Test
    void testValidateNormalizesBadValues() throws Exception {
        FileIO io = new FileIO(tempDir);
        Path file = tempDir.resolve("cfg.json");
        io.writeString(file, "{\"baseDir\":\" \",\"storage\":{\"flushDelayMs\":-5},"
                + "\"scoring\":{\"maxReasons\":12,\"usageSaturation\":0,\"weights\":{\"context\":-1}},"
                + "\"defaults\":{\"coldStartConfidence\":3.0,\"quickOptionsTop\":-2},"
                + "\"somethingElse\":true}");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);

        assertEquals("data", cfg.baseDir);
        assertEquals(0, cfg.storage.flushDelayMs);
        assertEquals(5, cfg.scoring.maxReasons);
        assertEquals(1, cfg.scoring.usageSaturation);
        assertEquals(0.0, cfg.scoring.weights.context, 1e-12);
        assertEquals(1.0, cfg.defaults.coldStartConfidence, 1e-12);
        assertEquals(0, cfg.defaults.quickOptionsTop);
        assertEquals("selections.jsonl", cfg.events.logFile);
    }

    @Test
    void testSaveWritesValidatedValues() throws Exception {
        FileIO io = new FileIO(tempDir);
        Path file = tempDir.resolve("saved.json");
        EngineConfig cfg = new EngineConfig();
        cfg.baseDir = "runtime";
        cfg.defaults.quickOptionsTop = -1;

        EngineConfig.save(io, file, mapper, cfg);

        EngineConfig back = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals("runtime", back.baseDir);
        assertEquals(0, back.defaults.quickOptionsTop);
    }

    @Test
    void testAllZeroWeightsFallBackToDefaults() {
        EngineConfig cfg = new EngineConfig();
        cfg.scoring.weights.context = 0;
        cfg.scoring.weights.usage = 0;
        cfg.scoring.weights.preference = 0;
        cfg.scoring.weights.time = 0;
        cfg.scoring.weights.confidence = 0;
        cfg.validate();
        assertEquals(0.30, cfg.scoring.weights.context, 1e-12);
    }

    @Test
    void testScoringViewIsNormalized() {
        EngineConfig cfg = new EngineConfig();
        cfg.scoring.weights.context = 2;
        cfg.scoring.weights.usage = 2;
        cfg.scoring.weights.preference = 0;
        cfg.scoring.weights.time = 0;
        cfg.scoring.weights.confidence = 0;
        cfg.validate();

        ScoringConfig sc = cfg.toScoringConfig();
        assertEquals(0.5, sc.weights.context, 1e-12);
        assertEquals(0.5, sc.weights.usage, 1e-12);
        assertEquals(Duration.ofHours(24), cfg.lastSelectionMaxAge());
    }
}
