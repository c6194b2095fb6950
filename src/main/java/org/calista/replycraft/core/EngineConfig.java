package org.calista.replycraft.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.replycraft.io.FileIO;
import org.calista.replycraft.score.ScoreWeights;
import org.calista.replycraft.score.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * EngineConfig — простой POJO конфиг движка:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public String baseDir = "data";
    public Storage storage = new Storage();
    public Events events = new Events();
    public Catalog catalog = new Catalog();
    public Scoring scoring = new Scoring();
    public Defaults defaults = new Defaults();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Storage {
        /** Directory under baseDir, one json file per store key. */
        public String dir = "store";
        /** Debounce of write-behind ledger flush. */
        public long flushDelayMs = 5000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public boolean enabled = true;
        public String logFile = "selections.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Catalog {
        /** External catalog json; blank => bundled catalog. */
        public String file = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Weights {
        public double context = ScoreWeights.DEFAULT_CONTEXT;
        public double usage = ScoreWeights.DEFAULT_USAGE;
        public double preference = ScoreWeights.DEFAULT_PREFERENCE;
        public double time = ScoreWeights.DEFAULT_TIME;
        public double confidence = ScoreWeights.DEFAULT_CONFIDENCE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Scoring {
        public Weights weights = new Weights();
        public int usageSaturation = 10;
        public int minHistoryUses = 3;
        public double reasonEpsilon = 0.05;
        public int maxReasons = 5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Defaults {
        public double coldStartConfidence = 0.1;
        public int lastSelectionMaxAgeHours = 24;
        public int quickOptionsTop = 3;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой) — создаёт дефолтный и пишет на диск.
     */
    public static EngineConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            EngineConfig created = new EngineConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            EngineConfig created = new EngineConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        EngineConfig cfg = mapper.readValue(json, EngineConfig.class);
        if (cfg == null) cfg = new EngineConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (storage == null) storage = new Storage();
        if (storage.dir == null || storage.dir.isBlank()) storage.dir = "store";
        if (storage.flushDelayMs < 0) storage.flushDelayMs = 0;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "selections.jsonl";

        if (catalog == null) catalog = new Catalog();
        if (catalog.file == null) catalog.file = "";
        catalog.file = catalog.file.trim();

        if (scoring == null) scoring = new Scoring();
        if (scoring.weights == null) scoring.weights = new Weights();
        Weights w = scoring.weights;
        w.context = weight(w.context, ScoreWeights.DEFAULT_CONTEXT);
        w.usage = weight(w.usage, ScoreWeights.DEFAULT_USAGE);
        w.preference = weight(w.preference, ScoreWeights.DEFAULT_PREFERENCE);
        w.time = weight(w.time, ScoreWeights.DEFAULT_TIME);
        w.confidence = weight(w.confidence, ScoreWeights.DEFAULT_CONFIDENCE);
        if (w.context + w.usage + w.preference + w.time + w.confidence <= 0.0) {
            log.warn("All scoring weights are zero. Falling back to defaults.");
            scoring.weights = new Weights();
        }
        if (scoring.usageSaturation < 1) scoring.usageSaturation = 1;
        if (scoring.minHistoryUses < 1) scoring.minHistoryUses = 1;
        if (!Double.isFinite(scoring.reasonEpsilon) || scoring.reasonEpsilon < 0.0) scoring.reasonEpsilon = 0.05;
        if (scoring.maxReasons < 0) scoring.maxReasons = 0;
        if (scoring.maxReasons > 5) scoring.maxReasons = 5;

        if (defaults == null) defaults = new Defaults();
        if (!Double.isFinite(defaults.coldStartConfidence)) defaults.coldStartConfidence = 0.1;
        if (defaults.coldStartConfidence < 0.0) defaults.coldStartConfidence = 0.0;
        if (defaults.coldStartConfidence > 1.0) defaults.coldStartConfidence = 1.0;
        if (defaults.lastSelectionMaxAgeHours < 0) defaults.lastSelectionMaxAgeHours = 0;
        if (defaults.quickOptionsTop < 0) defaults.quickOptionsTop = 0;
    }

    private static double weight(double v, double fallback) {
        if (!Double.isFinite(v)) return fallback;
        return Math.max(0.0, v);
    }

    // -------------------- Views --------------------

    public ScoringConfig toScoringConfig() {
        Weights w = scoring.weights;
        return new ScoringConfig(
                new ScoreWeights(w.context, w.usage, w.preference, w.time, w.confidence),
                scoring.usageSaturation,
                scoring.minHistoryUses,
                scoring.reasonEpsilon,
                scoring.maxReasons);
    }

    public Duration lastSelectionMaxAge() {
        return Duration.ofHours(defaults.lastSelectionMaxAgeHours);
    }
}
