package org.calista.replycraft.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.replycraft.catalog.CatalogLoader;
import org.calista.replycraft.catalog.StyleCatalog;
import org.calista.replycraft.combos.CustomCombosStore;
import org.calista.replycraft.defaults.RandomSource;
import org.calista.replycraft.defaults.SeededRandomSource;
import org.calista.replycraft.defaults.SmartDefaultsResolver;
import org.calista.replycraft.events.EventStore;
import org.calista.replycraft.favorites.FavoritesStore;
import org.calista.replycraft.io.FileIO;
import org.calista.replycraft.rank.SuggestionRanker;
import org.calista.replycraft.score.ScoringConfig;
import org.calista.replycraft.score.impl.DefaultFeatureScorer;
import org.calista.replycraft.store.FileKeyValueStore;
import org.calista.replycraft.store.KeyValueStore;
import org.calista.replycraft.usage.UsageLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.*;

/**
 * ReplyCraftKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config) -> loadOrCreate config, load catalog, read ledger + favorites once
 *   2) use           -> engine()
 *   3) close()       -> final ledger flush, stop the flush scheduler
 *
 * No statics singletons: lifecycle is explicit.
 */
public final class ReplyCraftKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReplyCraftKernel.class);

    static final long CLOSE_FLUSH_TIMEOUT_MS = 5000;

    private final FileIO io;
    private final ObjectMapper mapper;
    private final EngineConfig cfg;
    private final ScheduledExecutorService scheduler;
    private final UsageLedger ledger;
    private final EventStore events;
    private final ReplyStyleEngine engine;

    private volatile boolean closed = false;

    private ReplyCraftKernel(FileIO io,
                             ObjectMapper mapper,
                             EngineConfig cfg,
                             ScheduledExecutorService scheduler,
                             UsageLedger ledger,
                             EventStore events,
                             ReplyStyleEngine engine) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.events = events; // nullable: events disabled
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives. A relative baseDir or catalog file is resolved against it.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private KeyValueStore store;
        private Clock clock = Clock.systemDefaultZone();
        private RandomSource randomSource;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Replaces the file store under baseDir. */
        public Builder store(KeyValueStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder randomSource(RandomSource randomSource) {
            this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
            return this;
        }

        /**
         * Creates the kernel: loads/creates config, loads the catalog, reads persisted state.
         *
         * @throws IllegalStateException if the catalog cannot be loaded
         */
        public ReplyCraftKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset);
            Path cfgPath = configFile.isAbsolute() ? configFile : external.baseDir().resolve(configFile);

            EngineConfig cfg = EngineConfig.loadOrCreate(external, cfgPath, om);

            // Base IO bound to cfg.baseDir (runtime data dir)
            FileIO io = new FileIO(external.resolveExternal(cfg.baseDir), charset);

            StyleCatalog catalog = loadCatalog(external, cfg, om);

            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "replycraft-store");
                t.setDaemon(true);
                return t;
            });

            try {
                KeyValueStore kv = (this.store != null) ? this.store : new FileKeyValueStore(io, cfg.storage.dir, scheduler);

                UsageLedger ledger = new UsageLedger(kv, om, clock, scheduler, cfg.storage.flushDelayMs);
                ledger.load();

                FavoritesStore favorites = new FavoritesStore(kv, om);
                favorites.load();

                CustomCombosStore combos = new CustomCombosStore(kv, om, clock);
                combos.load();

                EventStore events = null;
                if (cfg.events.enabled) {
                    events = new EventStore(io, om, io.resolve(cfg.events.logFile));
                    ledger.addListener(events);
                }

                ScoringConfig scoring = cfg.toScoringConfig();
                DefaultFeatureScorer scorer = new DefaultFeatureScorer(catalog, ledger, favorites, scoring);
                SuggestionRanker ranker = new SuggestionRanker(scorer, catalog);

                RandomSource rnd = (this.randomSource != null) ? this.randomSource : new SeededRandomSource();
                SmartDefaultsResolver resolver = new SmartDefaultsResolver(
                        catalog, ledger, ranker, rnd,
                        cfg.defaults.coldStartConfidence,
                        cfg.lastSelectionMaxAge(),
                        cfg.defaults.quickOptionsTop);

                ReplyStyleEngine engine = new ReplyStyleEngine(catalog, ledger, favorites, combos, ranker, resolver, clock);

                ReplyCraftKernel k = new ReplyCraftKernel(io, om, cfg, scheduler, ledger, events, engine);
                k.logCreated(cfgPath, catalog);
                return k;
            } catch (RuntimeException e) {
                scheduler.shutdownNow();
                throw e;
            }
        }

        private static StyleCatalog loadCatalog(FileIO external, EngineConfig cfg, ObjectMapper om) {
            CatalogLoader loader = new CatalogLoader(om);
            try {
                if (cfg.catalog.file.isEmpty()) return loader.loadDefault();
                return loader.load(external, external.resolveExternal(cfg.catalog.file));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load style catalog: " + e.getMessage(), e);
            }
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public EngineConfig config() { return cfg; }
    public ReplyStyleEngine engine() { return engine; }

    /** Selection log; null when events are disabled. */
    public EventStore eventStore() { return events; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        try {
            Boolean ok = ledger.flush().get(CLOSE_FLUSH_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            if (!Boolean.TRUE.equals(ok)) log.warn("Final usage flush was not accepted by the store");
        } catch (TimeoutException e) {
            log.warn("Final usage flush timed out after {} ms", CLOSE_FLUSH_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during final usage flush");
        } catch (ExecutionException e) {
            log.warn("Final usage flush failed: {}", e.getCause() == null ? e.toString() : e.getCause().toString());
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(CLOSE_FLUSH_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ReplyCraftKernel closed");
    }

    private void logCreated(Path cfgPath, StyleCatalog catalog) {
        if (!log.isInfoEnabled()) return;
        log.info("ReplyCraftKernel created: config={}, baseDir={}, catalog.entities={}, personas={}, events={}",
                cfgPath, io.baseDir(), catalog.size(), catalog.personas().size(), events != null);
    }
}
