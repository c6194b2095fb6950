package org.calista.replycraft.core;

import org.calista.replycraft.defaults.SeededRandomSource;
import org.calista.replycraft.defaults.SmartDefaultsResolver;
import org.calista.replycraft.events.SelectionEvent;
import org.calista.replycraft.model.*;
import org.calista.replycraft.store.InMemoryKeyValueStore;
import org.calista.replycraft.testutil.MutableClock;
import org.calista.replycraft.usage.SelectionSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplyCraftKernelTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.at("2026-10-17T19:30:00Z");

    private ReplyCraftKernel build() throws Exception {
        return ReplyCraftKernel.builder()
                .configRoot(tempDir)
                .clock(clock)
                .randomSource(new SeededRandomSource(7))
                .build(Path.of("config.json"));
    }

    @Test
    void testBuildCreatesConfigAndDataDir() throws Exception {
        try (ReplyCraftKernel k = build()) {
            assertTrue(Files.exists(tempDir.resolve("config.json")));
            assertEquals(tempDir.resolve("data").toAbsolutePath().normalize(), k.io().baseDir());
            assertEquals(10080, k.engine().catalog().allCandidates().size());
            assertNotNull(k.eventStore());
        }
    }

    @Test
    void testUsageSurvivesRestartThroughFileStore() throws Exception {
        Candidate persona;
        try (ReplyCraftKernel k = build()) {
            persona = k.engine().selectPersona("debate_lord");
            k.engine().selectPersona("debate_lord");
            k.engine().toggleFavorite(EntityRef.personality("provocative"));
        }

        assertTrue(Files.exists(tempDir.resolve("data").resolve("store").resolve("combination_usage.json")));

        try (ReplyCraftKernel k = build()) {
            ReplyStyleEngine engine = k.engine();
            assertEquals(2, engine.ledger().getCombinationUsage(persona));
            assertTrue(engine.favorites().isFavorite(EntityRef.personality("provocative")));

            List<SelectionEvent> events = k.eventStore().readAll();
            assertEquals(2, events.size());
            assertEquals(SelectionSource.PERSONA, events.get(0).source);
            assertEquals(persona.key(), events.get(0).key);
        }
    }

    @Test
    void testRankAndResolveOverBundledCatalog() throws Exception {
        try (ReplyCraftKernel k = ReplyCraftKernel.builder()
                .configRoot(tempDir)
                .clock(clock)
                .store(new InMemoryKeyValueStore())
                .randomSource(new SeededRandomSource(1))
                .build(Path.of("config.json"))) {
            ReplyStyleEngine engine = k.engine();
            ReplyContext ctx = engine.context("Why would anyone think this is a good idea?", true, List.of());

            SmartDefault cold = engine.resolve(ctx);
            assertEquals(0.1, cold.confidence, 1e-12);
            assertTrue(cold.candidate.isFull());
            assertEquals(cold, engine.resolve(ctx));

            engine.confirm(cold);
            assertEquals(1, engine.ledger().getCombinationUsage(cold.candidate));

            List<Suggestion> top = engine.rank(ctx, 5);
            assertEquals(5, top.size());
            for (int i = 1; i < top.size(); i++) {
                assertTrue(top.get(i - 1).breakdown.total >= top.get(i).breakdown.total);
            }

            SmartDefault warm = engine.resolve(ctx);
            assertEquals(top.get(0).candidate, warm.candidate);
            assertNotEquals(SmartDefaultsResolver.COLD_START_REASON, warm.reason);
        }
    }

    @Test
    void testSavedComboIsRankedUnderItsNameAndSurvivesRestart() throws Exception {
        Candidate combo = Candidate.of("witty", "internet_genz", "agree_build", "drive_by");
        try (ReplyCraftKernel k = build()) {
            ReplyStyleEngine engine = k.engine();
            engine.saveCombo("Lunch break", combo);
            ReplyContext ctx = engine.context("Coffee first, then code", false, List.of());

            List<Suggestion> saved = engine.rankCombos(ctx, 5);
            assertEquals(1, saved.size());
            assertEquals("Lunch break", saved.get(0).candidate.label);

            List<Suggestion> all = engine.rank(ctx, engine.catalog().allCandidates().size());
            assertEquals(engine.catalog().allCandidates().size(), all.size());
            Suggestion labeled = all.stream().filter(s -> s.candidate.equals(combo)).findFirst().orElseThrow();
            assertEquals("Lunch break", labeled.candidate.label);

            assertEquals(combo, engine.selectCombo("lunch BREAK"));
            assertEquals(1, engine.ledger().getCombinationUsage(combo));
            assertEquals(1, engine.combos().findByName("Lunch break").orElseThrow().usageCount);
        }

        try (ReplyCraftKernel k = build()) {
            assertEquals(1, k.engine().combos().count());
            List<SelectionEvent> events = k.eventStore().readAll();
            assertEquals(SelectionSource.CUSTOM_COMBO, events.get(0).source);
            assertTrue(k.engine().deleteCombo("Lunch break"));
            assertTrue(k.engine().rankCombos(k.engine().context("x", false, List.of()), 5).isEmpty());
        }
    }

    @Test
    void testComboWithUnknownEntityOrNameIsRejected() throws Exception {
        try (ReplyCraftKernel k = build()) {
            ReplyStyleEngine engine = k.engine();
            assertThrows(IllegalArgumentException.class,
                    () -> engine.saveCombo("ghost", Candidate.of("nobody", "internet_genz", "agree_build", "drive_by")));
            assertThrows(IllegalArgumentException.class, () -> engine.selectCombo("ghost"));
            assertFalse(engine.deleteCombo("ghost"));
            assertEquals(0, engine.combos().count());
        }
    }

    @Test
    void testUnknownPersonaAndEntityAreRejected() throws Exception {
        try (ReplyCraftKernel k = build()) {
            assertThrows(IllegalArgumentException.class, () -> k.engine().selectPersona("nobody"));
            assertThrows(IllegalArgumentException.class, () -> k.engine().toggleFavorite(EntityRef.personality("nobody")));
        }
    }

    @Test
    void testBrokenExternalCatalogIsFatal() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), "{\"catalog\":{\"file\":\"missing-catalog.json\"}}");
        assertThrows(IllegalStateException.class, this::build);
    }
}
