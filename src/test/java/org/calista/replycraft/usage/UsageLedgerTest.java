package org.calista.replycraft.usage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;
import org.calista.replycraft.store.InMemoryKeyValueStore;
import org.calista.replycraft.testutil.FailingKeyValueStore;
import org.calista.replycraft.testutil.LogCapture;
import org.calista.replycraft.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class UsageLedgerTest {

    private static final long NO_AUTO_FLUSH = 60_000;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2026-10-17T10:00:00Z");
    private final Candidate a = Candidate.of("friendly", "plain_english", "agree_build", "drive_by");
    private final Candidate b = Candidate.of("analytical", "academic_scholarly", "devils_advocate", "drive_by");

    private ScheduledExecutorService scheduler;
    private InMemoryKeyValueStore store;
    private UsageLedger ledger;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        store = new InMemoryKeyValueStore();
        ledger = newLedger(store, NO_AUTO_FLUSH);
        ledger.load();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private UsageLedger newLedger(org.calista.replycraft.store.KeyValueStore kv, long delayMs) {
        return new UsageLedger(kv, mapper, clock, scheduler, delayMs);
    }

    @Test
    void testCountsEqualNumberOfCalls() {
        for (int i = 0; i < 12; i++) ledger.recordSelection(a, SelectionSource.MANUAL);
        for (int i = 0; i < 3; i++) ledger.recordSelection(b, SelectionSource.SUGGESTION);

        assertEquals(12, ledger.getCombinationUsage(a));
        assertEquals(3, ledger.getCombinationUsage(b));
        assertEquals(12, ledger.getEntityUsage(EntityRef.personality("friendly")));
        assertEquals(15, ledger.getEntityUsage(EntityRef.lengthPacing("drive_by")));
        assertEquals(0, ledger.getEntityUsage(EntityRef.personality("never_used")));
        assertTrue(ledger.hasAnyCombination());
    }

    @Test
    void testSameCombinationInAnyOrderSharesOneCounter() {
        Candidate reordered = Candidate.builder()
                .with(EntityRef.lengthPacing("drive_by"))
                .with(EntityRef.rhetoric("agree_build"))
                .with(EntityRef.vocabulary("plain_english"))
                .with(EntityRef.personality("friendly"))
                .build();
        ledger.recordSelection(a, SelectionSource.MANUAL);
        ledger.recordSelection(reordered, SelectionSource.MANUAL);

        assertEquals(2, ledger.getCombinationUsage(a));
        assertEquals(1, ledger.topCombinations(10).size());
    }

    @Test
    void testEmptyCandidateRecordsNothing() {
        long rev = ledger.revision();
        ledger.recordSelection(Candidate.empty(), SelectionSource.MANUAL);
        assertEquals(rev, ledger.revision());
        assertFalse(ledger.hasAnyCombination());
    }

    @Test
    void testPartialCandidateCountsOnlyFilledSlots() {
        Candidate legacy = Candidate.of("friendly", null, "agree_build", null);
        ledger.recordSelection(legacy, SelectionSource.MANUAL);
        assertEquals(1, ledger.getEntityUsage(EntityRef.personality("friendly")));
        assertEquals(0, ledger.getEntityUsage(EntityRef.lengthPacing("drive_by")));
        assertEquals("v1:friendly||agree_build|", ledger.topCombinations(1).get(0).key);
    }

    @Test
    void testTopCombinationsOrderedByCountThenRecencyThenKey() {
        Candidate c = Candidate.of("zany", null, null, null);
        Candidate d = Candidate.of("absurd", null, null, null);

        ledger.recordSelection(a, SelectionSource.MANUAL);
        ledger.recordSelection(a, SelectionSource.MANUAL);
        clock.advance(Duration.ofMinutes(1));
        ledger.recordSelection(b, SelectionSource.MANUAL);
        ledger.recordSelection(b, SelectionSource.MANUAL);
        clock.advance(Duration.ofMinutes(1));
        ledger.recordSelection(c, SelectionSource.MANUAL);
        ledger.recordSelection(d, SelectionSource.MANUAL);

        List<CombinationCount> top = ledger.topCombinations(10);
        List<String> keys = new ArrayList<>();
        for (CombinationCount cc : top) keys.add(cc.key);

        // b ties a on count but is more recent; c and d tie on both, key decides
        assertEquals(List.of(b.key(), a.key(), d.key(), c.key()), keys);
        assertEquals(2, ledger.topCombinations(2).size());
        assertTrue(ledger.topCombinations(0).isEmpty());
    }

    @Test
    void testResetClearsCountsAndLastSelection() {
        ledger.recordSelection(a, SelectionSource.MANUAL);
        assertTrue(ledger.reset().join());

        assertEquals(0, ledger.getCombinationUsage(a));
        assertFalse(ledger.hasAnyCombination());
        assertTrue(ledger.lastSelection(null).isEmpty());
        assertTrue(store.raw(UsageLedger.KEY_COMBINATIONS).orElseThrow().contains("\"combinations\":{}"));
    }

    @Test
    void testFlushAndReloadRestoresState() {
        for (int i = 0; i < 4; i++) ledger.recordSelection(a, SelectionSource.MANUAL);
        ledger.recordSelection(b, SelectionSource.PERSONA);
        assertTrue(ledger.flush().join());

        UsageLedger reloaded = newLedger(store, NO_AUTO_FLUSH);
        reloaded.load();

        assertEquals(4, reloaded.getCombinationUsage(a));
        assertEquals(1, reloaded.getCombinationUsage(b));
        assertEquals(5, reloaded.getEntityUsage(EntityRef.lengthPacing("drive_by")));
        assertEquals(b, reloaded.lastSelection(Duration.ofHours(24)).orElseThrow());
        assertEquals(ledger.topCombinations(5), reloaded.topCombinations(5));
    }

    @Test
    void testCorruptLedgerGivesZeroUsageAndOneWarning() {
        InMemoryKeyValueStore corrupt = new InMemoryKeyValueStore(Map.of(
                UsageLedger.KEY_LEDGER, "{\"version\":\"v1\",\"entities\":{\"personality\":{\"friendly\":{\"count\":"));

        try (LogCapture logs = LogCapture.attach(UsageLedger.class)) {
            UsageLedger l = newLedger(corrupt, NO_AUTO_FLUSH);
            l.load();

            assertEquals(0, l.getEntityUsage(EntityRef.personality("friendly")));
            assertEquals(1, logs.warnCount(), "warnings: " + logs.warnings());
        }
    }

    @Test
    void testBadNamespaceDoesNotTakeDownTheOthers() {
        InMemoryKeyValueStore mixed = new InMemoryKeyValueStore(Map.of(
                UsageLedger.KEY_LEDGER, "{\"version\":\"v1\",\"entities\":{\"personality\":{\"friendly\":{\"count\":3,\"lastUsedAt\":5}}}}",
                UsageLedger.KEY_COMBINATIONS, "{\"version\":\"v1\",\"combinations\":{\"v0:friendly|||\":{\"count\":3,\"lastUsedAt\":5}}}"));

        try (LogCapture logs = LogCapture.attach(UsageLedger.class)) {
            UsageLedger l = newLedger(mixed, NO_AUTO_FLUSH);
            l.load();

            assertEquals(3, l.getEntityUsage(EntityRef.personality("friendly")));
            assertFalse(l.hasAnyCombination());
            assertEquals(1, logs.warnCount());
        }
    }

    @Test
    void testNegativeOrFractionalCountsAreMalformed() {
        InMemoryKeyValueStore bad = new InMemoryKeyValueStore(Map.of(
                UsageLedger.KEY_LEDGER, "{\"version\":\"v1\",\"entities\":{\"rhetoric\":{\"x\":{\"count\":-1}}}}",
                UsageLedger.KEY_COMBINATIONS, "{\"version\":\"v1\",\"combinations\":{\"v1:a|b|c|d\":{\"count\":1.5}}}"));

        try (LogCapture logs = LogCapture.attach(UsageLedger.class)) {
            UsageLedger l = newLedger(bad, NO_AUTO_FLUSH);
            l.load();

            assertEquals(0, l.getEntityUsage(EntityRef.rhetoric("x")));
            assertFalse(l.hasAnyCombination());
            assertEquals(2, logs.warnCount());
        }
    }

    @Test
    void testMissingKeysLoadSilently() {
        try (LogCapture logs = LogCapture.attach(UsageLedger.class)) {
            UsageLedger l = newLedger(new InMemoryKeyValueStore(), NO_AUTO_FLUSH);
            l.load();
            assertEquals(0, logs.warnCount());
            assertFalse(l.hasAnyCombination());
        }
    }

    @Test
    void testReadFailureStartsEmpty() {
        FailingKeyValueStore failing = new FailingKeyValueStore();
        failing.failReads = true;

        try (LogCapture logs = LogCapture.attach(UsageLedger.class)) {
            UsageLedger l = newLedger(failing, NO_AUTO_FLUSH);
            assertDoesNotThrow(l::load);
            assertFalse(l.hasAnyCombination());
            assertEquals(1, logs.warnCount());
        }
    }

    @Test
    void testWriteFailureIsRetriedOnceThenDropped() {
        FailingKeyValueStore failing = new FailingKeyValueStore();
        UsageLedger l = newLedger(failing, NO_AUTO_FLUSH);
        l.load();

        failing.failWrites = true;
        assertDoesNotThrow(() -> l.recordSelection(a, SelectionSource.MANUAL));
        assertFalse(l.flush().join());
        assertEquals(1, l.getCombinationUsage(a), "memory stays authoritative");

        // still dirty: the retry succeeds once the store recovers
        failing.failWrites = false;
        assertTrue(l.flush().join());
        assertTrue(failing.delegate.raw(UsageLedger.KEY_COMBINATIONS).isPresent());

        failing.failWrites = true;
        l.recordSelection(b, SelectionSource.MANUAL);
        assertFalse(l.flush().join());
        assertFalse(l.flush().join());
        int attempts = failing.writeAttempts.get();

        // second consecutive failure dropped the pending write
        assertTrue(l.flush().join());
        assertEquals(attempts, failing.writeAttempts.get());
    }

    @Test
    void testDebouncedFlushReachesTheStore() throws InterruptedException {
        UsageLedger l = newLedger(store, 20);
        l.load();
        l.recordSelection(a, SelectionSource.MANUAL);
        l.recordSelection(a, SelectionSource.MANUAL);

        long deadline = System.currentTimeMillis() + 5000;
        String json = "";
        while (!json.contains("\"count\":2") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            json = store.raw(UsageLedger.KEY_COMBINATIONS).orElse("");
        }
        assertTrue(json.contains("\"count\":2"), json);
    }

    @Test
    void testLastSelectionExpires() {
        ledger.recordSelection(a, SelectionSource.MANUAL);
        ledger.recordSelection(b, SelectionSource.MANUAL);

        clock.advance(Duration.ofHours(23));
        assertEquals(b, ledger.lastSelection(Duration.ofHours(24)).orElseThrow());

        clock.advance(Duration.ofHours(2));
        assertTrue(ledger.lastSelection(Duration.ofHours(24)).isEmpty());
    }

    @Test
    void testStats() {
        ledger.recordSelection(a, SelectionSource.MANUAL);
        ledger.recordSelection(a, SelectionSource.MANUAL);
        ledger.recordSelection(b, SelectionSource.MANUAL);

        UsageStats s = ledger.stats();
        assertEquals(3, s.totalUsage);
        assertEquals(2, s.uniqueCombinations);
        assertEquals(EntityRef.personality("friendly"), s.topEntity(EntityKind.PERSONALITY).orElseThrow());
        assertEquals(EntityRef.lengthPacing("drive_by"), s.topEntity(EntityKind.LENGTH_PACING).orElseThrow());
    }

    @Test
    void testListenersSeeSelectionsAndCannotBreakRecording() {
        List<String> seen = new ArrayList<>();
        ledger.addListener((c, key, source, at) -> seen.add(source + " " + key));
        ledger.addListener((c, key, source, at) -> {
            throw new IllegalStateException("boom");
        });

        try (LogCapture logs = LogCapture.attach(UsageLedger.class)) {
            assertDoesNotThrow(() -> ledger.recordSelection(a, SelectionSource.PERSONA));
            assertEquals(1, logs.warnCount());
        }
        assertEquals(List.of("persona " + a.key()), seen);
        assertEquals(1, ledger.getCombinationUsage(a));
    }
}
