package org.calista.replycraft.store;

import org.calista.replycraft.io.FileIO;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class FileKeyValueStoreTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private FileKeyValueStore store;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        store = new FileKeyValueStore(new FileIO(tempDir), "store", executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testSetThenGet() throws Exception {
        store.set(Map.of("favorites", "{\"personality\":[\"friendly\"]}")).join();

        Map<String, String> got = store.get(List.of("favorites", "usage_ledger")).join();
        assertEquals(Map.of("favorites", "{\"personality\":[\"friendly\"]}"), got);
        assertTrue(Files.exists(tempDir.resolve("store").resolve("favorites.json")));
    }

    @Test
    void testOverwriteKeepsLatest() {
        store.set(Map.of("k", "1")).join();
        store.set(Map.of("k", "2")).join();
        assertEquals("2", store.get(List.of("k")).join().get("k"));
    }

    @Test
    void testIllegalKeyCompletesExceptionally() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> store.set(Map.of("../escape", "{}")).join());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
