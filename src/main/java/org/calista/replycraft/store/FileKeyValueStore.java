package org.calista.replycraft.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * FileKeyValueStore — one {@code <key>.json} file per key under a directory inside baseDir.
 *
 * <p>
 * Writes go through {@link FileIO#writeString} (atomic temp-file commit) on the given executor,
 * so the caller never waits on disk. A single-thread executor keeps writes in submission order.
 * </p>
 */
public final class FileKeyValueStore implements KeyValueStore {
    private static final Logger log = LogManager.getLogger(FileKeyValueStore.class);

    private static final Pattern KEY = Pattern.compile("[A-Za-z0-9_.-]+");

    private final FileIO io;
    private final String dir;
    private final Executor executor;

    public FileKeyValueStore(FileIO io, String dir, Executor executor) {
        this.io = Objects.requireNonNull(io, "io");
        this.dir = (dir == null || dir.isBlank()) ? "store" : dir.trim();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Map<String, String>> get(Collection<String> keys) {
        List<String> ks = keys == null ? List.of() : List.copyOf(keys);
        return CompletableFuture.supplyAsync(() -> {
            LinkedHashMap<String, String> out = new LinkedHashMap<>();
            for (String k : ks) {
                try {
                    Optional<String> v = io.readStringIfExists(fileOf(k));
                    v.ifPresent(s -> out.put(k, s));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read key " + k, e);
                }
            }
            log.debug("Store read: dir={}, requested={}, found={}", dir, ks.size(), out.size());
            return out;
        }, executor);
    }

    @Override
    public CompletableFuture<Void> set(Map<String, String> entries) {
        Map<String, String> copy = entries == null ? Map.of() : new LinkedHashMap<>(entries);
        return CompletableFuture.runAsync(() -> {
            for (var e : copy.entrySet()) {
                Path f = fileOf(e.getKey());
                try {
                    if (e.getValue() == null) io.deleteIfExists(f);
                    else io.writeString(f, e.getValue());
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to write key " + e.getKey(), ex);
                }
            }
            log.debug("Store write: dir={}, keys={}", dir, copy.keySet());
        }, executor);
    }

    Path fileOf(String key) {
        if (key == null || !KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Illegal store key: " + key);
        }
        return io.resolve(dir + "/" + key + ".json");
    }
}
