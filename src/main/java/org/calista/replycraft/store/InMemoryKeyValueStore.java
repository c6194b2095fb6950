package org.calista.replycraft.store;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Completes every call synchronously.
 * Used when no persistence is configured and as the substitutable fake in tests.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> data = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore() {
    }

    public InMemoryKeyValueStore(Map<String, String> initial) {
        if (initial != null) {
            for (var e : initial.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) data.put(e.getKey(), e.getValue());
            }
        }
    }

    @Override
    public CompletableFuture<Map<String, String>> get(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) return CompletableFuture.completedFuture(Map.of());
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        for (String k : keys) {
            if (k == null) continue;
            String v = data.get(k);
            if (v != null) out.put(k, v);
        }
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public CompletableFuture<Void> set(Map<String, String> entries) {
        if (entries != null) {
            for (var e : entries.entrySet()) {
                if (e.getKey() == null) continue;
                if (e.getValue() == null) data.remove(e.getKey());
                else data.put(e.getKey(), e.getValue());
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    /** Raw stored value, for inspection. */
    public Optional<String> raw(String key) {
        return Optional.ofNullable(data.get(key));
    }

    public int size() {
        return data.size();
    }
}
