package org.calista.replycraft.favorites;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;
import org.calista.replycraft.store.KeyValueStore;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * FavoritesStore — starred entity ids per kind.
 *
 * <p>
 * Persisted under {@value #KEY} as {@code {"personality":[ids],...}}. Every toggle is written
 * immediately and the caller does not wait for it. A malformed document is reset to empty with one warning.
 * </p>
 */
public final class FavoritesStore {
    private static final Logger log = LogManager.getLogger(FavoritesStore.class);

    public static final String KEY = "favorites";

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final EnumMap<EntityKind, TreeSet<String>> favorites = new EnumMap<>(EntityKind.class);

    public FavoritesStore(KeyValueStore store, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        for (EntityKind k : EntityKind.values()) favorites.put(k, new TreeSet<>());
    }

    public void load() {
        String json;
        try {
            json = store.get(List.of(KEY)).join().get(KEY);
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Favorites read failed, starting empty: {}", cause.toString());
            synchronized (this) {
                clear();
            }
            return;
        }

        synchronized (this) {
            clear();
            if (json == null) return;
            try {
                read(json);
            } catch (IllegalArgumentException | JsonProcessingException e) {
                clear();
                log.warn("Persisted {} is malformed, resetting to empty: {}", KEY, e.getMessage());
                return;
            }
            log.info("Favorites loaded: {}", count());
        }
    }

    public synchronized boolean isFavorite(EntityRef ref) {
        Objects.requireNonNull(ref, "ref");
        return favorites.get(ref.kind).contains(ref.id);
    }

    /**
     * Flips the favorite flag and persists.
     *
     * @return the new state
     */
    public boolean toggleFavorite(EntityRef ref) {
        Objects.requireNonNull(ref, "ref");
        boolean now;
        String json;
        synchronized (this) {
            TreeSet<String> set = favorites.get(ref.kind);
            now = set.add(ref.id);
            if (!now) set.remove(ref.id);
            json = serialize();
        }
        persist(json);
        return now;
    }

    public synchronized Set<String> favoritesOf(EntityKind kind) {
        Objects.requireNonNull(kind, "kind");
        return Collections.unmodifiableSortedSet(new TreeSet<>(favorites.get(kind)));
    }

    public synchronized int count() {
        int n = 0;
        for (TreeSet<String> s : favorites.values()) n += s.size();
        return n;
    }

    private void persist(String json) {
        CompletableFuture<Void> f;
        try {
            f = store.set(Map.of(KEY, json));
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        f.whenComplete((ok, err) -> {
            if (err != null) {
                Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
                log.warn("Favorites write failed: {}", cause.toString());
            }
        });
    }

    private void clear() {
        for (TreeSet<String> s : favorites.values()) s.clear();
    }

    private void read(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) throw new IllegalArgumentException("not an object");
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            var e = it.next();
            EntityKind kind = EntityKind.fromStorageName(e.getKey());
            if (!e.getValue().isArray()) throw new IllegalArgumentException("'" + e.getKey() + "' is not an array");
            for (JsonNode id : e.getValue()) {
                if (!id.isTextual()) throw new IllegalArgumentException("non-string id under '" + e.getKey() + "'");
                EntityRef ref = new EntityRef(kind, id.asText());
                favorites.get(kind).add(ref.id);
            }
        }
    }

    private String serialize() {
        ObjectNode root = mapper.createObjectNode();
        for (EntityKind kind : EntityKind.values()) {
            ArrayNode arr = root.putArray(kind.storageName());
            for (String id : favorites.get(kind)) arr.add(id);
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize favorites", e);
        }
    }
}
