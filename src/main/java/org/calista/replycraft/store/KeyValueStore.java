package org.calista.replycraft.store;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Persistent key-value store collaborator.
 *
 * <p>
 * Values are opaque JSON text. This is the only asynchronous boundary of the engine:
 * callers never block on {@link #set(Map)}; a failed write completes exceptionally.
 * </p>
 */
public interface KeyValueStore {

    /**
     * Reads the given keys. Absent keys are omitted from the result map.
     */
    CompletableFuture<Map<String, String>> get(Collection<String> keys);

    /**
     * Writes all entries. Completes exceptionally on failure.
     */
    CompletableFuture<Void> set(Map<String, String> entries);
}
