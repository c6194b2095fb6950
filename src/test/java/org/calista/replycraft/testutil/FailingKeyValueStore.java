package org.calista.replycraft.testutil;

import org.calista.replycraft.store.InMemoryKeyValueStore;
import org.calista.replycraft.store.KeyValueStore;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory store whose reads and writes can be switched to fail. */
public final class FailingKeyValueStore implements KeyValueStore {

    public final InMemoryKeyValueStore delegate = new InMemoryKeyValueStore();

    public volatile boolean failReads;
    public volatile boolean failWrites;
    public final AtomicInteger writeAttempts = new AtomicInteger();

    @Override
    public CompletableFuture<Map<String, String>> get(Collection<String> keys) {
        if (failReads) return CompletableFuture.failedFuture(new IOException("read refused"));
        return delegate.get(keys);
    }

    @Override
    public CompletableFuture<Void> set(Map<String, String> entries) {
        writeAttempts.incrementAndGet();
        if (failWrites) return CompletableFuture.failedFuture(new IOException("disk full"));
        return delegate.set(entries);
    }
}
