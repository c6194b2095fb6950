package org.calista.replycraft.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * WriteBehind — debounced fire-and-forget persistence of an in-memory namespace.
 *
 * <p>
 * {@link #markDirty()} returns immediately and schedules one flush after {@code delayMs};
 * further changes inside the window ride on the same flush. Every flush writes the full
 * snapshot. A failed write stays dirty and is retried with the next change; a second
 * consecutive failure drops it.
 * </p>
 */
public final class WriteBehind {
    private static final Logger log = LogManager.getLogger(WriteBehind.class);

    private final String name;
    private final KeyValueStore store;
    private final Supplier<Map<String, String>> snapshot;
    private final ScheduledExecutorService scheduler;
    private final long delayMs;

    private final Object lock = new Object();
    private ScheduledFuture<?> pending;
    private boolean dirty;
    private int consecutiveFailures;

    public WriteBehind(String name,
                       KeyValueStore store,
                       Supplier<Map<String, String>> snapshot,
                       ScheduledExecutorService scheduler,
                       long delayMs) {
        this.name = (name == null || name.isBlank()) ? "namespace" : name;
        this.store = Objects.requireNonNull(store, "store");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delayMs = Math.max(0L, delayMs);
    }

    public void markDirty() {
        synchronized (lock) {
            dirty = true;
            if (pending != null && !pending.isDone()) return;
            try {
                pending = scheduler.schedule(this::flushScheduled, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // scheduler already shut down: the final flush on close carries the change
                log.debug("{}: flush not scheduled, scheduler is shut down", name);
                pending = null;
            }
        }
    }

    public boolean isDirty() {
        synchronized (lock) {
            return dirty;
        }
    }

    /**
     * Flushes now if dirty. The returned future completes with {@code true} when the
     * store accepted the write (or nothing was pending) and never completes exceptionally.
     */
    public CompletableFuture<Boolean> flush() {
        synchronized (lock) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            if (!dirty) return CompletableFuture.completedFuture(Boolean.TRUE);
            dirty = false;
        }

        CompletableFuture<Void> write;
        try {
            write = store.set(snapshot.get());
        } catch (RuntimeException e) {
            write = CompletableFuture.failedFuture(e);
        }

        return write.handle((ok, err) -> {
            if (err == null) {
                onSuccess();
                return Boolean.TRUE;
            }
            onFailure(err);
            return Boolean.FALSE;
        });
    }

    private void flushScheduled() {
        synchronized (lock) {
            pending = null;
        }
        flush();
    }

    private void onSuccess() {
        synchronized (lock) {
            consecutiveFailures = 0;
        }
        log.debug("{}: flushed", name);
    }

    private void onFailure(Throwable err) {
        Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
        synchronized (lock) {
            consecutiveFailures++;
            if (consecutiveFailures == 1) {
                dirty = true;
                log.warn("{}: persistence write failed, will retry with next change: {}", name, cause.toString());
            } else {
                consecutiveFailures = 0;
                log.warn("{}: persistence write failed again, dropping pending write: {}", name, cause.toString());
            }
        }
    }
}
