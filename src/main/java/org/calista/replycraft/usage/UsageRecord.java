package org.calista.replycraft.usage;

import java.util.Objects;

/**
 * Usage counter of one entity or one combination.
 * Immutable; {@link #touch(long)} yields the next record.
 */
public final class UsageRecord {

    public static final UsageRecord NONE = new UsageRecord(0, 0L);

    public final int count;
    /** epoch ms, 0 when never used */
    public final long lastUsedAt;

    public UsageRecord(int count, long lastUsedAt) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);
        if (lastUsedAt < 0) throw new IllegalArgumentException("lastUsedAt must be >= 0: " + lastUsedAt);
        this.count = count;
        this.lastUsedAt = lastUsedAt;
    }

    UsageRecord touch(long nowEpochMs) {
        int next = count == Integer.MAX_VALUE ? count : count + 1;
        return new UsageRecord(next, Math.max(lastUsedAt, nowEpochMs));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof UsageRecord)) return false;
        UsageRecord o = (UsageRecord) other;
        return count == o.count && lastUsedAt == o.lastUsedAt;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, lastUsedAt);
    }

    @Override
    public String toString() {
        return "UsageRecord{count=" + count + ", lastUsedAt=" + lastUsedAt + "}";
    }
}
