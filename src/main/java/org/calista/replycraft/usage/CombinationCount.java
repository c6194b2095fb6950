package org.calista.replycraft.usage;

import org.calista.replycraft.model.Candidate;

import java.util.Comparator;
import java.util.Objects;

/** One row of {@link UsageLedger#topCombinations(int)}. */
public final class CombinationCount {

    /** count desc, lastUsedAt desc, key asc */
    public static final Comparator<CombinationCount> ORDER = Comparator
            .comparingInt((CombinationCount c) -> c.count).reversed()
            .thenComparing(Comparator.comparingLong((CombinationCount c) -> c.lastUsedAt).reversed())
            .thenComparing(c -> c.key);

    public final Candidate candidate;
    public final String key;
    public final int count;
    public final long lastUsedAt;

    public CombinationCount(Candidate candidate, String key, int count, long lastUsedAt) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.key = Objects.requireNonNull(key, "key");
        this.count = count;
        this.lastUsedAt = lastUsedAt;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof CombinationCount)) return false;
        CombinationCount o = (CombinationCount) other;
        return count == o.count && lastUsedAt == o.lastUsedAt && key.equals(o.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, count, lastUsedAt);
    }

    @Override
    public String toString() {
        return key + " x" + count;
    }
}
