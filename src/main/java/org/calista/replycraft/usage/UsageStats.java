package org.calista.replycraft.usage;

import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate ledger statistics.
 * {@code totalUsage} counts recorded selections; {@code topEntityPerKind} has no entry for a kind never used.
 */
public final class UsageStats {

    public final long totalUsage;
    public final int uniqueCombinations;
    public final Map<EntityKind, EntityRef> topEntityPerKind;

    public UsageStats(long totalUsage, int uniqueCombinations, Map<EntityKind, EntityRef> topEntityPerKind) {
        this.totalUsage = totalUsage;
        this.uniqueCombinations = uniqueCombinations;
        EnumMap<EntityKind, EntityRef> copy = new EnumMap<>(EntityKind.class);
        if (topEntityPerKind != null) copy.putAll(topEntityPerKind);
        this.topEntityPerKind = Collections.unmodifiableMap(copy);
    }

    public Optional<EntityRef> topEntity(EntityKind kind) {
        return Optional.ofNullable(topEntityPerKind.get(kind));
    }

    @Override
    public String toString() {
        return "UsageStats{totalUsage=" + totalUsage + ", uniqueCombinations=" + uniqueCombinations
                + ", top=" + topEntityPerKind.values() + "}";
    }
}
