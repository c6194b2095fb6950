package org.calista.replycraft.combos;

import org.calista.replycraft.model.Candidate;

import java.util.Objects;

/**
 * A user-named full combination.
 * {@link #candidate} carries {@link #name} as its label.
 */
public final class CustomCombo {
    public final String id;
    public final String name;
    public final Candidate candidate;
    public final long createdAt;
    public final int usageCount;
    /** Epoch ms, 0 if never used. */
    public final long lastUsed;

    CustomCombo(String id, String name, Candidate candidate, long createdAt, int usageCount, long lastUsed) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.candidate = Objects.requireNonNull(candidate, "candidate").withLabel(name);
        this.createdAt = createdAt;
        this.usageCount = usageCount;
        this.lastUsed = lastUsed;
    }

    CustomCombo used(long now) {
        return new CustomCombo(id, name, candidate, createdAt, usageCount + 1, now);
    }

    CustomCombo renamed(String newName, Candidate newCandidate) {
        return new CustomCombo(id, newName, newCandidate, createdAt, usageCount, lastUsed);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof CustomCombo c)) return false;
        return id.equals(c.id) && name.equals(c.name) && candidate.equals(c.candidate)
                && createdAt == c.createdAt && usageCount == c.usageCount && lastUsed == c.lastUsed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, candidate, createdAt, usageCount, lastUsed);
    }

    @Override
    public String toString() {
        return "CustomCombo{" + id + " '" + name + "' " + candidate.key() + ", used=" + usageCount + '}';
    }
}
