package org.calista.replycraft.model;

import java.util.Objects;

public final class Suggestion {
    public final Candidate candidate;
    public final ScoreBreakdown breakdown;

    public Suggestion(Candidate candidate, ScoreBreakdown breakdown) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.breakdown = Objects.requireNonNull(breakdown, "breakdown");
    }

    public String key() {
        return candidate.key();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Suggestion s)) return false;
        return candidate.equals(s.candidate) && breakdown.equals(s.breakdown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, breakdown);
    }

    @Override
    public String toString() {
        return "Suggestion{" + candidate + ", total=" + breakdown.total + ", reasons=" + breakdown.reasons + '}';
    }
}
