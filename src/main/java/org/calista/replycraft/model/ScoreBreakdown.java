package org.calista.replycraft.model;

import java.util.List;
import java.util.Objects;

/**
 * Explainable score of one candidate.
 *
 * <p>
 * Sub-scores are in [0,1]; {@link #total} is the aggregate on a 1..10 integer scale.
 * {@link #scored} is false for backfilled entries that were never scored.
 * </p>
 */
public final class ScoreBreakdown {

    public static final int MIN_TOTAL = 1;
    public static final int MAX_TOTAL = 10;
    public static final String NO_USAGE_DATA = "no usage data";

    public final double contextMatch;
    public final double usageScore;
    public final double preferenceScore;
    public final double timeScore;
    public final double confidence;

    /** Ordered by contribution, at most five entries. */
    public final List<String> reasons;

    public final int total;
    public final boolean scored;

    public ScoreBreakdown(double contextMatch,
                          double usageScore,
                          double preferenceScore,
                          double timeScore,
                          double confidence,
                          List<String> reasons,
                          int total) {
        this(contextMatch, usageScore, preferenceScore, timeScore, confidence, reasons, total, true);
    }

    private ScoreBreakdown(double contextMatch,
                           double usageScore,
                           double preferenceScore,
                           double timeScore,
                           double confidence,
                           List<String> reasons,
                           int total,
                           boolean scored) {
        this.contextMatch = unit(contextMatch, "contextMatch");
        this.usageScore = unit(usageScore, "usageScore");
        this.preferenceScore = unit(preferenceScore, "preferenceScore");
        this.timeScore = unit(timeScore, "timeScore");
        this.confidence = unit(confidence, "confidence");
        this.reasons = reasons == null ? List.of() : List.copyOf(reasons);
        if (total < MIN_TOTAL || total > MAX_TOTAL) {
            throw new IllegalArgumentException("total must be in [1,10]: " + total);
        }
        this.total = total;
        this.scored = scored;
    }

    /** Placeholder for a backfilled candidate: nothing scored, lowest total. */
    public static ScoreBreakdown unscored() {
        return new ScoreBreakdown(0.0, 0.0, 0.0, 0.0, 0.0, List.of(NO_USAGE_DATA), MIN_TOTAL, false);
    }

    private static double unit(double v, String name) {
        if (!Double.isFinite(v) || v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0,1]: " + v);
        }
        return v;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ScoreBreakdown b)) return false;
        return Double.compare(contextMatch, b.contextMatch) == 0
                && Double.compare(usageScore, b.usageScore) == 0
                && Double.compare(preferenceScore, b.preferenceScore) == 0
                && Double.compare(timeScore, b.timeScore) == 0
                && Double.compare(confidence, b.confidence) == 0
                && total == b.total
                && scored == b.scored
                && reasons.equals(b.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contextMatch, usageScore, preferenceScore, timeScore, confidence, reasons, total, scored);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT,
                "ScoreBreakdown{total=%d, ctx=%.3f, usage=%.3f, pref=%.3f, time=%.3f, conf=%.3f, reasons=%s}",
                total, contextMatch, usageScore, preferenceScore, timeScore, confidence, reasons);
    }
}
