package org.calista.replycraft.score;

/**
 * Scoring knobs. Data only; the default scorer reads nothing else.
 */
public final class ScoringConfig {

    public final ScoreWeights weights;

    /** Combination uses at which usageScore saturates at 1. */
    public final int usageSaturation;

    /** Uses after which history no longer lowers confidence. */
    public final int minHistoryUses;

    /** Minimum weighted lift for a sub-score to be explained. */
    public final double reasonEpsilon;

    /** Cap on explanation strings per breakdown. */
    public final int maxReasons;

    public ScoringConfig(ScoreWeights weights, int usageSaturation, int minHistoryUses, double reasonEpsilon, int maxReasons) {
        if (weights == null) throw new IllegalArgumentException("weights is null");
        if (usageSaturation < 1) throw new IllegalArgumentException("usageSaturation must be >= 1: " + usageSaturation);
        if (minHistoryUses < 1) throw new IllegalArgumentException("minHistoryUses must be >= 1: " + minHistoryUses);
        if (!Double.isFinite(reasonEpsilon) || reasonEpsilon < 0.0) {
            throw new IllegalArgumentException("reasonEpsilon must be >= 0: " + reasonEpsilon);
        }
        if (maxReasons < 0 || maxReasons > 5) throw new IllegalArgumentException("maxReasons must be in [0,5]: " + maxReasons);
        this.weights = weights.normalized();
        this.usageSaturation = usageSaturation;
        this.minHistoryUses = minHistoryUses;
        this.reasonEpsilon = reasonEpsilon;
        this.maxReasons = maxReasons;
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(ScoreWeights.defaults(), 10, 3, 0.05, 5);
    }

    public ScoringConfig withWeights(ScoreWeights w) {
        return new ScoringConfig(w, usageSaturation, minHistoryUses, reasonEpsilon, maxReasons);
    }
}
