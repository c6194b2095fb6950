package org.calista.replycraft.score;

import java.util.Objects;

/**
 * Blend weights of the five sub-scores.
 *
 * <p>
 * Any non-negative values are accepted; {@link #normalized()} rescales them to sum 1.
 * At least one weight must be positive.
 * </p>
 */
public final class ScoreWeights {

    public static final double DEFAULT_CONTEXT = 0.30;
    public static final double DEFAULT_USAGE = 0.25;
    public static final double DEFAULT_PREFERENCE = 0.20;
    public static final double DEFAULT_TIME = 0.10;
    public static final double DEFAULT_CONFIDENCE = 0.15;

    public final double context;
    public final double usage;
    public final double preference;
    public final double time;
    public final double confidence;

    public ScoreWeights(double context, double usage, double preference, double time, double confidence) {
        this.context = check("context", context);
        this.usage = check("usage", usage);
        this.preference = check("preference", preference);
        this.time = check("time", time);
        this.confidence = check("confidence", confidence);
        if (sum() <= 0.0) throw new IllegalArgumentException("At least one score weight must be positive");
    }

    public static ScoreWeights defaults() {
        return new ScoreWeights(DEFAULT_CONTEXT, DEFAULT_USAGE, DEFAULT_PREFERENCE, DEFAULT_TIME, DEFAULT_CONFIDENCE);
    }

    public double sum() {
        return context + usage + preference + time + confidence;
    }

    public ScoreWeights normalized() {
        double s = sum();
        if (Math.abs(s - 1.0) < 1e-12) return this;
        return new ScoreWeights(context / s, usage / s, preference / s, time / s, confidence / s);
    }

    private static double check(String name, double v) {
        if (!Double.isFinite(v) || v < 0.0) {
            throw new IllegalArgumentException("Weight '" + name + "' must be a finite non-negative number: " + v);
        }
        return v;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ScoreWeights)) return false;
        ScoreWeights o = (ScoreWeights) other;
        return Double.compare(context, o.context) == 0
                && Double.compare(usage, o.usage) == 0
                && Double.compare(preference, o.preference) == 0
                && Double.compare(time, o.time) == 0
                && Double.compare(confidence, o.confidence) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(context, usage, preference, time, confidence);
    }

    @Override
    public String toString() {
        return "ScoreWeights{context=" + context + ", usage=" + usage + ", preference=" + preference
                + ", time=" + time + ", confidence=" + confidence + "}";
    }
}
