package org.calista.replycraft.model;

import java.util.Objects;

/**
 * One-click recommendation: a candidate, how sure the engine is, and why.
 */
public final class SmartDefault {
    public final Candidate candidate;
    /** 0..1 */
    public final double confidence;
    public final String reason;

    public SmartDefault(Candidate candidate, double confidence, String reason) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
        this.confidence = confidence;
        this.reason = reason == null ? "" : reason;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof SmartDefault d)) return false;
        return Double.compare(confidence, d.confidence) == 0
                && candidate.equals(d.candidate)
                && reason.equals(d.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, confidence, reason);
    }

    @Override
    public String toString() {
        return "SmartDefault{" + candidate + ", confidence=" + confidence + ", reason='" + reason + "'}";
    }
}
