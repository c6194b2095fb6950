package org.calista.replycraft.score;

import org.calista.replycraft.model.ReplyContext;

import java.util.*;

/**
 * Situational feature vector of a {@link ReplyContext}: weighted tags a style entity can carry.
 *
 * <p>
 * Derived purely from the context. contextMatch of a candidate is
 * {@code 0.5 + 0.5 * matchedWeight / totalWeight}.
 * </p>
 */
public final class ContextFeatures {

    public static final String TAG_REPLIES = "good-for-replies";
    public static final String TAG_ORIGINALS = "good-for-originals";
    public static final String TAG_LONG_THREADS = "good-for-long-threads";

    static final double SITUATION_WEIGHT = 1.0;
    static final int LONG_THREAD = 2;

    private final Map<String, Double> weights;
    private final double totalWeight;

    private ContextFeatures(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        double s = 0.0;
        for (double w : weights.values()) s += w;
        this.totalWeight = s;
    }

    public static ContextFeatures extract(ReplyContext ctx, KeywordTaxonomy taxonomy) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(taxonomy, "taxonomy");

        LinkedHashMap<String, Double> w = new LinkedHashMap<>();
        w.put(ctx.isReply ? TAG_REPLIES : TAG_ORIGINALS, SITUATION_WEIGHT);
        if (ctx.threadLength() > LONG_THREAD) w.put(TAG_LONG_THREADS, SITUATION_WEIGHT);
        for (var e : taxonomy.match(ctx.tweetText).entrySet()) w.merge(e.getKey(), e.getValue(), Math::max);
        return new ContextFeatures(w);
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public double totalWeight() {
        return totalWeight;
    }

    /**
     * @param carried tags carried by any entity of the candidate
     */
    public double matchScore(Set<String> carried) {
        if (totalWeight <= 0.0 || carried == null || carried.isEmpty()) return 0.5;
        double matched = 0.0;
        for (var e : weights.entrySet()) {
            if (carried.contains(e.getKey())) matched += e.getValue();
        }
        return 0.5 + 0.5 * (matched / totalWeight);
    }

    /** Feature tags present in {@code carried}, in feature order. */
    public List<String> matched(Set<String> carried) {
        if (carried == null || carried.isEmpty()) return List.of();
        ArrayList<String> out = new ArrayList<>();
        for (String tag : weights.keySet()) {
            if (carried.contains(tag)) out.add(tag);
        }
        return out;
    }

    @Override
    public String toString() {
        return "ContextFeatures" + weights;
    }
}
