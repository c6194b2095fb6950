package org.calista.replycraft.score.impl;

import org.calista.replycraft.catalog.StyleCatalog;
import org.calista.replycraft.catalog.StyleEntity;
import org.calista.replycraft.favorites.FavoritesStore;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityRef;
import org.calista.replycraft.model.ReplyContext;
import org.calista.replycraft.model.ScoreBreakdown;
import org.calista.replycraft.score.*;
import org.calista.replycraft.usage.UsageLedger;

import java.util.*;

/**
 * DefaultFeatureScorer — five-signal blend.
 *
 * <ul>
 *   <li>contextMatch: tags of the candidate's entities vs {@link ContextFeatures}; 0.5 when nothing matches</li>
 *   <li>usageScore: {@code min(combinationCount / usageSaturation, 1)}</li>
 *   <li>preferenceScore: 1 all entities favorite, 0.5 some, 0 none</li>
 *   <li>timeScore: mean {@link TimeRegisterPolicy} fit of the entities' registers</li>
 *   <li>confidence: {@code textFactor * (0.3 + 0.7 * min(uses, M) / M)}</li>
 * </ul>
 *
 * <p>
 * total = {@code round(clamp(1 + 9 * sum(w_i * s_i), 1, 10))}. A reason is given for every sub-score
 * that rises more than {@code reasonEpsilon} above its neutral baseline; reasons are ordered by
 * weighted lift, largest first.
 * </p>
 */
public final class DefaultFeatureScorer implements FeatureScorer {

    static final double BASE_CONTEXT = 0.5;
    static final double BASE_USAGE = 0.0;
    static final double BASE_PREFERENCE = 0.0;
    static final double BASE_TIME = 0.5;
    static final double BASE_CONFIDENCE = 0.5;

    static final double BLANK_TEXT_FACTOR = 0.5;
    static final double HISTORY_FLOOR = 0.3;

    private final StyleCatalog catalog;
    private final UsageLedger ledger;
    private final FavoritesStore favorites;
    private final ScoringConfig config;
    private final KeywordTaxonomy taxonomy;
    private final TimeRegisterPolicy timePolicy;

    // last context -> features; ranking scores thousands of candidates against one context
    private volatile Prepared prepared;

    public DefaultFeatureScorer(StyleCatalog catalog, UsageLedger ledger, FavoritesStore favorites, ScoringConfig config) {
        this(catalog, ledger, favorites, config, KeywordTaxonomy.defaults(), TimeRegisterPolicy.defaults());
    }

    public DefaultFeatureScorer(StyleCatalog catalog,
                                UsageLedger ledger,
                                FavoritesStore favorites,
                                ScoringConfig config,
                                KeywordTaxonomy taxonomy,
                                TimeRegisterPolicy timePolicy) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.favorites = Objects.requireNonNull(favorites, "favorites");
        this.config = Objects.requireNonNull(config, "config");
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
        this.timePolicy = Objects.requireNonNull(timePolicy, "timePolicy");
    }

    @Override
    public ScoreBreakdown score(Candidate candidate, ReplyContext context) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(context, "context");

        List<EntityRef> refs = candidate.entities();
        List<StyleEntity> ents = new ArrayList<>(refs.size());
        for (EntityRef r : refs) {
            ents.add(catalog.entity(r).orElseThrow(() -> new ScoringException("Unknown catalog entity: " + r)));
        }

        ContextFeatures features = featuresOf(context);
        Set<String> carried = new HashSet<>();
        for (StyleEntity e : ents) carried.addAll(e.tags);

        int uses = ledger.getCombinationUsage(candidate);

        double contextMatch = features.matchScore(carried);
        double usageScore = Math.min((double) uses / config.usageSaturation, 1.0);
        double preferenceScore = preference(refs);
        double timeScore = time(ents, context.timeOfDay);
        double confidence = confidence(context, uses);

        ScoreWeights w = config.weights;
        double weighted = w.context * contextMatch
                + w.usage * usageScore
                + w.preference * preferenceScore
                + w.time * timeScore
                + w.confidence * confidence;

        double raw = 1.0 + 9.0 * weighted;
        int total = (int) Math.round(clamp(raw, ScoreBreakdown.MIN_TOTAL, ScoreBreakdown.MAX_TOTAL));

        List<String> reasons = reasons(features, carried, uses, preferenceScore,
                contextMatch, usageScore, timeScore, confidence);

        return new ScoreBreakdown(contextMatch, usageScore, preferenceScore, timeScore, clamp01(confidence), reasons, total);
    }

    // -------------------- sub-scores --------------------

    private double preference(List<EntityRef> refs) {
        if (refs.isEmpty()) return 0.0;
        int fav = 0;
        for (EntityRef r : refs) {
            if (favorites.isFavorite(r)) fav++;
        }
        if (fav == 0) return 0.0;
        return fav == refs.size() ? 1.0 : 0.5;
    }

    private double time(List<StyleEntity> ents, int hour) {
        if (ents.isEmpty()) return BASE_TIME;
        double s = 0.0;
        for (StyleEntity e : ents) s += timePolicy.score(e.register, hour);
        return clamp01(s / ents.size());
    }

    private double confidence(ReplyContext ctx, int uses) {
        double textFactor = ctx.hasText() ? 1.0 : BLANK_TEXT_FACTOR;
        int m = config.minHistoryUses;
        double historyFactor = HISTORY_FLOOR + (1.0 - HISTORY_FLOOR) * Math.min(uses, m) / (double) m;
        return textFactor * historyFactor;
    }

    // -------------------- reasons --------------------

    private List<String> reasons(ContextFeatures features,
                                 Set<String> carried,
                                 int uses,
                                 double preferenceScore,
                                 double contextMatch,
                                 double usageScore,
                                 double timeScore,
                                 double confidence) {
        if (config.maxReasons == 0) return List.of();
        ScoreWeights w = config.weights;
        List<Lift> lifts = new ArrayList<>(5);

        addLift(lifts, contextMatch - BASE_CONTEXT, w.context, 0,
                "fits this post: " + String.join(", ", features.matched(carried)));
        addLift(lifts, usageScore - BASE_USAGE, w.usage, 1,
                "used " + uses + (uses == 1 ? " time" : " times") + " before");
        addLift(lifts, preferenceScore - BASE_PREFERENCE, w.preference, 2,
                preferenceScore >= 1.0 ? "all favorites" : "includes a favorite");
        addLift(lifts, timeScore - BASE_TIME, w.time, 3, "suits the time of day");
        addLift(lifts, confidence - BASE_CONFIDENCE, w.confidence, 4, "well-established choice");

        lifts.sort(Comparator.comparingDouble((Lift l) -> l.weighted).reversed().thenComparingInt(l -> l.order));

        List<String> out = new ArrayList<>(Math.min(lifts.size(), config.maxReasons));
        for (Lift l : lifts) {
            if (out.size() >= config.maxReasons) break;
            out.add(l.text);
        }
        return out;
    }

    // the gate is the sub-score's own lift; the weight only orders what passed
    private void addLift(List<Lift> lifts, double lift, double weight, int order, String text) {
        if (lift > config.reasonEpsilon) lifts.add(new Lift(weight * lift, order, text));
    }

    private static final class Lift {
        final double weighted;
        final int order;
        final String text;

        Lift(double weighted, int order, String text) {
            this.weighted = weighted;
            this.order = order;
            this.text = text;
        }
    }

    // -------------------- utils --------------------

    private ContextFeatures featuresOf(ReplyContext ctx) {
        Prepared p = prepared;
        if (p != null && p.context.equals(ctx)) return p.features;
        ContextFeatures f = ContextFeatures.extract(ctx, taxonomy);
        prepared = new Prepared(ctx, f);
        return f;
    }

    private static final class Prepared {
        final ReplyContext context;
        final ContextFeatures features;

        Prepared(ReplyContext context, ContextFeatures features) {
            this.context = context;
            this.features = features;
        }
    }

    private static double clamp(double v, double lo, double hi) {
        if (Double.isNaN(v)) return lo;
        return Math.max(lo, Math.min(hi, v));
    }

    private static double clamp01(double v) {
        return clamp(v, 0.0, 1.0);
    }
}
