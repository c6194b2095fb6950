package org.calista.replycraft.rank;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.catalog.StyleCatalog;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.ReplyContext;
import org.calista.replycraft.model.ScoreBreakdown;
import org.calista.replycraft.model.Suggestion;
import org.calista.replycraft.score.FeatureScorer;

import java.util.*;

/**
 * SuggestionRanker — score, sort, truncate, backfill.
 *
 * <p>
 * Order: total desc, usageScore desc, combination key asc. A candidate whose scoring throws is
 * dropped (one WARN each) and the batch continues. When fewer than {@code limit} candidates were
 * scored, the list is topped up from {@link StyleCatalog#allCandidates()} in catalog order with
 * {@link ScoreBreakdown#unscored()} entries.
 * </p>
 */
public final class SuggestionRanker {
    private static final Logger log = LogManager.getLogger(SuggestionRanker.class);

    public static final Comparator<Suggestion> ORDER = Comparator
            .comparingInt((Suggestion s) -> s.breakdown.total).reversed()
            .thenComparing(Comparator.comparingDouble((Suggestion s) -> s.breakdown.usageScore).reversed())
            .thenComparing(Suggestion::key);

    private final FeatureScorer scorer;
    private final StyleCatalog catalog;

    public SuggestionRanker(FeatureScorer scorer, StyleCatalog catalog) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public List<Suggestion> rank(Collection<Candidate> candidates, ReplyContext context, int limit) {
        Objects.requireNonNull(context, "context");
        if (limit <= 0) return List.of();

        Collection<Candidate> in = candidates == null ? List.of() : candidates;
        ArrayList<Suggestion> scored = new ArrayList<>(in.size());
        Set<String> seen = new HashSet<>();
        Set<String> excluded = new HashSet<>();
        int failures = 0;

        for (Candidate c : in) {
            if (c == null) continue;
            String key = c.key();
            if (!seen.add(key)) continue;
            try {
                scored.add(new Suggestion(c, scorer.score(c, context)));
            } catch (RuntimeException e) {
                excluded.add(key);
                failures++;
                log.warn("Candidate {} excluded from ranking: {}", key, e.toString());
            }
        }

        scored.sort(ORDER);
        List<Suggestion> out = new ArrayList<>(Math.min(limit, scored.size()));
        for (int i = 0; i < scored.size() && out.size() < limit; i++) out.add(scored.get(i));

        int backfilled = 0;
        if (out.size() < limit) {
            for (Candidate c : catalog.allCandidates()) {
                if (out.size() >= limit) break;
                String key = c.key();
                if (seen.contains(key) || excluded.contains(key)) continue;
                seen.add(key);
                out.add(new Suggestion(c, ScoreBreakdown.unscored()));
                backfilled++;
            }
        }

        log.debug("Ranked {} candidates: returned={}, failures={}, backfilled={}", in.size(), out.size(), failures, backfilled);
        return List.copyOf(out);
    }
}
