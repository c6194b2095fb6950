package org.calista.replycraft.defaults;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.catalog.StyleCatalog;
import org.calista.replycraft.catalog.StyleEntity;
import org.calista.replycraft.model.*;
import org.calista.replycraft.rank.SuggestionRanker;
import org.calista.replycraft.usage.SelectionSource;
import org.calista.replycraft.usage.UsageLedger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * SmartDefaultsResolver — the single "best guess" combination.
 *
 * <p>
 * With history: the top of the full catalog ranking. Without: one random entity per kind,
 * drawn once per ledger revision so repeated calls agree until the next recorded selection.
 * When history exists but nothing could be ranked, the same random draw is returned with
 * {@link #UNRANKED_REASON} and a warning is logged.
 * Resolving never writes; {@link #confirm(SmartDefault)} does.
 * </p>
 */
public final class SmartDefaultsResolver {
    private static final Logger log = LogManager.getLogger(SmartDefaultsResolver.class);

    public static final String COLD_START_REASON = "randomized — no history yet";
    public static final String FALLBACK_REASON = "top match for your history";
    public static final String UNRANKED_REASON = "randomized — no combination could be ranked";

    public static final double DEFAULT_COLD_START_CONFIDENCE = 0.1;
    public static final Duration DEFAULT_LAST_SELECTION_MAX_AGE = Duration.ofHours(24);
    public static final int DEFAULT_QUICK_OPTIONS_TOP = 3;

    private final StyleCatalog catalog;
    private final UsageLedger ledger;
    private final SuggestionRanker ranker;
    private final RandomSource random;
    private final double coldStartConfidence;
    private final Duration lastSelectionMaxAge;
    private final int quickOptionsTop;

    private long drawRevision = -1L;
    private Candidate draw;

    public SmartDefaultsResolver(StyleCatalog catalog, UsageLedger ledger, SuggestionRanker ranker, RandomSource random) {
        this(catalog, ledger, ranker, random, DEFAULT_COLD_START_CONFIDENCE, DEFAULT_LAST_SELECTION_MAX_AGE, DEFAULT_QUICK_OPTIONS_TOP);
    }

    public SmartDefaultsResolver(StyleCatalog catalog,
                                 UsageLedger ledger,
                                 SuggestionRanker ranker,
                                 RandomSource random,
                                 double coldStartConfidence,
                                 Duration lastSelectionMaxAge,
                                 int quickOptionsTop) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.random = Objects.requireNonNull(random, "random");
        if (!(coldStartConfidence >= 0.0 && coldStartConfidence <= 1.0)) {
            throw new IllegalArgumentException("coldStartConfidence must be in [0,1]: " + coldStartConfidence);
        }
        this.coldStartConfidence = coldStartConfidence;
        this.lastSelectionMaxAge = Objects.requireNonNull(lastSelectionMaxAge, "lastSelectionMaxAge");
        this.quickOptionsTop = Math.max(0, quickOptionsTop);
    }

    public SmartDefault resolve(ReplyContext context) {
        Objects.requireNonNull(context, "context");

        if (ledger.hasAnyCombination()) {
            List<Suggestion> top = ranker.rank(catalog.allCandidates(), context, 1);
            if (!top.isEmpty()) {
                Suggestion s = top.get(0);
                List<String> reasons = s.breakdown.reasons;
                String reason = reasons.isEmpty()
                        ? FALLBACK_REASON
                        : String.join("; ", reasons.subList(0, Math.min(2, reasons.size())));
                return new SmartDefault(s.candidate, s.breakdown.confidence, reason);
            }
            log.warn("Usage history present but no candidate could be ranked; falling back to a random pick");
            return new SmartDefault(randomDraw(), coldStartConfidence, UNRANKED_REASON);
        }
        return new SmartDefault(randomDraw(), coldStartConfidence, COLD_START_REASON);
    }

    public void confirm(SmartDefault smartDefault) {
        Objects.requireNonNull(smartDefault, "smartDefault");
        ledger.recordSelection(smartDefault.candidate, SelectionSource.SMART_DEFAULT);
    }

    public QuickOptions quickOptions(ReplyContext context) {
        return new QuickOptions(
                ledger.lastSelection(lastSelectionMaxAge),
                resolve(context),
                ledger.topCombinations(quickOptionsTop));
    }

    private synchronized Candidate randomDraw() {
        long rev = ledger.revision();
        if (draw != null && drawRevision == rev) return draw;

        Candidate.Builder b = Candidate.builder();
        for (EntityKind kind : EntityKind.values()) {
            List<StyleEntity> options = catalog.entities(kind);
            if (options.isEmpty()) continue;
            b.with(random.choice(options).ref);
        }
        draw = b.build();
        drawRevision = rev;
        log.debug("Random default drawn at revision {}: {}", rev, draw.key());
        return draw;
    }
}
