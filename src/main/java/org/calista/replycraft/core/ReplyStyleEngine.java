package org.calista.replycraft.core;

import org.calista.replycraft.catalog.Persona;
import org.calista.replycraft.catalog.StyleCatalog;
import org.calista.replycraft.combos.CustomCombo;
import org.calista.replycraft.combos.CustomCombosStore;
import org.calista.replycraft.defaults.QuickOptions;
import org.calista.replycraft.defaults.SmartDefaultsResolver;
import org.calista.replycraft.favorites.FavoritesStore;
import org.calista.replycraft.model.*;
import org.calista.replycraft.rank.SuggestionRanker;
import org.calista.replycraft.usage.SelectionSource;
import org.calista.replycraft.usage.UsageLedger;
import org.calista.replycraft.usage.UsageStats;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Consumer surface of the engine. Obtained from {@link ReplyCraftKernel#engine()}.
 */
public final class ReplyStyleEngine {

    private final StyleCatalog catalog;
    private final UsageLedger ledger;
    private final FavoritesStore favorites;
    private final CustomCombosStore combos;
    private final SuggestionRanker ranker;
    private final SmartDefaultsResolver resolver;
    private final Clock clock;

    public ReplyStyleEngine(StyleCatalog catalog,
                            UsageLedger ledger,
                            FavoritesStore favorites,
                            CustomCombosStore combos,
                            SuggestionRanker ranker,
                            SmartDefaultsResolver resolver,
                            Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.favorites = Objects.requireNonNull(favorites, "favorites");
        this.combos = Objects.requireNonNull(combos, "combos");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Context stamped with the engine clock's hour and weekday. */
    public ReplyContext context(String tweetText, boolean isReply, List<ReplyContext.ThreadMessage> thread) {
        return ReplyContext.now(tweetText, isReply, thread, clock);
    }

    /** Ranks the whole catalog; combinations saved as custom combos carry the combo name. */
    public List<Suggestion> rank(ReplyContext context, int limit) {
        List<Candidate> all = catalog.allCandidates();
        List<Candidate> saved = comboCandidates();
        if (saved.isEmpty()) return ranker.rank(all, context, limit);
        List<Candidate> in = new ArrayList<>(saved.size() + all.size());
        in.addAll(saved);
        in.addAll(all);
        return ranker.rank(in, context, limit);
    }

    /** Ranks only the saved custom combos. */
    public List<Suggestion> rankCombos(ReplyContext context, int limit) {
        List<Candidate> saved = comboCandidates();
        return ranker.rank(saved, context, Math.min(limit, saved.size()));
    }

    public List<Suggestion> rank(Collection<Candidate> candidates, ReplyContext context, int limit) {
        return ranker.rank(candidates, context, limit);
    }

    public SmartDefault resolve(ReplyContext context) {
        return resolver.resolve(context);
    }

    public void confirm(SmartDefault smartDefault) {
        resolver.confirm(smartDefault);
    }

    public QuickOptions quickOptions(ReplyContext context) {
        return resolver.quickOptions(context);
    }

    public void recordSelection(Candidate candidate, String source) {
        ledger.recordSelection(candidate, source);
    }

    /**
     * Records the persona's combination as a selection.
     *
     * @throws IllegalArgumentException for an unknown persona id
     */
    public Candidate selectPersona(String personaId) {
        Persona p = catalog.persona(personaId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown persona: " + personaId));
        ledger.recordSelection(p.candidate, SelectionSource.PERSONA);
        return p.candidate;
    }

    public boolean toggleFavorite(EntityRef ref) {
        if (!catalog.contains(ref)) throw new IllegalArgumentException("Unknown catalog entity: " + ref);
        return favorites.toggleFavorite(ref);
    }

    /**
     * Saves a named combination of catalog entities.
     *
     * @throws IllegalArgumentException for an entity outside the catalog, a bad or taken name
     */
    public CustomCombo saveCombo(String name, Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        requireInCatalog(candidate);
        return combos.save(name, candidate);
    }

    /**
     * Uses a saved combo: counts it on the combo and records the selection.
     *
     * @param idOrName combo id, or its name ignoring case
     * @throws IllegalArgumentException for an unknown combo
     */
    public Candidate selectCombo(String idOrName) {
        CustomCombo c = findCombo(idOrName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown combo: " + idOrName));
        combos.incrementUsage(c.id);
        ledger.recordSelection(c.candidate, SelectionSource.CUSTOM_COMBO);
        return c.candidate;
    }

    public boolean deleteCombo(String idOrName) {
        return findCombo(idOrName).map(c -> combos.delete(c.id)).orElse(false);
    }

    public UsageStats stats() {
        return ledger.stats();
    }

    public StyleCatalog catalog() { return catalog; }
    public UsageLedger ledger() { return ledger; }
    public FavoritesStore favorites() { return favorites; }
    public CustomCombosStore combos() { return combos; }

    private Optional<CustomCombo> findCombo(String idOrName) {
        Optional<CustomCombo> byId = combos.get(idOrName);
        return byId.isPresent() ? byId : combos.findByName(idOrName);
    }

    // combos whose entities left the catalog are kept in the store but not offered
    private List<Candidate> comboCandidates() {
        List<Candidate> out = new ArrayList<>();
        for (Candidate c : combos.candidates()) {
            if (inCatalog(c)) out.add(c);
        }
        return out;
    }

    private boolean inCatalog(Candidate c) {
        for (EntityRef r : c.entities()) {
            if (!catalog.contains(r)) return false;
        }
        return true;
    }

    private void requireInCatalog(Candidate c) {
        for (EntityRef r : c.entities()) {
            if (!catalog.contains(r)) throw new IllegalArgumentException("Unknown catalog entity: " + r);
        }
    }
}
