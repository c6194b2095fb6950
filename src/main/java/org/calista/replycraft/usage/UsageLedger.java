package org.calista.replycraft.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.CombinationKey;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;
import org.calista.replycraft.store.KeyValueStore;
import org.calista.replycraft.store.WriteBehind;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * UsageLedger — per-entity and per-combination usage counters.
 *
 * <p>
 * State lives in memory and is the source of truth for the running process. It is read
 * once from the {@link KeyValueStore} in {@link #load()} and persisted write-behind.
 * Three namespaces are stored: {@value #KEY_LEDGER}, {@value #KEY_COMBINATIONS} and
 * {@value #KEY_LAST_SELECTION}. A namespace that does not parse is reset to empty
 * with one warning; the others survive.
 * </p>
 *
 * <p>
 * Counts only grow, except through {@link #reset()}. Persistence problems never reach the caller.
 * </p>
 */
public final class UsageLedger {
    private static final Logger log = LogManager.getLogger(UsageLedger.class);

    public static final String KEY_LEDGER = "usage_ledger";
    public static final String KEY_COMBINATIONS = "combination_usage";
    public static final String KEY_LAST_SELECTION = "last_selection";

    static final String FORMAT_VERSION = CombinationKey.VERSION;

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final WriteBehind writer;
    private final List<SelectionListener> listeners = new CopyOnWriteArrayList<>();

    private final EnumMap<EntityKind, Map<String, UsageRecord>> entities = new EnumMap<>(EntityKind.class);
    private final Map<String, UsageRecord> combinations = new HashMap<>();
    private final Map<String, Candidate> candidatesByKey = new HashMap<>();

    private Candidate lastSelection;
    private long lastSelectionAt;
    private long revision;

    public UsageLedger(KeyValueStore store,
                       ObjectMapper mapper,
                       Clock clock,
                       ScheduledExecutorService scheduler,
                       long flushDelayMs) {
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.writer = new WriteBehind("usage ledger", store, this::snapshot, scheduler, flushDelayMs);
        for (EntityKind k : EntityKind.values()) entities.put(k, new HashMap<>());
    }

    public void addListener(SelectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // -------------------- load --------------------

    /**
     * Single blocking startup read. A failed read leaves the ledger empty.
     */
    public void load() {
        Map<String, String> raw;
        try {
            raw = store.get(List.of(KEY_LEDGER, KEY_COMBINATIONS, KEY_LAST_SELECTION)).join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Usage ledger read failed, starting empty: {}", cause.toString());
            synchronized (this) {
                clearState();
                revision++;
            }
            return;
        }
        if (raw == null) raw = Map.of();

        synchronized (this) {
            clearState();

            String ledgerJson = raw.get(KEY_LEDGER);
            if (ledgerJson != null) {
                try {
                    readEntities(ledgerJson);
                } catch (MalformedNamespaceException e) {
                    for (Map<String, UsageRecord> m : entities.values()) m.clear();
                    log.warn("Persisted {} is malformed, resetting to empty: {}", KEY_LEDGER, e.getMessage());
                }
            }

            String comboJson = raw.get(KEY_COMBINATIONS);
            if (comboJson != null) {
                try {
                    readCombinations(comboJson);
                } catch (MalformedNamespaceException e) {
                    combinations.clear();
                    candidatesByKey.clear();
                    log.warn("Persisted {} is malformed, resetting to empty: {}", KEY_COMBINATIONS, e.getMessage());
                }
            }

            String lastJson = raw.get(KEY_LAST_SELECTION);
            if (lastJson != null) {
                try {
                    readLastSelection(lastJson);
                } catch (MalformedNamespaceException e) {
                    lastSelection = null;
                    lastSelectionAt = 0L;
                    log.warn("Persisted {} is malformed, resetting to empty: {}", KEY_LAST_SELECTION, e.getMessage());
                }
            }

            revision++;
            log.info("Usage ledger loaded: combinations={}, entities={}", combinations.size(), entityCount());
        }
    }

    // -------------------- mutation --------------------

    /**
     * Records one finalized choice. An empty candidate records nothing.
     */
    public void recordSelection(Candidate candidate, String source) {
        Objects.requireNonNull(candidate, "candidate");
        if (candidate.isEmpty()) {
            log.debug("Ignoring empty selection from {}", source);
            return;
        }
        String src = (source == null || source.isBlank()) ? SelectionSource.MANUAL : source.trim();
        long now = clock.millis();
        String key;

        synchronized (this) {
            for (EntityRef r : candidate.entities()) {
                Map<String, UsageRecord> m = entities.get(r.kind);
                m.put(r.id, m.getOrDefault(r.id, UsageRecord.NONE).touch(now));
            }
            key = candidate.key();
            combinations.put(key, combinations.getOrDefault(key, UsageRecord.NONE).touch(now));
            candidatesByKey.putIfAbsent(key, candidate.withLabel(null));
            lastSelection = candidate;
            lastSelectionAt = now;
            revision++;
        }

        writer.markDirty();
        notifyListeners(candidate, key, src, now);
    }

    /**
     * Clears all counters and the last selection, then flushes.
     */
    public CompletableFuture<Boolean> reset() {
        synchronized (this) {
            clearState();
            revision++;
        }
        log.info("Usage ledger reset");
        writer.markDirty();
        return writer.flush();
    }

    /**
     * Writes pending state now. Completes with {@code false} when the store rejected the write.
     */
    public CompletableFuture<Boolean> flush() {
        return writer.flush();
    }

    // -------------------- queries --------------------

    public synchronized int getEntityUsage(EntityRef ref) {
        Objects.requireNonNull(ref, "ref");
        return entities.get(ref.kind).getOrDefault(ref.id, UsageRecord.NONE).count;
    }

    public synchronized int getCombinationUsage(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        return combinations.getOrDefault(candidate.key(), UsageRecord.NONE).count;
    }

    public synchronized boolean hasAnyCombination() {
        return !combinations.isEmpty();
    }

    /** Monotonic mutation counter. */
    public synchronized long revision() {
        return revision;
    }

    public synchronized List<CombinationCount> topCombinations(int n) {
        if (n <= 0 || combinations.isEmpty()) return List.of();
        ArrayList<CombinationCount> all = new ArrayList<>(combinations.size());
        for (var e : combinations.entrySet()) {
            all.add(new CombinationCount(candidatesByKey.get(e.getKey()), e.getKey(), e.getValue().count, e.getValue().lastUsedAt));
        }
        all.sort(CombinationCount.ORDER);
        return List.copyOf(all.subList(0, Math.min(n, all.size())));
    }

    /**
     * Last finalized candidate if it was recorded within {@code maxAge}.
     */
    public synchronized Optional<Candidate> lastSelection(Duration maxAge) {
        if (lastSelection == null) return Optional.empty();
        if (maxAge != null && clock.millis() - lastSelectionAt > maxAge.toMillis()) return Optional.empty();
        return Optional.of(lastSelection);
    }

    public synchronized UsageStats stats() {
        long total = 0;
        for (UsageRecord r : combinations.values()) total += r.count;

        EnumMap<EntityKind, EntityRef> top = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            String bestId = null;
            UsageRecord best = null;
            for (var e : entities.get(kind).entrySet()) {
                UsageRecord r = e.getValue();
                if (best == null
                        || r.count > best.count
                        || (r.count == best.count && r.lastUsedAt > best.lastUsedAt)
                        || (r.count == best.count && r.lastUsedAt == best.lastUsedAt && e.getKey().compareTo(bestId) < 0)) {
                    best = r;
                    bestId = e.getKey();
                }
            }
            if (bestId != null) top.put(kind, new EntityRef(kind, bestId));
        }
        return new UsageStats(total, combinations.size(), top);
    }

    // -------------------- internals --------------------

    private void notifyListeners(Candidate candidate, String key, String source, long at) {
        for (SelectionListener l : listeners) {
            try {
                l.onSelection(candidate, key, source, at);
            } catch (RuntimeException e) {
                log.warn("Selection listener failed: {}", e.toString());
            }
        }
    }

    private void clearState() {
        for (Map<String, UsageRecord> m : entities.values()) m.clear();
        combinations.clear();
        candidatesByKey.clear();
        lastSelection = null;
        lastSelectionAt = 0L;
    }

    private int entityCount() {
        int n = 0;
        for (Map<String, UsageRecord> m : entities.values()) n += m.size();
        return n;
    }

    synchronized Map<String, String> snapshot() {
        ObjectNode ledger = mapper.createObjectNode();
        ledger.put("version", FORMAT_VERSION);
        ObjectNode ents = ledger.putObject("entities");
        for (EntityKind kind : EntityKind.values()) {
            ObjectNode byId = ents.putObject(kind.storageName());
            for (String id : new TreeSet<>(entities.get(kind).keySet())) {
                writeRecord(byId.putObject(id), entities.get(kind).get(id));
            }
        }

        ObjectNode combos = mapper.createObjectNode();
        combos.put("version", FORMAT_VERSION);
        ObjectNode byKey = combos.putObject("combinations");
        for (String key : new TreeSet<>(combinations.keySet())) {
            writeRecord(byKey.putObject(key), combinations.get(key));
        }

        ObjectNode last = mapper.createObjectNode();
        if (lastSelection != null) {
            last.put("key", lastSelection.key());
            last.put("at", lastSelectionAt);
        } else {
            last.putNull("key");
            last.put("at", 0L);
        }

        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        try {
            out.put(KEY_LEDGER, mapper.writeValueAsString(ledger));
            out.put(KEY_COMBINATIONS, mapper.writeValueAsString(combos));
            out.put(KEY_LAST_SELECTION, mapper.writeValueAsString(last));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize usage ledger", e);
        }
        return out;
    }

    private static void writeRecord(ObjectNode n, UsageRecord r) {
        n.put("count", r.count);
        n.put("lastUsedAt", r.lastUsedAt);
    }

    private void readEntities(String json) throws MalformedNamespaceException {
        JsonNode root = parseVersioned(json);
        JsonNode ents = root.get("entities");
        if (ents == null || ents.isNull()) return;
        if (!ents.isObject()) throw new MalformedNamespaceException("'entities' is not an object");

        Iterator<Map.Entry<String, JsonNode>> kinds = ents.fields();
        while (kinds.hasNext()) {
            var k = kinds.next();
            EntityKind kind;
            try {
                kind = EntityKind.fromStorageName(k.getKey());
            } catch (IllegalArgumentException e) {
                throw new MalformedNamespaceException("unknown kind '" + k.getKey() + "'");
            }
            if (!k.getValue().isObject()) throw new MalformedNamespaceException("kind '" + k.getKey() + "' is not an object");

            Iterator<Map.Entry<String, JsonNode>> ids = k.getValue().fields();
            while (ids.hasNext()) {
                var e = ids.next();
                EntityRef ref;
                try {
                    ref = new EntityRef(kind, e.getKey());
                } catch (IllegalArgumentException ex) {
                    throw new MalformedNamespaceException("bad id '" + e.getKey() + "': " + ex.getMessage());
                }
                entities.get(kind).put(ref.id, readRecord(e.getValue(), ref.toString()));
            }
        }
    }

    private void readCombinations(String json) throws MalformedNamespaceException {
        JsonNode root = parseVersioned(json);
        JsonNode combos = root.get("combinations");
        if (combos == null || combos.isNull()) return;
        if (!combos.isObject()) throw new MalformedNamespaceException("'combinations' is not an object");

        Iterator<Map.Entry<String, JsonNode>> it = combos.fields();
        while (it.hasNext()) {
            var e = it.next();
            Candidate c = parseKey(e.getKey());
            combinations.put(e.getKey(), readRecord(e.getValue(), e.getKey()));
            candidatesByKey.put(e.getKey(), c);
        }
    }

    private void readLastSelection(String json) throws MalformedNamespaceException {
        JsonNode root = parseTree(json);
        if (root.isNull()) return;
        if (!root.isObject()) throw new MalformedNamespaceException("not an object");
        JsonNode key = root.get("key");
        if (key == null || key.isNull()) return;
        if (!key.isTextual()) throw new MalformedNamespaceException("'key' is not a string");

        Candidate c = parseKey(key.asText());
        JsonNode at = root.get("at");
        if (at == null || !at.isIntegralNumber() || at.asLong() < 0) {
            throw new MalformedNamespaceException("'at' must be a non-negative integer");
        }
        lastSelection = c;
        lastSelectionAt = at.asLong();
    }

    private JsonNode parseVersioned(String json) throws MalformedNamespaceException {
        JsonNode root = parseTree(json);
        if (!root.isObject()) throw new MalformedNamespaceException("not an object");
        JsonNode v = root.get("version");
        if (v == null || !FORMAT_VERSION.equals(v.asText(null))) {
            throw new MalformedNamespaceException("unsupported version " + v);
        }
        return root;
    }

    private JsonNode parseTree(String json) throws MalformedNamespaceException {
        try {
            JsonNode n = mapper.readTree(json);
            if (n == null || n.isMissingNode()) throw new MalformedNamespaceException("empty document");
            return n;
        } catch (JsonProcessingException e) {
            throw new MalformedNamespaceException("invalid JSON: " + e.getOriginalMessage());
        }
    }

    private static Candidate parseKey(String key) throws MalformedNamespaceException {
        if (!CombinationKey.hasCurrentVersion(key)) throw new MalformedNamespaceException("foreign key version '" + key + "'");
        try {
            return CombinationKey.parse(key);
        } catch (IllegalArgumentException e) {
            throw new MalformedNamespaceException("bad key '" + key + "': " + e.getMessage());
        }
    }

    private static UsageRecord readRecord(JsonNode n, String what) throws MalformedNamespaceException {
        if (n == null || !n.isObject()) throw new MalformedNamespaceException(what + ": record is not an object");
        JsonNode count = n.get("count");
        if (count == null || !count.isIntegralNumber() || !count.canConvertToInt() || count.asInt() < 0) {
            throw new MalformedNamespaceException(what + ": count must be a non-negative integer");
        }
        JsonNode at = n.get("lastUsedAt");
        long lastUsedAt = 0L;
        if (at != null && !at.isNull()) {
            if (!at.isIntegralNumber() || at.asLong() < 0) {
                throw new MalformedNamespaceException(what + ": lastUsedAt must be a non-negative integer");
            }
            lastUsedAt = at.asLong();
        }
        return new UsageRecord(count.asInt(), lastUsedAt);
    }

    private static final class MalformedNamespaceException extends Exception {
        MalformedNamespaceException(String message) {
            super(message);
        }
    }
}
