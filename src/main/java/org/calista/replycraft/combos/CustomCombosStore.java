package org.calista.replycraft.combos;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.store.KeyValueStore;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * CustomCombosStore — user-named full combinations.
 *
 * <p>
 * Persisted under {@value #KEY} as {@code {"version":1,"combos":[...]}}. Every change is written
 * immediately and the caller does not wait for it. A malformed document is reset to empty with one warning.
 * Names are unique ignoring case. The store does not know the catalog; callers check entity ids.
 * </p>
 */
public final class CustomCombosStore {
    private static final Logger log = LogManager.getLogger(CustomCombosStore.class);

    public static final String KEY = "custom_combos";
    public static final int VERSION = 1;
    public static final String EXPORT_VERSION = "1.0";
    public static final int MAX_NAME_LENGTH = 50;

    /** Most used first, then by name. */
    public static final Comparator<CustomCombo> BY_USAGE = Comparator
            .comparingInt((CustomCombo c) -> c.usageCount).reversed()
            .thenComparing(c -> c.name, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(c -> c.id);

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final LinkedHashMap<String, CustomCombo> combos = new LinkedHashMap<>();

    public CustomCombosStore(KeyValueStore store, ObjectMapper mapper, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void load() {
        String json;
        try {
            json = store.get(List.of(KEY)).join().get(KEY);
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Custom combos read failed, starting empty: {}", cause.toString());
            synchronized (this) {
                combos.clear();
            }
            return;
        }

        synchronized (this) {
            combos.clear();
            if (json == null) return;
            try {
                for (CustomCombo c : read(json)) combos.put(c.id, c);
            } catch (IllegalArgumentException | JsonProcessingException e) {
                combos.clear();
                log.warn("Persisted {} is malformed, resetting to empty: {}", KEY, e.getMessage());
                return;
            }
            log.info("Custom combos loaded: {}", combos.size());
        }
    }

    // -------------------- mutations --------------------

    /**
     * Saves a new combo.
     *
     * @throws IllegalArgumentException on a bad or taken name or a candidate that is not full
     */
    public CustomCombo save(String name, Candidate candidate) {
        String n = validName(name);
        requireFull(candidate);
        CustomCombo c;
        String json;
        synchronized (this) {
            requireFreeName(n, null);
            c = new CustomCombo(newId(), n, candidate, clock.millis(), 0, 0L);
            combos.put(c.id, c);
            json = serialize();
        }
        persist(json);
        log.debug("Custom combo saved: {}", c);
        return c;
    }

    public boolean delete(String id) {
        String json;
        synchronized (this) {
            if (id == null || combos.remove(id) == null) return false;
            json = serialize();
        }
        persist(json);
        return true;
    }

    /**
     * Renames and/or re-assigns a combo; a null argument keeps the current value.
     *
     * @return the updated combo, empty for an unknown id
     * @throws IllegalArgumentException on a bad or taken name or a candidate that is not full
     */
    public Optional<CustomCombo> update(String id, String newName, Candidate newCandidate) {
        String n = newName == null ? null : validName(newName);
        if (newCandidate != null) requireFull(newCandidate);
        CustomCombo updated;
        String json;
        synchronized (this) {
            CustomCombo cur = id == null ? null : combos.get(id);
            if (cur == null) return Optional.empty();
            if (n != null) requireFreeName(n, id);
            updated = cur.renamed(n == null ? cur.name : n, newCandidate == null ? cur.candidate : newCandidate);
            combos.put(id, updated);
            json = serialize();
        }
        persist(json);
        return Optional.of(updated);
    }

    /** Counts one use of the combo; false for an unknown id. */
    public boolean incrementUsage(String id) {
        String json;
        synchronized (this) {
            CustomCombo cur = id == null ? null : combos.get(id);
            if (cur == null) return false;
            combos.put(id, cur.used(clock.millis()));
            json = serialize();
        }
        persist(json);
        return true;
    }

    // -------------------- queries --------------------

    public synchronized Optional<CustomCombo> get(String id) {
        return Optional.ofNullable(id == null ? null : combos.get(id));
    }

    public synchronized Optional<CustomCombo> findByName(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim();
        for (CustomCombo c : combos.values()) {
            if (c.name.equalsIgnoreCase(n)) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** All combos, {@link #BY_USAGE}. */
    public synchronized List<CustomCombo> all() {
        List<CustomCombo> out = new ArrayList<>(combos.values());
        out.sort(BY_USAGE);
        return List.copyOf(out);
    }

    public synchronized int count() {
        return combos.size();
    }

    /** Case-insensitive substring match on the name and entity ids. */
    public List<CustomCombo> search(String query) {
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<CustomCombo> out = new ArrayList<>();
        for (CustomCombo c : all()) {
            if (q.isEmpty() || matches(c, q)) out.add(c);
        }
        return out;
    }

    /** Used at least once, most used first. */
    public List<CustomCombo> popular(int limit) {
        if (limit <= 0) return List.of();
        List<CustomCombo> out = new ArrayList<>();
        for (CustomCombo c : all()) {
            if (out.size() >= limit) break;
            if (c.usageCount > 0) out.add(c);
        }
        return out;
    }

    /** Used at least once, most recent first. */
    public List<CustomCombo> recent(int limit) {
        if (limit <= 0) return List.of();
        List<CustomCombo> used = new ArrayList<>();
        for (CustomCombo c : all()) {
            if (c.lastUsed > 0) used.add(c);
        }
        used.sort(Comparator.comparingLong((CustomCombo c) -> c.lastUsed).reversed().thenComparing(c -> c.id));
        return used.size() > limit ? List.copyOf(used.subList(0, limit)) : used;
    }

    /** Labeled candidates of all combos, {@link #BY_USAGE}. */
    public List<Candidate> candidates() {
        List<Candidate> out = new ArrayList<>();
        for (CustomCombo c : all()) out.add(c.candidate);
        return out;
    }

    // -------------------- backup --------------------

    /** Pretty JSON backup of all combos. */
    public String exportJson() {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", EXPORT_VERSION);
        root.put("exportedAt", Instant.ofEpochMilli(clock.millis()).toString());
        ArrayNode arr = root.putArray("combos");
        for (CustomCombo c : all()) arr.add(toNode(c));
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export custom combos", e);
        }
    }

    /**
     * Adds combos from a backup. Invalid entries and names already present are skipped;
     * imported combos get fresh ids and keep their usage. Nothing throws for bad input.
     */
    public ComboImportResult importJson(String json) {
        int imported = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();

        JsonNode root;
        try {
            root = json == null ? null : mapper.readTree(json);
        } catch (JsonProcessingException e) {
            root = null;
        }
        if (root == null || !root.path("combos").isArray()) {
            errors.add("Invalid backup format: missing combos array");
            return new ComboImportResult(0, 0, errors);
        }

        String out = null;
        synchronized (this) {
            for (JsonNode n : root.get("combos")) {
                String label = n.path("name").asText("?");
                CustomCombo c;
                try {
                    c = fromNode(n, newId(), clock.millis());
                } catch (IllegalArgumentException e) {
                    errors.add("Invalid combo \"" + label + "\": " + e.getMessage());
                    skipped++;
                    continue;
                }
                if (nameTaken(c.name, null)) {
                    skipped++;
                    continue;
                }
                combos.put(c.id, c);
                imported++;
            }
            if (imported > 0) out = serialize();
        }
        if (out != null) persist(out);
        log.info("Custom combos import: imported={}, skipped={}, errors={}", imported, skipped, errors.size());
        return new ComboImportResult(imported, skipped, errors);
    }

    // -------------------- internals --------------------

    private static boolean matches(CustomCombo c, String q) {
        if (c.name.toLowerCase(Locale.ROOT).contains(q)) return true;
        for (var r : c.candidate.entities()) {
            if (r.id.toLowerCase(Locale.ROOT).contains(q)) return true;
        }
        return false;
    }

    private static String validName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Combo name is required");
        String n = name.trim();
        if (n.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Combo name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        return n;
    }

    private static void requireFull(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (!candidate.isFull()) {
            throw new IllegalArgumentException("Combo must fill all four slots: " + candidate.key());
        }
    }

    private void requireFreeName(String name, String exceptId) {
        if (nameTaken(name, exceptId)) throw new IllegalArgumentException("Combo with name \"" + name + "\" already exists");
    }

    private boolean nameTaken(String name, String exceptId) {
        for (CustomCombo c : combos.values()) {
            if (!c.id.equals(exceptId) && c.name.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    private String newId() {
        String id;
        do {
            id = "combo_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        } while (combos.containsKey(id));
        return id;
    }

    private void persist(String json) {
        CompletableFuture<Void> f;
        try {
            f = store.set(Map.of(KEY, json));
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        f.whenComplete((ok, err) -> {
            if (err != null) {
                Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
                log.warn("Custom combos write failed: {}", cause.toString());
            }
        });
    }

    private List<CustomCombo> read(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) throw new IllegalArgumentException("not an object");
        if (root.path("version").asInt(-1) != VERSION) {
            throw new IllegalArgumentException("unsupported version " + root.path("version"));
        }
        JsonNode arr = root.path("combos");
        if (!arr.isArray()) throw new IllegalArgumentException("'combos' is not an array");

        List<CustomCombo> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (JsonNode n : arr) {
            JsonNode id = n.path("id");
            if (!id.isTextual() || id.asText().isBlank()) throw new IllegalArgumentException("combo without id");
            CustomCombo c = fromNode(n, id.asText(), n.path("createdAt").asLong(0L));
            if (!names.add(c.name.toLowerCase(Locale.ROOT))) throw new IllegalArgumentException("duplicate name " + c.name);
            out.add(c);
        }
        return out;
    }

    private static CustomCombo fromNode(JsonNode n, String id, long createdAt) {
        if (n == null || !n.isObject()) throw new IllegalArgumentException("not an object");
        JsonNode name = n.path("name");
        if (!name.isTextual()) throw new IllegalArgumentException("Combo name is required");
        String validName = validName(name.asText());

        Candidate.Builder b = Candidate.builder();
        for (EntityKind kind : EntityKind.values()) {
            JsonNode v = n.path(kind.storageName());
            if (!v.isTextual() || v.asText().isBlank()) {
                throw new IllegalArgumentException("'" + kind.storageName() + "' is required");
            }
            b.set(kind, v.asText());
        }
        int usage = count(n, "usageCount");
        long lastUsed = n.path("lastUsed").isMissingNode() ? 0L : n.path("lastUsed").asLong(-1L);
        if (lastUsed < 0) throw new IllegalArgumentException("bad lastUsed");
        return new CustomCombo(id, validName, b.build(), createdAt, usage, lastUsed);
    }

    private static int count(JsonNode n, String field) {
        JsonNode v = n.path(field);
        if (v.isMissingNode() || v.isNull()) return 0;
        if (!v.canConvertToInt() || !v.isIntegralNumber() || v.asInt() < 0) {
            throw new IllegalArgumentException("bad " + field + ": " + v);
        }
        return v.asInt();
    }

    private ObjectNode toNode(CustomCombo c) {
        ObjectNode o = mapper.createObjectNode();
        o.put("id", c.id);
        o.put("name", c.name);
        for (EntityKind kind : EntityKind.values()) o.put(kind.storageName(), c.candidate.idOrEmpty(kind));
        o.put("createdAt", c.createdAt);
        o.put("usageCount", c.usageCount);
        o.put("lastUsed", c.lastUsed);
        return o;
    }

    private String serialize() {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", VERSION);
        ArrayNode arr = root.putArray("combos");
        for (CustomCombo c : combos.values()) arr.add(toNode(c));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize custom combos", e);
        }
    }
}
