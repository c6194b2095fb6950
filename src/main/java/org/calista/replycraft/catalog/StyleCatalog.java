package org.calista.replycraft.catalog;

import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;

import java.util.*;

/**
 * StyleCatalog — immutable set of selectable entities per kind plus bundled personas.
 *
 * <p>
 * Catalog order is declaration order. {@link #allCandidates()} enumerates the full
 * cartesian product personality-major, which is the order the ranker backfills in.
 * A kind with no entities leaves its slot empty in every enumerated candidate.
 * </p>
 */
public final class StyleCatalog {

    private final EnumMap<EntityKind, List<StyleEntity>> byKind;
    private final Map<EntityRef, StyleEntity> byRef;
    private final List<Persona> personas;
    private final Map<String, Persona> personaById;

    private volatile List<Candidate> allCandidates;

    public StyleCatalog(Map<EntityKind, List<StyleEntity>> entities, List<Persona> personas) {
        Objects.requireNonNull(entities, "entities");

        EnumMap<EntityKind, List<StyleEntity>> kinds = new EnumMap<>(EntityKind.class);
        LinkedHashMap<EntityRef, StyleEntity> refs = new LinkedHashMap<>();

        for (EntityKind kind : EntityKind.values()) {
            List<StyleEntity> list = entities.getOrDefault(kind, List.of());
            ArrayList<StyleEntity> copy = new ArrayList<>(list.size());
            for (StyleEntity e : list) {
                if (e == null) continue;
                if (e.ref.kind != kind) {
                    throw new IllegalArgumentException("Entity " + e.ref + " listed under " + kind);
                }
                if (refs.putIfAbsent(e.ref, e) != null) {
                    throw new IllegalArgumentException("Duplicate catalog entity: " + e.ref);
                }
                copy.add(e);
            }
            kinds.put(kind, Collections.unmodifiableList(copy));
        }

        LinkedHashMap<String, Persona> pById = new LinkedHashMap<>();
        if (personas != null) {
            for (Persona p : personas) {
                if (p == null) continue;
                for (EntityRef r : p.candidate.entities()) {
                    if (!refs.containsKey(r)) {
                        throw new IllegalArgumentException("Persona " + p.id + " references unknown entity " + r);
                    }
                }
                if (pById.putIfAbsent(p.id, p) != null) {
                    throw new IllegalArgumentException("Duplicate persona id: " + p.id);
                }
            }
        }

        this.byKind = kinds;
        this.byRef = Collections.unmodifiableMap(refs);
        this.personas = List.copyOf(pById.values());
        this.personaById = Collections.unmodifiableMap(pById);
    }

    public List<StyleEntity> entities(EntityKind kind) {
        return byKind.get(Objects.requireNonNull(kind, "kind"));
    }

    public Optional<StyleEntity> entity(EntityRef ref) {
        if (ref == null) return Optional.empty();
        return Optional.ofNullable(byRef.get(ref));
    }

    public boolean contains(EntityRef ref) {
        return ref != null && byRef.containsKey(ref);
    }

    public List<Persona> personas() {
        return personas;
    }

    public Optional<Persona> persona(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(personaById.get(id.trim()));
    }

    public int size() {
        return byRef.size();
    }

    /** Full candidate enumeration in catalog order (cached, unmodifiable). */
    public List<Candidate> allCandidates() {
        List<Candidate> local = allCandidates;
        if (local != null) return local;
        synchronized (this) {
            if (allCandidates == null) allCandidates = Collections.unmodifiableList(enumerate());
            return allCandidates;
        }
    }

    private List<Candidate> enumerate() {
        List<Candidate.Builder> acc = new ArrayList<>();
        acc.add(Candidate.builder());
        boolean any = false;

        for (EntityKind kind : EntityKind.values()) {
            List<StyleEntity> options = byKind.get(kind);
            if (options.isEmpty()) continue;
            any = true;

            ArrayList<Candidate.Builder> next = new ArrayList<>(acc.size() * options.size());
            for (Candidate.Builder prefix : acc) {
                Candidate base = prefix.build();
                for (StyleEntity e : options) {
                    next.add(base.toBuilder().with(e.ref));
                }
            }
            acc = next;
        }
        if (!any) return List.of();

        ArrayList<Candidate> out = new ArrayList<>(acc.size());
        for (Candidate.Builder b : acc) out.add(b.build());
        return out;
    }
}
