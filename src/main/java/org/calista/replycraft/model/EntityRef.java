package org.calista.replycraft.model;

import java.util.Objects;

/**
 * Reference to one selectable style unit: {@code (kind, id)}.
 * Ids are opaque, unique within their kind, and never contain the key separator.
 */
public final class EntityRef implements Comparable<EntityRef> {

    public final EntityKind kind;
    public final String id;

    public EntityRef(EntityKind kind, String id) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("EntityRef.id is required");
        }
        String t = id.trim();
        if (t.indexOf(CombinationKey.SEPARATOR) >= 0) {
            throw new IllegalArgumentException("EntityRef.id must not contain '" + CombinationKey.SEPARATOR + "': " + id);
        }
        this.id = t;
    }

    public static EntityRef personality(String id) {
        return new EntityRef(EntityKind.PERSONALITY, id);
    }

    public static EntityRef vocabulary(String id) {
        return new EntityRef(EntityKind.VOCABULARY, id);
    }

    public static EntityRef rhetoric(String id) {
        return new EntityRef(EntityKind.RHETORIC, id);
    }

    public static EntityRef lengthPacing(String id) {
        return new EntityRef(EntityKind.LENGTH_PACING, id);
    }

    @Override
    public int compareTo(EntityRef o) {
        int c = kind.compareTo(o.kind);
        if (c != 0) return c;
        return id.compareTo(o.id);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof EntityRef r)) return false;
        return kind == r.kind && id.equals(r.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind.storageName() + ":" + id;
    }
}
