package org.calista.replycraft.model;

import java.util.*;

/**
 * Candidate — immutable assignment of entities to the four style slots.
 *
 * <p>
 * A full candidate fills every slot; a legacy one may carry only personality + rhetoric.
 * Identity is the slot assignment only: the optional {@link #label} (persona name, etc.)
 * never participates in equals/hashCode or in the {@link CombinationKey}.
 * </p>
 */
public final class Candidate {

    private static final Candidate EMPTY = new Candidate(new EnumMap<>(EntityKind.class), null);

    private final EnumMap<EntityKind, EntityRef> slots;

    /** Optional display label, may be null. */
    public final String label;

    private Candidate(EnumMap<EntityKind, EntityRef> slots, String label) {
        this.slots = slots;
        this.label = (label == null || label.isBlank()) ? null : label.trim();
    }

    public static Candidate empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Convenience for the common full case. Null or blank ids leave the slot empty. */
    public static Candidate of(String personality, String vocabulary, String rhetoric, String lengthPacing) {
        return builder()
                .set(EntityKind.PERSONALITY, personality)
                .set(EntityKind.VOCABULARY, vocabulary)
                .set(EntityKind.RHETORIC, rhetoric)
                .set(EntityKind.LENGTH_PACING, lengthPacing)
                .build();
    }

    public static Candidate of(Collection<EntityRef> refs) {
        Builder b = builder();
        if (refs != null) {
            for (EntityRef r : refs) b.with(r);
        }
        return b.build();
    }

    public Optional<EntityRef> slot(EntityKind kind) {
        return Optional.ofNullable(slots.get(kind));
    }

    /** Id in the slot or empty string when the slot is empty. */
    public String idOrEmpty(EntityKind kind) {
        EntityRef r = slots.get(kind);
        return r == null ? "" : r.id;
    }

    /** Non-empty entities in slot order. */
    public List<EntityRef> entities() {
        return List.copyOf(slots.values());
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public boolean isFull() {
        return slots.size() == EntityKind.values().length;
    }

    public String key() {
        return CombinationKey.of(this);
    }

    public Candidate withLabel(String newLabel) {
        return new Candidate(new EnumMap<>(slots), newLabel);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.slots.putAll(slots);
        b.label = label;
        return b;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Candidate c)) return false;
        return slots.equals(c.slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }

    @Override
    public String toString() {
        return label == null ? key() : label + "{" + key() + "}";
    }

    public static final class Builder {
        private final EnumMap<EntityKind, EntityRef> slots = new EnumMap<>(EntityKind.class);
        private String label;

        private Builder() {
        }

        /** Assigns the ref to its kind's slot; a later assignment to the same slot wins. */
        public Builder with(EntityRef ref) {
            Objects.requireNonNull(ref, "ref");
            slots.put(ref.kind, ref);
            return this;
        }

        public Builder set(EntityKind kind, String id) {
            Objects.requireNonNull(kind, "kind");
            if (id == null || id.isBlank()) {
                slots.remove(kind);
            } else {
                slots.put(kind, new EntityRef(kind, id));
            }
            return this;
        }

        public Builder clear(EntityKind kind) {
            slots.remove(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Candidate build() {
            if (slots.isEmpty() && label == null) return EMPTY;
            return new Candidate(new EnumMap<>(slots), label);
        }
    }
}
