package org.calista.replycraft.model;

import java.util.Locale;

/**
 * Style slot kinds.
 *
 * <p>Declaration order IS the slot order of {@link CombinationKey}. Reordering constants
 * changes every persisted key and requires a {@link CombinationKey#VERSION} bump.</p>
 */
public enum EntityKind {
    PERSONALITY("personality"),
    VOCABULARY("vocabulary"),
    RHETORIC("rhetoric"),
    LENGTH_PACING("lengthPacing");

    private final String storageName;

    EntityKind(String storageName) {
        this.storageName = storageName;
    }

    /** Stable name used in persisted JSON and in the catalog file. */
    public String storageName() {
        return storageName;
    }

    public static EntityKind fromStorageName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("kind name must not be blank");
        }
        String n = name.trim();
        for (EntityKind k : values()) {
            if (k.storageName.equals(n)) return k;
        }
        // tolerate enum-style names from hand-written files
        try {
            return EntityKind.valueOf(n.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity kind: " + name, e);
        }
    }

    /** Short human label for reasons and console output. */
    public String label() {
        switch (this) {
            case PERSONALITY:
                return "personality";
            case VOCABULARY:
                return "vocabulary";
            case RHETORIC:
                return "rhetorical move";
            case LENGTH_PACING:
                return "length/pacing";
            default:
                throw new IllegalStateException("Unhandled kind " + this);
        }
    }
}
