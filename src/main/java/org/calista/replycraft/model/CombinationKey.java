package org.calista.replycraft.model;

import java.util.Objects;

/**
 * Canonical combination key.
 *
 * <p>Format (version {@value #VERSION}):</p>
 * <pre>
 *   v1:&lt;personality&gt;|&lt;vocabulary&gt;|&lt;rhetoric&gt;|&lt;lengthPacing&gt;
 * </pre>
 * <p>
 * Slots follow {@link EntityKind} declaration order, an empty slot is the empty string.
 * The key depends only on the slot assignment. Any change to slot order or separator
 * must bump {@link #VERSION}; persisted ledgers with another prefix are discarded on load.
 * </p>
 */
public final class CombinationKey {

    public static final String VERSION = "v1";
    public static final String PREFIX = VERSION + ":";
    public static final char SEPARATOR = '|';

    private CombinationKey() {
    }

    public static String of(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        StringBuilder sb = new StringBuilder(48);
        sb.append(PREFIX);
        EntityKind[] kinds = EntityKind.values();
        for (int i = 0; i < kinds.length; i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(candidate.idOrEmpty(kinds[i]));
        }
        return sb.toString();
    }

    public static boolean hasCurrentVersion(String key) {
        return key != null && key.startsWith(PREFIX);
    }

    /**
     * Parses a key produced by {@link #of(Candidate)}.
     *
     * @throws IllegalArgumentException on a foreign version prefix or a wrong slot count
     */
    public static Candidate parse(String key) {
        if (!hasCurrentVersion(key)) {
            throw new IllegalArgumentException("Unsupported combination key version: " + key);
        }
        String body = key.substring(PREFIX.length());
        String[] parts = body.split("\\" + SEPARATOR, -1);
        EntityKind[] kinds = EntityKind.values();
        if (parts.length != kinds.length) {
            throw new IllegalArgumentException("Combination key must have " + kinds.length + " slots: " + key);
        }
        Candidate.Builder b = Candidate.builder();
        for (int i = 0; i < kinds.length; i++) {
            String id = parts[i];
            if (!id.isEmpty() && !id.equals(id.trim())) {
                throw new IllegalArgumentException("Combination key slot has surrounding whitespace: " + key);
            }
            b.set(kinds[i], id);
        }
        return b.build();
    }
}
