package org.calista.replycraft.defaults;

import java.util.List;

/**
 * Source of randomness for the cold-start fallback. Substitutable in tests.
 */
@FunctionalInterface
public interface RandomSource {

    /** Uniform in [0, 1). */
    double nextDouble();

    default <T> T choice(List<T> items) {
        if (items == null || items.isEmpty()) throw new IllegalArgumentException("Cannot choose from an empty list");
        int i = (int) Math.floor(nextDouble() * items.size());
        return items.get(Math.max(0, Math.min(items.size() - 1, i)));
    }
}
