package org.calista.replycraft.defaults;

import java.util.Random;

/** {@link RandomSource} over {@link java.util.Random}; a fixed seed replays the same sequence. */
public final class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    public SeededRandomSource() {
        this.random = new Random();
    }

    @Override
    public synchronized double nextDouble() {
        return random.nextDouble();
    }
}
