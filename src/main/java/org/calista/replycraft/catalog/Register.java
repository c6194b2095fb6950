package org.calista.replycraft.catalog;

import java.util.Locale;

/** Declared tone register of a style entity, used by time-of-day fit. */
public enum Register {
    PROFESSIONAL,
    CASUAL,
    NEUTRAL;

    public static Register parse(String raw) {
        if (raw == null || raw.isBlank()) return NEUTRAL;
        try {
            return Register.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown register: " + raw, e);
        }
    }
}
