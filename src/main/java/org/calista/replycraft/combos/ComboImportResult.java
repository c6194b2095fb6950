package org.calista.replycraft.combos;

import java.util.List;

/** Outcome of {@link CustomCombosStore#importJson(String)}. */
public final class ComboImportResult {
    public final int imported;
    public final int skipped;
    public final List<String> errors;

    ComboImportResult(int imported, int skipped, List<String> errors) {
        this.imported = imported;
        this.skipped = skipped;
        this.errors = List.copyOf(errors);
    }

    @Override
    public String toString() {
        return "ComboImportResult{imported=" + imported + ", skipped=" + skipped + ", errors=" + errors.size() + '}';
    }
}
