package org.calista.replycraft.catalog;

import org.calista.replycraft.model.EntityRef;

import java.util.*;

/**
 * Catalog entry for one selectable style unit.
 *
 * <p>Tags are situational hints ("good-for-replies", "question", ...) matched against
 * context features. They are normalized to lower case and kept in declaration order.</p>
 */
public final class StyleEntity {

    public final EntityRef ref;
    public final String label;
    public final String category;
    public final Set<String> tags;
    public final Register register;

    public StyleEntity(EntityRef ref, String label, String category, Collection<String> tags, Register register) {
        this.ref = Objects.requireNonNull(ref, "ref");
        this.label = (label == null || label.isBlank()) ? ref.id : label.trim();
        this.category = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
        this.register = register == null ? Register.NEUTRAL : register;

        if (tags == null || tags.isEmpty()) {
            this.tags = Set.of();
        } else {
            LinkedHashSet<String> norm = new LinkedHashSet<>();
            for (String t : tags) {
                if (t == null) continue;
                String x = t.trim().toLowerCase(Locale.ROOT);
                if (!x.isEmpty()) norm.add(x);
            }
            this.tags = Collections.unmodifiableSet(norm);
        }
    }

    public boolean hasTag(String tag) {
        return tag != null && tags.contains(tag);
    }

    @Override
    public String toString() {
        return "StyleEntity{" + ref + ", register=" + register + ", tags=" + tags + '}';
    }
}
