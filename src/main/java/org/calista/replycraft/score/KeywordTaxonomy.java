package org.calista.replycraft.score;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Keyword categories recognized in the text being replied to.
 *
 * <p>
 * Each rule is a case-insensitive regex with a weight. A rule fires at most once per text.
 * Category names double as catalog tags: an entity tagged {@code question} fits a text
 * the {@code question} rule fires on.
 * </p>
 */
public final class KeywordTaxonomy {

    public static final class Rule {
        public final String category;
        public final Pattern pattern;
        public final double weight;

        public Rule(String category, String regex, double weight) {
            if (category == null || category.isBlank()) throw new IllegalArgumentException("category is blank");
            if (!(weight > 0.0) || !Double.isFinite(weight)) throw new IllegalArgumentException("weight must be > 0: " + weight);
            this.category = category.trim().toLowerCase(Locale.ROOT);
            this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            this.weight = weight;
        }
    }

    private final List<Rule> rules;

    public KeywordTaxonomy(List<Rule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static KeywordTaxonomy defaults() {
        return new KeywordTaxonomy(List.of(
                new Rule("question", "\\?|\\b(how|what|when|where|why|who|which)\\b", 1.5),
                new Rule("opinion", "\\b(think|believe|opinion|feel|seems|appears)\\b", 1.3),
                new Rule("achievement", "\\b(achieved|launched|built|created|finished|completed|proud|excited)\\b", 1.4),
                new Rule("problem", "\\b(problem|issue|broken|failed|error|help|stuck|struggling)\\b", 1.4),
                new Rule("data", "\\b(statistics|data|research|study|survey|report|analysis)\\b", 1.3),
                new Rule("debate", "\\b(controversial|debate|argue|disagree|wrong|actually)\\b", 1.5),
                new Rule("humor", "\\b(lol|haha|funny|joke|meme|lmao|hilarious)\\b", 1.4),
                new Rule("news", "\\b(breaking|announced|news|update|released|available)\\b", 1.2)
        ));
    }

    /**
     * Categories whose rule fires on {@code text}, with their weights, in rule order.
     * The same category listed twice keeps the larger weight.
     */
    public Map<String, Double> match(String text) {
        if (text == null || text.isBlank()) return Map.of();
        LinkedHashMap<String, Double> out = new LinkedHashMap<>();
        for (Rule r : rules) {
            if (r.pattern.matcher(text).find()) out.merge(r.category, r.weight, Math::max);
        }
        return out;
    }
}
