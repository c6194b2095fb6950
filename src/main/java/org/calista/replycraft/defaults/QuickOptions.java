package org.calista.replycraft.defaults;

import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.SmartDefault;
import org.calista.replycraft.usage.CombinationCount;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One-tap options: the recent choice, the smart default and the most used combinations.
 */
public final class QuickOptions {

    public final Optional<Candidate> lastSelection;
    public final SmartDefault smartDefault;
    public final List<CombinationCount> topCombinations;

    public QuickOptions(Optional<Candidate> lastSelection, SmartDefault smartDefault, List<CombinationCount> topCombinations) {
        this.lastSelection = lastSelection == null ? Optional.empty() : lastSelection;
        this.smartDefault = Objects.requireNonNull(smartDefault, "smartDefault");
        this.topCombinations = topCombinations == null ? List.of() : List.copyOf(topCombinations);
    }

    @Override
    public String toString() {
        return "QuickOptions{last=" + lastSelection.map(Candidate::key).orElse("-")
                + ", default=" + smartDefault + ", top=" + topCombinations + "}";
    }
}
