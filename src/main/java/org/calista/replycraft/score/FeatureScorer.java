package org.calista.replycraft.score;

import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.ReplyContext;
import org.calista.replycraft.model.ScoreBreakdown;

/**
 * Scores one candidate combination against a reply context.
 * Must be deterministic for equal inputs and equal ledger/favorites state.
 */
public interface FeatureScorer {

    /**
     * @throws ScoringException if the candidate cannot be scored
     */
    ScoreBreakdown score(Candidate candidate, ReplyContext context);
}
