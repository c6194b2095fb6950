package org.calista.replycraft.usage;

import org.calista.replycraft.model.Candidate;

/**
 * Observer of finalized selections. Called synchronously after the ledger is updated;
 * failures are logged by the ledger and never reach the caller.
 */
@FunctionalInterface
public interface SelectionListener {
    void onSelection(Candidate candidate, String key, String source, long atEpochMs);
}
