package org.calista.replycraft.score;

/**
 * Thrown when a candidate cannot be scored, e.g. it references an entity missing from the catalog.
 */
public class ScoringException extends RuntimeException {
    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
