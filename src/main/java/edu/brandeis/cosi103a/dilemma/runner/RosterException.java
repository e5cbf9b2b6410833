package edu.brandeis.cosi103a.dilemma.runner;

/**
 * Thrown when a roster cannot be played: too few strategies, or a reference that
 * does not resolve to a strategy.
 */
public class RosterException extends IllegalArgumentException {

    public RosterException(String message) {
        super(message);
    }

    public RosterException(String message, Throwable cause) {
        super(message, cause);
    }
}
