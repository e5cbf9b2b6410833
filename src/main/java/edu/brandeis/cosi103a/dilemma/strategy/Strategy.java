package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * A decision policy for the iterated dilemma.
 *
 * <p>Implementations keep per-match state and are not reentrant: one instance must take
 * part in at most one match at a time.
 */
public interface Strategy {

    /**
     * Display name, unique within a tournament roster after deduplication.
     */
    String getName();

    /**
     * Chooses the action for the next round.
     *
     * @param ownHistory      this strategy's actions in all prior rounds, oldest first (read-only)
     * @param opponentHistory the opponent's actions in all prior rounds, oldest first (read-only)
     * @return the action to play; never null
     */
    Action decide(List<Action> ownHistory, List<Action> opponentHistory);

    /**
     * Clears per-match state. Called before every match; calling it twice is harmless.
     */
    default void reset() {
    }
}
