package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Static utility methods shared across strategy implementations.
 */
public final class StrategyHelpers {

    private StrategyHelpers() {
        // Utility class
    }

    /**
     * Last action of a history, or null if it is empty.
     */
    public static Action last(List<Action> history) {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    /**
     * Tit-for-tat: cooperate on an empty history, else copy the opponent's last action.
     */
    public static Action mirror(List<Action> opponentHistory) {
        return opponentHistory.isEmpty() ? Action.COOPERATE : last(opponentHistory);
    }

    /**
     * Counts occurrences of {@code action} in the last {@code window} entries.
     */
    public static int countRecent(List<Action> history, Action action, int window) {
        int from = Math.max(0, history.size() - window);
        int count = 0;
        for (int i = from; i < history.size(); i++) {
            if (history.get(i) == action) {
                count++;
            }
        }
        return count;
    }

    public static int count(List<Action> history, Action action) {
        return countRecent(history, action, history.size());
    }

    /**
     * Cooperates with probability {@code cooperateProbability}.
     */
    public static Action cooperateWithProbability(RandomSource random, double cooperateProbability) {
        return random.nextDouble() < cooperateProbability ? Action.COOPERATE : Action.DEFECT;
    }

    /**
     * Maps a fraction in [0, 1] linearly onto [low, high].
     */
    public static double rescale(double fraction, double low, double high) {
        return low + fraction * (high - low);
    }

    /**
     * Whether {@code history[start, start + pattern.size())} equals {@code pattern}.
     */
    public static boolean matchesAt(List<Action> history, int start, List<Action> pattern) {
        if (start < 0 || start + pattern.size() > history.size()) {
            return false;
        }
        for (int k = 0; k < pattern.size(); k++) {
            if (history.get(start + k) != pattern.get(k)) {
                return false;
            }
        }
        return true;
    }
}
