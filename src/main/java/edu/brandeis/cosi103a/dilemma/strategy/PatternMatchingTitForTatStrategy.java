package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Tit-for-tat with a predictor. Once the match is long enough, the opponent's latest
 * four moves are looked up in its history; if that window occurred at least twice before
 * and was mostly followed by defection, it defects pre-emptively.
 */
@StrategyDescription("Tit-for-tat that pre-empts defections predicted from 4-move patterns")
public class PatternMatchingTitForTatStrategy extends NamedStrategy {

    private final int patternLength;
    private final int minOccurrences;

    public PatternMatchingTitForTatStrategy() {
        this("PatternMatchingTitForTat");
    }

    public PatternMatchingTitForTatStrategy(String name) {
        this(name, 4, 2);
    }

    public PatternMatchingTitForTatStrategy(String name, int patternLength, int minOccurrences) {
        super(name);
        if (patternLength <= 0 || minOccurrences <= 0) {
            throw new IllegalArgumentException("patternLength and minOccurrences must be positive");
        }
        this.patternLength = patternLength;
        this.minOccurrences = minOccurrences;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        if (opponentHistory.size() >= patternLength * 3) {
            List<Action> pattern = findRecurringPattern(opponentHistory);
            if (pattern != null && predictDefection(opponentHistory, pattern)) {
                return Action.DEFECT;
            }
        }
        return StrategyHelpers.last(opponentHistory);
    }

    /**
     * Returns the latest window if it occurs often enough in the earlier history, else null.
     */
    List<Action> findRecurringPattern(List<Action> history) {
        int n = history.size();
        if (n < patternLength * 2) {
            return null;
        }
        List<Action> recent = history.subList(n - patternLength, n);
        int occurrences = 0;
        for (int i = 0; i <= n - patternLength * 2; i++) {
            if (StrategyHelpers.matchesAt(history, i, recent)) {
                occurrences++;
            }
        }
        return occurrences >= minOccurrences ? recent : null;
    }

    /**
     * Majority vote over what followed each earlier occurrence of the pattern.
     */
    boolean predictDefection(List<Action> history, List<Action> pattern) {
        int continuations = 0;
        int defections = 0;
        for (int i = 0; i < history.size() - pattern.size(); i++) {
            if (StrategyHelpers.matchesAt(history, i, pattern)) {
                continuations++;
                if (history.get(i + pattern.size()) == Action.DEFECT) {
                    defections++;
                }
            }
        }
        return continuations > 0 && (double) defections / continuations > 0.5;
    }
}
