package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Looks for the opponent's latest three moves earlier in the match. If any earlier
 * occurrence was followed by a defection, it defects pre-emptively; otherwise it cooperates.
 */
@StrategyDescription("Defects when the opponent's recent 3-move pattern used to precede a defection")
public class PatternDetectorStrategy extends NamedStrategy {

    private final int patternLength;

    public PatternDetectorStrategy() {
        this("PatternDetector");
    }

    public PatternDetectorStrategy(String name) {
        this(name, 3);
    }

    public PatternDetectorStrategy(String name, int patternLength) {
        super(name);
        if (patternLength <= 0) {
            throw new IllegalArgumentException("patternLength must be positive");
        }
        this.patternLength = patternLength;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        int n = opponentHistory.size();
        if (n < patternLength + 1) {
            return Action.COOPERATE;
        }

        List<Action> recent = opponentHistory.subList(n - patternLength, n);
        // Candidates end at least one full window before the recent one.
        for (int i = 0; i < n - patternLength * 2; i++) {
            if (StrategyHelpers.matchesAt(opponentHistory, i, recent)
                    && opponentHistory.get(i + patternLength) == Action.DEFECT) {
                return Action.DEFECT;
            }
        }
        return Action.COOPERATE;
    }

    public int getPatternLength() {
        return patternLength;
    }
}
