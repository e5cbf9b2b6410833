package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Retaliates with growing force. Each time the opponent defects against its cooperation,
 * the defection count goes up and a revenge run of that many defections begins.
 */
@StrategyDescription("Answers the n-th betrayal with n defections")
public class GradualStrategy extends NamedStrategy {

    private int revengeCounter;
    private int defectCount;

    public GradualStrategy() {
        this("Gradual");
    }

    public GradualStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        if (StrategyHelpers.last(opponentHistory) == Action.DEFECT
                && StrategyHelpers.last(ownHistory) == Action.COOPERATE) {
            defectCount++;
            revengeCounter = defectCount;
        }

        if (revengeCounter > 0) {
            revengeCounter--;
            return Action.DEFECT;
        }
        return Action.COOPERATE;
    }

    int getDefectCount() {
        return defectCount;
    }

    @Override
    public void reset() {
        revengeCounter = 0;
        defectCount = 0;
    }
}
