package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperates until the opponent defects once, then defects for the rest of the match.
 */
@StrategyDescription("Cooperates until the first opponent defection, then always defects")
public class GrudgeStrategy extends NamedStrategy {

    private boolean grudge;

    public GrudgeStrategy() {
        this("Grudge");
    }

    public GrudgeStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }
        if (!grudge && opponentHistory.contains(Action.DEFECT)) {
            grudge = true;
        }
        return grudge ? Action.DEFECT : Action.COOPERATE;
    }

    /**
     * Whether a defection has been seen this match.
     */
    public boolean isHoldingGrudge() {
        return grudge;
    }

    @Override
    public void reset() {
        grudge = false;
    }
}
