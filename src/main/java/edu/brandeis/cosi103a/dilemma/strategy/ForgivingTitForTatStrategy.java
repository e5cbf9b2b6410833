package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Defects only when the opponent defected in at least two of the last three rounds.
 * Cooperates until three rounds of history exist.
 */
@StrategyDescription("Defects only after 2 opponent defections in the last 3 rounds")
public class ForgivingTitForTatStrategy extends NamedStrategy {

    private static final int WINDOW = 3;
    private static final int THRESHOLD = 2;

    public ForgivingTitForTatStrategy() {
        this("ForgivingTitForTat");
    }

    public ForgivingTitForTatStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.size() < WINDOW) {
            return Action.COOPERATE;
        }
        return StrategyHelpers.countRecent(opponentHistory, Action.DEFECT, WINDOW) >= THRESHOLD
            ? Action.DEFECT
            : Action.COOPERATE;
    }
}
