package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Fixed response to last round's outcome (own, opponent):
 * (C,C) and (D,D) lead to cooperation, (D,C) and (C,D) to defection.
 */
@StrategyDescription("Cooperates after matching moves, defects after mismatched ones")
public class PavlovStrategy extends NamedStrategy {

    public PavlovStrategy() {
        this("Pavlov");
    }

    public PavlovStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (ownHistory.isEmpty() || opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }
        Action own = StrategyHelpers.last(ownHistory);
        Action opponent = StrategyHelpers.last(opponentHistory);

        if (own == Action.COOPERATE && opponent == Action.COOPERATE) {
            return Action.COOPERATE;
        } else if (own == Action.DEFECT && opponent == Action.COOPERATE) {
            return Action.DEFECT;
        } else if (own == Action.COOPERATE) {
            return Action.DEFECT;
        }
        return Action.COOPERATE;
    }
}
