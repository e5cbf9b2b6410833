package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperates in the first round, then copies whatever the opponent did last.
 */
@StrategyDescription("Cooperates first, then copies the opponent's last move")
public class TitForTatStrategy extends NamedStrategy {

    public TitForTatStrategy() {
        this("TitForTat");
    }

    public TitForTatStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        return StrategyHelpers.mirror(opponentHistory);
    }
}
