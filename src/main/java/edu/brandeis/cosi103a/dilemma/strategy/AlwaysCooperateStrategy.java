package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Plays {@link Action#COOPERATE} every round regardless of history.
 */
@StrategyDescription("Always cooperates")
public class AlwaysCooperateStrategy extends NamedStrategy {

    public AlwaysCooperateStrategy() {
        this("AlwaysCooperate");
    }

    public AlwaysCooperateStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        return Action.COOPERATE;
    }
}
