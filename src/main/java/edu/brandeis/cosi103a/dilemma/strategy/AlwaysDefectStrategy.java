package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Plays {@link Action#DEFECT} every round regardless of history.
 */
@StrategyDescription("Always defects")
public class AlwaysDefectStrategy extends NamedStrategy {

    public AlwaysDefectStrategy() {
        this("AlwaysDefect");
    }

    public AlwaysDefectStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        return Action.DEFECT;
    }
}
