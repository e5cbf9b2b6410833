package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Plays the fixed cycle cooperate, cooperate, defect, ignoring the opponent.
 */
@StrategyDescription("Fixed cycle: cooperate, cooperate, defect")
public class TwoCoopOneDefectStrategy extends NamedStrategy {

    private static final int CYCLE = 3;

    private int position;

    public TwoCoopOneDefectStrategy() {
        this("TwoCoopOneDefect");
    }

    public TwoCoopOneDefectStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        Action action = position < CYCLE - 1 ? Action.COOPERATE : Action.DEFECT;
        position = (position + 1) % CYCLE;
        return action;
    }

    @Override
    public void reset() {
        position = 0;
    }
}
