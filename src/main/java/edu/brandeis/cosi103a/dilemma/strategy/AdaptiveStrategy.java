package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Follows the opponent's overall cooperation rate: cooperates at 0.7 or above, defects at
 * 0.3 or below, and plays tit-for-tat in between.
 */
@StrategyDescription("Cooperates with cooperators, defects against defectors, tit-for-tat otherwise")
public class AdaptiveStrategy extends NamedStrategy {

    static final double COOPERATIVE = 0.7;
    static final double HOSTILE = 0.3;

    private double cooperationRate;

    public AdaptiveStrategy() {
        this("Adaptive");
    }

    public AdaptiveStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }
        cooperationRate = (double) StrategyHelpers.count(opponentHistory, Action.COOPERATE) / opponentHistory.size();

        if (cooperationRate >= COOPERATIVE) {
            return Action.COOPERATE;
        } else if (cooperationRate <= HOSTILE) {
            return Action.DEFECT;
        }
        return StrategyHelpers.last(opponentHistory);
    }

    public double getCooperationRate() {
        return cooperationRate;
    }

    @Override
    public void reset() {
        cooperationRate = 0.0;
    }
}
