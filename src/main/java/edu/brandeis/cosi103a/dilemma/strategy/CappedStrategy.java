package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Answers cooperation with cooperation 90% of the time and always answers defection
 * with defection.
 */
@StrategyDescription("Returns cooperation 90% of the time, defection always")
public class CappedStrategy extends NamedStrategy {

    static final double COOPERATION_CAP = 0.9;

    private final RandomSource random;

    public CappedStrategy(RandomSource random) {
        this("Capped", random);
    }

    public CappedStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }
        if (StrategyHelpers.last(opponentHistory) == Action.COOPERATE) {
            return StrategyHelpers.cooperateWithProbability(random, COOPERATION_CAP);
        }
        return Action.DEFECT;
    }
}
