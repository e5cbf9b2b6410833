package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * A random strategy that cooperates or defects with equal probability.
 * Used as a baseline for testing and practice.
 */
@StrategyDescription("Cooperates or defects with equal probability")
public class RandomStrategy extends NamedStrategy {

    private final RandomSource random;

    public RandomStrategy(RandomSource random) {
        this("Random", random);
    }

    public RandomStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        return StrategyHelpers.cooperateWithProbability(random, 0.5);
    }
}
