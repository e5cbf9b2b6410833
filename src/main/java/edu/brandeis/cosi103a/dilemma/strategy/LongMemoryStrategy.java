package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperation probability follows the opponent's cooperate-fraction over the whole match,
 * rescaled into [0.2, 0.8]. Starts at 0.7.
 */
@StrategyDescription("Cooperation probability from all opponent moves, in [0.2, 0.8]")
public class LongMemoryStrategy extends NamedStrategy {

    static final double LOW = 0.2;
    static final double HIGH = 0.8;
    static final double INITIAL_PROBABILITY = 0.7;

    private final RandomSource random;
    private double cooperationProbability = INITIAL_PROBABILITY;

    public LongMemoryStrategy(RandomSource random) {
        this("LongMemory", random);
    }

    public LongMemoryStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (!opponentHistory.isEmpty()) {
            double fraction = (double) StrategyHelpers.count(opponentHistory, Action.COOPERATE) / opponentHistory.size();
            cooperationProbability = StrategyHelpers.rescale(fraction, LOW, HIGH);
        }
        return StrategyHelpers.cooperateWithProbability(random, cooperationProbability);
    }

    public double getCooperationProbability() {
        return cooperationProbability;
    }

    @Override
    public void reset() {
        cooperationProbability = INITIAL_PROBABILITY;
    }
}
