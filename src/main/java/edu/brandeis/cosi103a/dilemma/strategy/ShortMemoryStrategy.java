package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperation probability follows the opponent's cooperate-fraction over the last three
 * rounds, rescaled into [0.3, 0.7]. Starts at 0.7.
 */
@StrategyDescription("Cooperation probability from the opponent's last 3 moves, in [0.3, 0.7]")
public class ShortMemoryStrategy extends NamedStrategy {

    static final int WINDOW = 3;
    static final double LOW = 0.3;
    static final double HIGH = 0.7;
    static final double INITIAL_PROBABILITY = 0.7;

    private final RandomSource random;
    private double cooperationProbability = INITIAL_PROBABILITY;

    public ShortMemoryStrategy(RandomSource random) {
        this("ShortMemory", random);
    }

    public ShortMemoryStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.size() >= WINDOW) {
            int cooperations = StrategyHelpers.countRecent(opponentHistory, Action.COOPERATE, WINDOW);
            cooperationProbability = StrategyHelpers.rescale((double) cooperations / WINDOW, LOW, HIGH);
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
