package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperation probability follows the opponent's cooperate-fraction over the last (up to)
 * fifteen rounds, rescaled into [0.2, 0.8]. Starts at 0.7.
 */
@StrategyDescription("Cooperation probability from the opponent's last 15 moves, in [0.2, 0.8]")
public class MediumMemoryStrategy extends NamedStrategy {

    static final int WINDOW = 15;
    static final double LOW = 0.2;
    static final double HIGH = 0.8;
    static final double INITIAL_PROBABILITY = 0.7;

    private final RandomSource random;
    private double cooperationProbability = INITIAL_PROBABILITY;

    public MediumMemoryStrategy(RandomSource random) {
        this("MediumMemory", random);
    }

    public MediumMemoryStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (!opponentHistory.isEmpty()) {
            cooperationProbability = recentCooperationProbability(opponentHistory);
        }
        return StrategyHelpers.cooperateWithProbability(random, cooperationProbability);
    }

    /**
     * Cooperate-fraction over the last {@value #WINDOW} opponent moves, rescaled into the band.
     * The history must not be empty.
     */
    static double recentCooperationProbability(List<Action> opponentHistory) {
        int lookback = Math.min(WINDOW, opponentHistory.size());
        int cooperations = StrategyHelpers.countRecent(opponentHistory, Action.COOPERATE, lookback);
        return StrategyHelpers.rescale((double) cooperations / lookback, LOW, HIGH);
    }

    public double getCooperationProbability() {
        return cooperationProbability;
    }

    @Override
    public void reset() {
        cooperationProbability = INITIAL_PROBABILITY;
    }
}
