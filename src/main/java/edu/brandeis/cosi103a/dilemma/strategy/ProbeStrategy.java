package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Tit-for-tat whose willingness to cooperate wears down: the cooperation probability
 * starts at 1 and loses 0.01 per round down to 0.5. A cooperative tit-for-tat move turns
 * into a defection when the draw exceeds that probability.
 */
@StrategyDescription("Tit-for-tat with cooperation probability decaying towards 0.5")
public class ProbeStrategy extends NamedStrategy {

    static final double FLOOR = 0.5;
    static final double DECAY_PER_ROUND = 0.01;

    private final RandomSource random;
    private double cooperationProbability = 1.0;
    private int rounds;

    public ProbeStrategy(RandomSource random) {
        this("Probe", random);
    }

    public ProbeStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        rounds++;
        if (cooperationProbability > FLOOR) {
            cooperationProbability = Math.max(FLOOR, 1.0 - DECAY_PER_ROUND * rounds);
        }

        Action titForTat = StrategyHelpers.last(opponentHistory);
        if (titForTat == Action.COOPERATE && random.nextDouble() > cooperationProbability) {
            return Action.DEFECT;
        }
        return titForTat;
    }

    public double getCooperationProbability() {
        return cooperationProbability;
    }

    @Override
    public void reset() {
        cooperationProbability = 1.0;
        rounds = 0;
    }
}
