package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Plays tit-for-tat for the first five rounds, then switches to the medium-memory rule.
 */
@StrategyDescription("Tit-for-tat for 5 rounds, then medium memory")
public class TitForTatStartMediumMemoryStrategy extends NamedStrategy {

    static final int OPENING_ROUNDS = 5;

    private final RandomSource random;
    private double cooperationProbability = MediumMemoryStrategy.INITIAL_PROBABILITY;

    public TitForTatStartMediumMemoryStrategy(RandomSource random) {
        this("TitForTatStartMediumMemory", random);
    }

    public TitForTatStartMediumMemoryStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.size() < OPENING_ROUNDS) {
            return StrategyHelpers.mirror(opponentHistory);
        }
        cooperationProbability = MediumMemoryStrategy.recentCooperationProbability(opponentHistory);
        return StrategyHelpers.cooperateWithProbability(random, cooperationProbability);
    }

    @Override
    public void reset() {
        cooperationProbability = MediumMemoryStrategy.INITIAL_PROBABILITY;
    }
}
