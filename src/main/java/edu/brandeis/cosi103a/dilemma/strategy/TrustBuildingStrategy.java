package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperates unconditionally for three rounds, then cooperates with probability equal to
 * its trust level. Trust starts at 1, drops by 0.3 on a defection and recovers by 0.1 on
 * cooperation.
 */
@StrategyDescription("Cooperates in proportion to a trust level eroded by defections")
public class TrustBuildingStrategy extends NamedStrategy {

    static final int WARMUP_ROUNDS = 3;
    static final double BETRAYAL_PENALTY = 0.3;
    static final double FORGIVENESS = 0.1;

    private final RandomSource random;
    private double trustLevel = 1.0;

    public TrustBuildingStrategy(RandomSource random) {
        this("TrustBuilding", random);
    }

    public TrustBuildingStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.size() < WARMUP_ROUNDS) {
            return Action.COOPERATE;
        }

        if (StrategyHelpers.last(opponentHistory) == Action.DEFECT) {
            trustLevel = Math.max(0.0, trustLevel - BETRAYAL_PENALTY);
        } else {
            trustLevel = Math.min(1.0, trustLevel + FORGIVENESS);
        }

        return StrategyHelpers.cooperateWithProbability(random, trustLevel);
    }

    public double getTrustLevel() {
        return trustLevel;
    }

    @Override
    public void reset() {
        trustLevel = 1.0;
    }
}
