package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Punishes a betrayal with two defections, then drifts back to cooperation: the further
 * the last opponent defection lies behind, the likelier it cooperates, and once the
 * five-round forgiveness horizon is reached it cooperates unconditionally.
 */
@StrategyDescription("Short revenge, then increasingly likely forgiveness")
public class GradualForgivingStrategy extends NamedStrategy {

    static final int REVENGE_ROUNDS = 2;
    static final int FORGIVENESS_HORIZON = 5;

    private final RandomSource random;
    private int revengeCounter;
    private int forgiveness;
    private int roundsSinceDefect;

    public GradualForgivingStrategy(RandomSource random) {
        this("GradualForgiving", random);
    }

    public GradualForgivingStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        boolean opponentDefected = StrategyHelpers.last(opponentHistory) == Action.DEFECT;
        if (opponentDefected) {
            roundsSinceDefect = 0;
        } else {
            roundsSinceDefect++;
        }

        if (opponentDefected && StrategyHelpers.last(ownHistory) == Action.COOPERATE) {
            revengeCounter = REVENGE_ROUNDS;
            forgiveness = FORGIVENESS_HORIZON;
        }

        if (revengeCounter > 0) {
            revengeCounter--;
            return Action.DEFECT;
        }

        if (roundsSinceDefect >= forgiveness) {
            forgiveness = 0;
            return Action.COOPERATE;
        }

        double cooperateProbability = Math.min(0.9, 0.5 + roundsSinceDefect * 0.1);
        return StrategyHelpers.cooperateWithProbability(random, cooperateProbability);
    }

    @Override
    public void reset() {
        revengeCounter = 0;
        forgiveness = 0;
        roundsSinceDefect = 0;
    }
}
