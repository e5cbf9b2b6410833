package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperates when both sides played the same action last round; otherwise cooperates
 * with probability 2/7.
 */
@StrategyDescription("Cooperates after agreement, mostly defects after disagreement")
public class ConsensusStrategy extends NamedStrategy {

    static final double DISAGREEMENT_COOPERATION = 2.0 / 7.0;

    private final RandomSource random;

    public ConsensusStrategy(RandomSource random) {
        this("Consensus", random);
    }

    public ConsensusStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (ownHistory.isEmpty() || opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }
        if (StrategyHelpers.last(ownHistory) == StrategyHelpers.last(opponentHistory)) {
            return Action.COOPERATE;
        }
        return StrategyHelpers.cooperateWithProbability(random, DISAGREEMENT_COOPERATION);
    }
}
