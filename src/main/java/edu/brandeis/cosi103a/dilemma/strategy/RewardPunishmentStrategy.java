package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Keeps a punishment counter in [0, 5]. Opponent cooperation lowers it by one and is
 * rewarded with cooperation; a defection raises it by two and is answered with defection.
 */
@StrategyDescription("Rewards cooperation and punishes defection through a bounded counter")
public class RewardPunishmentStrategy extends NamedStrategy {

    static final int MAX_PUNISHMENT = 5;

    private int punishmentCounter;

    public RewardPunishmentStrategy() {
        this("RewardPunishment");
    }

    public RewardPunishmentStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        if (StrategyHelpers.last(opponentHistory) == Action.COOPERATE) {
            punishmentCounter = Math.max(0, punishmentCounter - 1);
            return Action.COOPERATE;
        }

        punishmentCounter = Math.min(MAX_PUNISHMENT, punishmentCounter + 2);
        return punishmentCounter > 0 ? Action.DEFECT : Action.COOPERATE;
    }

    int getPunishmentCounter() {
        return punishmentCounter;
    }

    @Override
    public void reset() {
        punishmentCounter = 0;
    }
}
