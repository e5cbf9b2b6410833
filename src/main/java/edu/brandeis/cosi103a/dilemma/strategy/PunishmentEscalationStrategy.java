package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Tit-for-tat whose punishments lengthen as the opponent keeps defecting: after the n-th
 * observed defection it defects once plus {@code min(5, n / 2)} more rounds.
 */
@StrategyDescription("Tit-for-tat with punishment streaks growing with opponent defections")
public class PunishmentEscalationStrategy extends NamedStrategy {

    static final int MAX_STREAK = 5;

    private int opponentDefectCount;
    private int punishmentStreak;

    public PunishmentEscalationStrategy() {
        this("PunishmentEscalation");
    }

    public PunishmentEscalationStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        if (punishmentStreak > 0) {
            punishmentStreak--;
            return Action.DEFECT;
        }

        if (StrategyHelpers.last(opponentHistory) == Action.DEFECT) {
            opponentDefectCount++;
            punishmentStreak = Math.min(MAX_STREAK, opponentDefectCount / 2);
            return Action.DEFECT;
        }
        return Action.COOPERATE;
    }

    @Override
    public void reset() {
        opponentDefectCount = 0;
        punishmentStreak = 0;
    }
}
