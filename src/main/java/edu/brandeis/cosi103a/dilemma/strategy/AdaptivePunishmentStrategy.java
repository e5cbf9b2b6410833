package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Punishes each observed defection with a streak whose length depends on how often the
 * opponent has defected so far: 3 above a 0.5 rate, 2 above 0.3, otherwise 1.
 */
@StrategyDescription("Punishment length scales with the opponent's defection rate")
public class AdaptivePunishmentStrategy extends NamedStrategy {

    private int punishmentLevel = 1;
    private int defectCount;
    private int rounds;
    private int punishmentStreak;

    public AdaptivePunishmentStrategy() {
        this("AdaptivePunishment");
    }

    public AdaptivePunishmentStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        rounds++;

        if (punishmentStreak > 0) {
            punishmentStreak--;
            return Action.DEFECT;
        }

        if (StrategyHelpers.last(opponentHistory) == Action.DEFECT) {
            defectCount++;
            double defectRate = (double) defectCount / rounds;
            if (defectRate > 0.5) {
                punishmentLevel = 3;
            } else if (defectRate > 0.3) {
                punishmentLevel = 2;
            } else {
                punishmentLevel = 1;
            }
            punishmentStreak = punishmentLevel;
            return Action.DEFECT;
        }
        return Action.COOPERATE;
    }

    int getPunishmentLevel() {
        return punishmentLevel;
    }

    @Override
    public void reset() {
        punishmentLevel = 1;
        defectCount = 0;
        rounds = 0;
        punishmentStreak = 0;
    }
}
