package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Cooperates, but after five rounds of mutual cooperation defects once as a probe.
 * If the probe goes unpunished it keeps defecting until the opponent retaliates;
 * if it is punished it goes back to cooperating.
 */
@StrategyDescription("Probes long cooperation with a defection and exploits if unpunished")
public class EscapeTigerStrategy extends NamedStrategy {

    static final int PROBE_AFTER = 5;

    private int coopStreak;
    private boolean probing;
    private boolean exploiting;

    public EscapeTigerStrategy() {
        this("EscapeTiger");
    }

    public EscapeTigerStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        Action opponentLast = StrategyHelpers.last(opponentHistory);
        if (StrategyHelpers.last(ownHistory) == Action.COOPERATE && opponentLast == Action.COOPERATE) {
            coopStreak++;
        } else {
            coopStreak = 0;
        }

        if (probing) {
            probing = false;
            exploiting = opponentLast == Action.COOPERATE;
            return exploiting ? Action.DEFECT : Action.COOPERATE;
        }

        if (exploiting) {
            if (opponentLast == Action.DEFECT) {
                exploiting = false;
                return Action.COOPERATE;
            }
            return Action.DEFECT;
        }

        if (coopStreak >= PROBE_AFTER) {
            probing = true;
            coopStreak = 0;
            return Action.DEFECT;
        }
        return Action.COOPERATE;
    }

    boolean isExploiting() {
        return exploiting;
    }

    @Override
    public void reset() {
        coopStreak = 0;
        probing = false;
        exploiting = false;
    }
}
