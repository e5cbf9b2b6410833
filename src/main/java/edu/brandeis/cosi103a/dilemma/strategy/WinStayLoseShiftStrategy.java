package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Counts a round as won when the opponent cooperated: repeats its own last action after
 * a win and switches after a loss.
 */
@StrategyDescription("Repeats its move when the opponent cooperated, switches otherwise")
public class WinStayLoseShiftStrategy extends NamedStrategy {

    public WinStayLoseShiftStrategy() {
        this("WinStayLoseShift");
    }

    public WinStayLoseShiftStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (ownHistory.isEmpty() || opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }
        Action lastOwn = StrategyHelpers.last(ownHistory);
        if (StrategyHelpers.last(opponentHistory) == Action.COOPERATE) {
            return lastOwn;
        }
        return lastOwn.flip();
    }
}
