package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Switches between tit-for-tat, always-defect and always-cooperate. Every ten decisions
 * it replays each candidate against the opponent's last ten moves, scores the replay with
 * its own fixed table, and adopts the best one (earlier candidates win ties).
 */
@StrategyDescription("Every 10 rounds adopts whichever simple policy would have scored best")
public class HybridStrategy extends NamedStrategy {

    static final int EVALUATION_WINDOW = 10;

    /**
     * Replay scores, independent of the tournament's payoff model.
     */
    static final int REWARD = 3;
    static final int TEMPTATION = 5;
    static final int SUCKER = -2;
    static final int PUNISHMENT = 1;

    /**
     * The simple policies the hybrid chooses between, in tie-break order.
     */
    public enum Mode {
        TIT_FOR_TAT {
            @Override
            Action act(List<Action> opponentHistory) {
                return StrategyHelpers.mirror(opponentHistory);
            }
        },
        ALWAYS_DEFECT {
            @Override
            Action act(List<Action> opponentHistory) {
                return Action.DEFECT;
            }
        },
        ALWAYS_COOPERATE {
            @Override
            Action act(List<Action> opponentHistory) {
                return Action.COOPERATE;
            }
        };

        abstract Action act(List<Action> opponentHistory);
    }

    private Mode current = Mode.TIT_FOR_TAT;
    private int rounds;
    private int lastSwitch;

    public HybridStrategy() {
        this("Hybrid");
    }

    public HybridStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        rounds++;
        if (rounds - lastSwitch >= EVALUATION_WINDOW) {
            evaluate(opponentHistory);
            lastSwitch = rounds;
        }
        return current.act(opponentHistory);
    }

    private void evaluate(List<Action> opponentHistory) {
        int n = opponentHistory.size();
        if (n < EVALUATION_WINDOW) {
            return;
        }
        List<Action> recent = opponentHistory.subList(n - EVALUATION_WINDOW, n);

        Mode best = current;
        int bestScore = Integer.MIN_VALUE;
        for (Mode mode : Mode.values()) {
            int score = replay(mode, recent);
            if (score > bestScore) {
                bestScore = score;
                best = mode;
            }
        }
        current = best;
    }

    /**
     * Scores a policy as if it had played the window from scratch.
     */
    static int replay(Mode mode, List<Action> window) {
        int score = 0;
        for (int i = 0; i < window.size(); i++) {
            Action own = mode.act(window.subList(0, i));
            Action opponent = window.get(i);
            if (own == Action.COOPERATE) {
                score += opponent == Action.COOPERATE ? REWARD : SUCKER;
            } else {
                score += opponent == Action.COOPERATE ? TEMPTATION : PUNISHMENT;
            }
        }
        return score;
    }

    public Mode getCurrentMode() {
        return current;
    }

    @Override
    public void reset() {
        current = Mode.TIT_FOR_TAT;
        rounds = 0;
        lastSwitch = 0;
    }
}
