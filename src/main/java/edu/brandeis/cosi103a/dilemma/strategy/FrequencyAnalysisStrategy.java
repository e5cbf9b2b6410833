package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Tracks how often the opponent defects in response to its own cooperation and to its own
 * defection, and picks a reply once five rounds have been played:
 * <ul>
 *   <li>defects if the opponent exploits cooperation (rate above 0.6);</li>
 *   <li>cooperates if the opponent mainly retaliates (rate after defection exceeds the
 *       rate after cooperation by more than 0.3);</li>
 *   <li>defects if the opponent defects often either way (both above 0.4);</li>
 *   <li>otherwise plays tit-for-tat.</li>
 * </ul>
 */
@StrategyDescription("Chooses its reply from the opponent's conditional defection rates")
public class FrequencyAnalysisStrategy extends NamedStrategy {

    static final int MIN_HISTORY = 5;

    private int afterCooperateDefections;
    private int afterCooperateTotal;
    private int afterDefectDefections;
    private int afterDefectTotal;

    public FrequencyAnalysisStrategy() {
        this("FrequencyAnalysis");
    }

    public FrequencyAnalysisStrategy(String name) {
        super(name);
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (ownHistory.size() > 1 && opponentHistory.size() > 1) {
            boolean opponentDefected = StrategyHelpers.last(opponentHistory) == Action.DEFECT;
            if (ownHistory.get(ownHistory.size() - 2) == Action.COOPERATE) {
                afterCooperateTotal++;
                if (opponentDefected) {
                    afterCooperateDefections++;
                }
            } else {
                afterDefectTotal++;
                if (opponentDefected) {
                    afterDefectDefections++;
                }
            }
        }

        if (opponentHistory.size() < MIN_HISTORY) {
            return Action.COOPERATE;
        }

        double afterCooperateRate = (double) afterCooperateDefections / Math.max(1, afterCooperateTotal);
        double afterDefectRate = (double) afterDefectDefections / Math.max(1, afterDefectTotal);

        if (afterCooperateRate > 0.6) {
            return Action.DEFECT;
        } else if (afterDefectRate > afterCooperateRate + 0.3) {
            return Action.COOPERATE;
        } else if (afterCooperateRate > 0.4 && afterDefectRate > 0.4) {
            return Action.DEFECT;
        }
        return StrategyHelpers.mirror(opponentHistory);
    }

    @Override
    public void reset() {
        afterCooperateDefections = 0;
        afterCooperateTotal = 0;
        afterDefectDefections = 0;
        afterDefectTotal = 0;
    }
}
