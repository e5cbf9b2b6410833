package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;

import java.util.List;

/**
 * Takes a little more each time the opponent cooperates and backs off sharply when it
 * defects. The defection probability rises by 0.05 (up to 0.7) and falls by 0.2 (down to 0).
 */
@StrategyDescription("Slowly raises its defection rate while the opponent cooperates")
public class InchingStrategy extends NamedStrategy {

    static final double MAX_DEFECT_RATE = 0.7;

    private final RandomSource random;
    private double defectRate;

    public InchingStrategy(RandomSource random) {
        this("Inching", random);
    }

    public InchingStrategy(String name, RandomSource random) {
        super(name);
        this.random = random;
    }

    @Override
    public Action decide(List<Action> ownHistory, List<Action> opponentHistory) {
        if (opponentHistory.isEmpty()) {
            return Action.COOPERATE;
        }

        if (StrategyHelpers.last(opponentHistory) == Action.COOPERATE) {
            defectRate = Math.min(MAX_DEFECT_RATE, defectRate + 0.05);
        } else {
            defectRate = Math.max(0.0, defectRate - 0.2);
        }

        return random.nextDouble() < defectRate ? Action.DEFECT : Action.COOPERATE;
    }

    public double getDefectRate() {
        return defectRate;
    }

    @Override
    public void reset() {
        defectRate = 0.0;
    }
}
