package edu.brandeis.cosi103a.dilemma.engine;

/**
 * Thrown when a strategy fails to produce an action. Aborts the pair-run in progress.
 */
public class ProtocolViolationException extends RuntimeException {

    private final String strategyName;
    private final int matchIndex;
    private final int roundIndex;

    public ProtocolViolationException(String strategyName, int matchIndex, int roundIndex) {
        super(String.format("Strategy '%s' returned no action in match %d, round %d",
            strategyName, matchIndex + 1, roundIndex + 1));
        this.strategyName = strategyName;
        this.matchIndex = matchIndex;
        this.roundIndex = roundIndex;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public int getMatchIndex() {
        return matchIndex;
    }

    public int getRoundIndex() {
        return roundIndex;
    }
}
