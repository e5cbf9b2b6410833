package edu.brandeis.cosi103a.dilemma.engine;

/**
 * The choice a strategy makes in a single round.
 */
public enum Action {
    COOPERATE('C'),
    DEFECT('D');

    private final char symbol;

    Action(char symbol) {
        this.symbol = symbol;
    }

    /**
     * One-character form used by the result files.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Returns the other action.
     */
    public Action flip() {
        return this == COOPERATE ? DEFECT : COOPERATE;
    }
}
