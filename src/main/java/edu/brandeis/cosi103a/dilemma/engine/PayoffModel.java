package edu.brandeis.cosi103a.dilemma.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payoff matrix and sizing for every match of a run.
 *
 * @param defectWin       score for defecting against a cooperator
 * @param mutualCooperate score each side gets when both cooperate
 * @param mutualDefect    score each side gets when both defect
 * @param cooperateLoss   score for cooperating against a defector
 * @param roundsPerMatch  rounds in one match
 * @param matchesPerPair  independent matches played by each pair
 * @throws InvalidConfigurationException unless
 *         {@code defectWin > mutualCooperate > mutualDefect >= cooperateLoss}
 *         and both sizes are positive, and unless a match total of
 *         {@code roundsPerMatch} rounds at the largest payoff magnitude fits in an {@code int}
 */
public record PayoffModel(
    @JsonProperty("defectWin") int defectWin,
    @JsonProperty("mutualCooperate") int mutualCooperate,
    @JsonProperty("mutualDefect") int mutualDefect,
    @JsonProperty("cooperateLoss") int cooperateLoss,
    @JsonProperty("roundsPerMatch") int roundsPerMatch,
    @JsonProperty("matchesPerPair") int matchesPerPair
) {

    public static final int DEFAULT_ROUNDS = 500;
    public static final int DEFAULT_MATCHES = 30;

    public PayoffModel {
        if (!(defectWin > mutualCooperate && mutualCooperate > mutualDefect && mutualDefect >= cooperateLoss)) {
            throw new InvalidConfigurationException(String.format(
                "Payoffs must satisfy defectWin(%d) > mutualCooperate(%d) > mutualDefect(%d) >= cooperateLoss(%d)",
                defectWin, mutualCooperate, mutualDefect, cooperateLoss));
        }
        if (roundsPerMatch <= 0 || matchesPerPair <= 0) {
            throw new InvalidConfigurationException(String.format(
                "roundsPerMatch(%d) and matchesPerPair(%d) must be positive", roundsPerMatch, matchesPerPair));
        }
        long largestPayoff = Math.max(Math.abs((long) defectWin), Math.abs((long) cooperateLoss));
        if (largestPayoff * roundsPerMatch > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException(String.format(
                "A match of %d rounds at payoff magnitude %d overflows the score range (max %d)",
                roundsPerMatch, largestPayoff, Integer.MAX_VALUE));
        }
    }

    /**
     * The classic 5/3/1/0 matrix with default sizing.
     */
    public static PayoffModel defaults() {
        return new PayoffModel(5, 3, 1, 0, DEFAULT_ROUNDS, DEFAULT_MATCHES);
    }

    /**
     * Looks up the score pair for one round.
     */
    public RoundPayoff score(Action a, Action b) {
        if (a == Action.DEFECT && b == Action.DEFECT) {
            return new RoundPayoff(mutualDefect, mutualDefect);
        }
        if (a == Action.COOPERATE && b == Action.COOPERATE) {
            return new RoundPayoff(mutualCooperate, mutualCooperate);
        }
        if (a == Action.DEFECT) {
            return new RoundPayoff(defectWin, cooperateLoss);
        }
        return new RoundPayoff(cooperateLoss, defectWin);
    }

    /**
     * Copy with different sizing, same payoffs.
     */
    public PayoffModel withSizing(int rounds, int matches) {
        return new PayoffModel(defectWin, mutualCooperate, mutualDefect, cooperateLoss, rounds, matches);
    }

    @Override
    public String toString() {
        return String.format("PayoffModel(defectWin=%d, mutualCooperate=%d, mutualDefect=%d, cooperateLoss=%d, rounds=%d, matches=%d)",
            defectWin, mutualCooperate, mutualDefect, cooperateLoss, roundsPerMatch, matchesPerPair);
    }

    /**
     * Scores awarded to each side for a single round.
     */
    public record RoundPayoff(int first, int second) {}
}
