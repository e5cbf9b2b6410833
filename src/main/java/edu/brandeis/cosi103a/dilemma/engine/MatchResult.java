package edu.brandeis.cosi103a.dilemma.engine;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of all matches played between one ordered pair of strategies.
 *
 * <p>The four lists are indexed by match and always have the same length.
 * Each history holds one action per round, oldest first.
 */
public record MatchResult(
    ImmutableList<Integer> scoresA,
    ImmutableList<Integer> scoresB,
    ImmutableList<ImmutableList<Action>> historiesA,
    ImmutableList<ImmutableList<Action>> historiesB
) {

    public MatchResult {
        int n = scoresA.size();
        if (scoresB.size() != n || historiesA.size() != n || historiesB.size() != n) {
            throw new IllegalArgumentException("Scores and histories must cover the same matches");
        }
    }

    public int matchCount() {
        return scoresA.size();
    }

    public double averageScoreA() {
        return ScoreStatistics.average(scoresA);
    }

    public double averageScoreB() {
        return ScoreStatistics.average(scoresB);
    }

    public int minScoreA() {
        return ScoreStatistics.minimum(scoresA);
    }

    public int minScoreB() {
        return ScoreStatistics.minimum(scoresB);
    }

    public int medianScoreA() {
        return ScoreStatistics.median(scoresA);
    }

    public int medianScoreB() {
        return ScoreStatistics.median(scoresB);
    }

    public double firstQuartileA() {
        return ScoreStatistics.firstQuartile(scoresA);
    }

    public double firstQuartileB() {
        return ScoreStatistics.firstQuartile(scoresB);
    }

    /**
     * Counts matches won by each side by comparing match totals.
     */
    public WinRecord winRecord() {
        int winsA = 0;
        int winsB = 0;
        int draws = 0;
        for (int i = 0; i < scoresA.size(); i++) {
            int cmp = Integer.compare(scoresA.get(i), scoresB.get(i));
            if (cmp > 0) {
                winsA++;
            } else if (cmp < 0) {
                winsB++;
            } else {
                draws++;
            }
        }
        return new WinRecord(winsA, winsB, draws);
    }

    /**
     * Renders a history as a string of action symbols, e.g. {@code "CCDC"}.
     */
    public static String encode(List<Action> history) {
        StringBuilder sb = new StringBuilder(history.size());
        for (Action action : history) {
            sb.append(action.symbol());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        WinRecord wins = winRecord();
        return String.format("matches=%d, A: %s avg=%.2f min=%d, B: %s avg=%.2f min=%d, %s",
            matchCount(), scoresA, averageScoreA(), minScoreA(), scoresB, averageScoreB(), minScoreB(), wins);
    }

    /**
     * Match-by-match comparison of totals.
     */
    public record WinRecord(int winsA, int winsB, int draws) {
        @Override
        public String toString() {
            return String.format("A wins %d, B wins %d, draws %d", winsA, winsB, draws);
        }
    }
}
