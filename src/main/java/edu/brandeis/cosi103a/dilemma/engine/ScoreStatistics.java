package edu.brandeis.cosi103a.dilemma.engine;

import java.util.Arrays;
import java.util.List;

/**
 * Order statistics over per-match score totals.
 */
public final class ScoreStatistics {

    private ScoreStatistics() {
        // Utility class
    }

    /**
     * First quartile using linear interpolation between closest ranks:
     * position {@code 0.25 * (n - 1)} in the ascending sorted values.
     *
     * @throws IllegalArgumentException if {@code scores} is empty
     */
    public static double firstQuartile(List<Integer> scores) {
        return percentile(scores, 0.25);
    }

    /**
     * Linearly interpolated percentile, {@code fraction} in [0, 1].
     */
    public static double percentile(List<Integer> scores, double fraction) {
        if (scores.isEmpty()) {
            throw new IllegalArgumentException("Cannot take a percentile of no scores");
        }
        if (fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("fraction must be in [0, 1], got " + fraction);
        }
        int[] sorted = sorted(scores);
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + ((double) sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Upper-middle element of the sorted values.
     */
    public static int median(List<Integer> scores) {
        if (scores.isEmpty()) {
            return 0;
        }
        int[] sorted = sorted(scores);
        return sorted[sorted.length / 2];
    }

    public static double average(List<Integer> scores) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        long total = 0;
        for (int score : scores) {
            total += score;
        }
        return (double) total / scores.size();
    }

    public static int minimum(List<Integer> scores) {
        int min = Integer.MAX_VALUE;
        for (int score : scores) {
            min = Math.min(min, score);
        }
        return scores.isEmpty() ? 0 : min;
    }

    private static int[] sorted(List<Integer> scores) {
        int[] values = scores.stream().mapToInt(Integer::intValue).toArray();
        Arrays.sort(values);
        return values;
    }
}
