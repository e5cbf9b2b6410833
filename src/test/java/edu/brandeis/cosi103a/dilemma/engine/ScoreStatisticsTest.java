package edu.brandeis.cosi103a.dilemma.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoreStatisticsTest {

    private static final double EPSILON = 1e-9;

    @Test
    void firstQuartileInterpolatesBetweenRanks() {
        // position 0.25 * 3 = 0.75 between 10 and 20
        assertEquals(17.5, ScoreStatistics.firstQuartile(List.of(40, 10, 30, 20)), EPSILON);
    }

    @Test
    void firstQuartileOfFiveValuesHitsARank() {
        // position 0.25 * 4 = 1
        assertEquals(2.0, ScoreStatistics.firstQuartile(List.of(5, 4, 3, 2, 1)), EPSILON);
    }

    @Test
    void firstQuartileOfSingleValueIsThatValue() {
        assertEquals(42.0, ScoreStatistics.firstQuartile(List.of(42)), EPSILON);
    }

    @Test
    void firstQuartileOfEmptyListFails() {
        assertThrows(IllegalArgumentException.class, () -> ScoreStatistics.firstQuartile(List.of()));
    }

    @Test
    void percentileEndpointsAreMinAndMax() {
        List<Integer> scores = List.of(7, 3, 9, 1);
        assertEquals(1.0, ScoreStatistics.percentile(scores, 0.0), EPSILON);
        assertEquals(9.0, ScoreStatistics.percentile(scores, 1.0), EPSILON);
    }

    @Test
    void percentileSpanningTheWholeIntRange() {
        List<Integer> scores = List.of(2_000_000_000, -2_000_000_000);
        assertEquals(0.0, ScoreStatistics.percentile(scores, 0.5), EPSILON);
        assertEquals(-1.0e9, ScoreStatistics.firstQuartile(scores), EPSILON);
    }

    @Test
    void percentileRejectsFractionOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ScoreStatistics.percentile(List.of(1), 1.5));
        assertThrows(IllegalArgumentException.class, () -> ScoreStatistics.percentile(List.of(1), -0.1));
    }

    @Test
    void medianIsUpperMiddleElement() {
        assertEquals(30, ScoreStatistics.median(List.of(40, 10, 30, 20)));
        assertEquals(3, ScoreStatistics.median(List.of(5, 1, 3)));
        assertEquals(0, ScoreStatistics.median(List.of()));
    }

    @Test
    void averageAndMinimum() {
        assertEquals(2.5, ScoreStatistics.average(List.of(1, 2, 3, 4)), EPSILON);
        assertEquals(1, ScoreStatistics.minimum(List.of(4, 1, 3)));
        assertEquals(0.0, ScoreStatistics.average(List.of()), EPSILON);
        assertEquals(0, ScoreStatistics.minimum(List.of()));
    }
}
