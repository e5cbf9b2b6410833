package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;
import org.junit.jupiter.api.Test;

import java.util.List;

import static edu.brandeis.cosi103a.dilemma.strategy.StrategyTestSupport.fixed;
import static edu.brandeis.cosi103a.dilemma.strategy.StrategyTestSupport.h;
import static edu.brandeis.cosi103a.dilemma.strategy.StrategyTestSupport.play;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the strategies that look for structure in the opponent's history.
 */
class PatternStrategiesTest {

    private static final RandomSource NO_DRAWS = () -> {
        throw new AssertionError("No random draw expected");
    };

    @Test
    void patternDetectorCooperatesOnShortHistory() {
        PatternDetectorStrategy s = new PatternDetectorStrategy();

        assertEquals(3, s.getPatternLength());
        assertEquals(Action.COOPERATE, s.decide(h("DDD"), h("DDD")));
        // Six rounds leave no earlier window to compare against
        assertEquals(Action.COOPERATE, s.decide(h("CCCCCC"), h("CCDCCD")));
    }

    @Test
    void patternDetectorDefectsWhenPatternWasFollowedByDefection() {
        PatternDetectorStrategy s = new PatternDetectorStrategy();

        assertEquals(Action.DEFECT, s.decide(h("CCCCCCC"), h("CCDDCCD")));
        assertEquals(Action.COOPERATE, s.decide(h("CCCCCCC"), h("CCDCCCD")));
    }

    @Test
    void patternMatchingTitForTatIsPlainTitForTatEarly() {
        PatternMatchingTitForTatStrategy s = new PatternMatchingTitForTatStrategy();

        assertEquals("CCDC", play(s, "CDCC"));
    }

    @Test
    void patternMatchingTitForTatPreemptsPredictedDefection() {
        PatternMatchingTitForTatStrategy s = new PatternMatchingTitForTatStrategy();
        String opponent = "DCCC".repeat(3);

        assertEquals(h("DCCC"), s.findRecurringPattern(h(opponent)));
        assertTrue(s.predictDefection(h(opponent), h("DCCC")));
        // Tit-for-tat alone would cooperate here
        assertEquals(Action.DEFECT, s.decide(h("C".repeat(12)), h(opponent)));
    }

    @Test
    void patternMatchingTitForTatFallsBackWithoutRecurrence() {
        PatternMatchingTitForTatStrategy s = new PatternMatchingTitForTatStrategy();

        assertNull(s.findRecurringPattern(h("CCCCCCCD")));
        assertEquals(Action.DEFECT, s.decide(h("C".repeat(12)), h("CCCDCCCDCCCD")));
        assertFalse(s.predictDefection(h("CCCDCCCDCCCD"), h("CCCD")));
    }

    @Test
    void frequencyAnalysisPunishesDefectionAfterCooperation() {
        FrequencyAnalysisStrategy s = new FrequencyAnalysisStrategy();

        assertEquals("CCCCCD", play(s, "DDDDDD"));
    }

    @Test
    void frequencyAnalysisKeepsCooperatingWithCooperator() {
        FrequencyAnalysisStrategy s = new FrequencyAnalysisStrategy();

        assertEquals("C".repeat(10), play(s, "C".repeat(10)));
    }

    @Test
    void rhythmDetectorLatchesAlternation() {
        RhythmDetectorStrategy s = new RhythmDetectorStrategy(NO_DRAWS);

        assertEquals(Action.COOPERATE, s.decide(h("CCCCC"), h("DCDCD")));
        assertEquals(Action.DEFECT, s.decide(h("CCCCCC"), h("DCDCDC")));
        assertEquals(h("DC"), s.getDetectedRhythm());
        assertEquals(Action.COOPERATE, s.decide(h("CCCCCCC"), h("DCDCDCD")));

        s.reset();
        assertNull(s.getDetectedRhythm());
    }

    @Test
    void rhythmDetectorOccasionallyExploitsConstantCooperator() {
        assertEquals(Action.DEFECT, new RhythmDetectorStrategy(fixed(0.05)).decide(h("CCCCCC"), h("CCCCCC")));
        assertEquals(Action.COOPERATE, new RhythmDetectorStrategy(fixed(0.5)).decide(h("CCCCCC"), h("CCCCCC")));
    }

    @Test
    void rhythmDetectorMirrorsWithoutConfidentRhythm() {
        RhythmDetectorStrategy s = new RhythmDetectorStrategy(NO_DRAWS);

        assertEquals(Action.DEFECT, s.decide(h("CCCCCCCC"), h("CCDDCCDD")));
        assertNull(s.getDetectedRhythm());
    }

    @Test
    void rhythmFitIsFractionOfMatchingRounds() {
        assertEquals(1.0, RhythmDetectorStrategy.fit(h("DCDC"), h("DC")), 1e-9);
        assertEquals(0.5, RhythmDetectorStrategy.fit(h("DCDC"), h("D")), 1e-9);
        assertEquals(0.0, RhythmDetectorStrategy.fit(h(""), h("D")), 1e-9);
    }

    @Test
    void hybridReplayScoresEachMode() {
        List<Action> window = h("CDCDCDCDCD");

        assertEquals(13, HybridStrategy.replay(HybridStrategy.Mode.TIT_FOR_TAT, window));
        assertEquals(30, HybridStrategy.replay(HybridStrategy.Mode.ALWAYS_DEFECT, window));
        assertEquals(5, HybridStrategy.replay(HybridStrategy.Mode.ALWAYS_COOPERATE, window));
    }

    @Test
    void hybridSwitchesToDefectionAgainstDefector() {
        HybridStrategy before = new HybridStrategy();
        play(before, "D".repeat(19));
        assertEquals(HybridStrategy.Mode.TIT_FOR_TAT, before.getCurrentMode());

        HybridStrategy after = new HybridStrategy();
        play(after, "D".repeat(20));
        assertEquals(HybridStrategy.Mode.ALWAYS_DEFECT, after.getCurrentMode());

        after.reset();
        assertEquals(HybridStrategy.Mode.TIT_FOR_TAT, after.getCurrentMode());
    }

    @Test
    void hybridExploitsCooperator() {
        HybridStrategy s = new HybridStrategy();

        String moves = play(s, "C".repeat(21));

        assertEquals(HybridStrategy.Mode.ALWAYS_DEFECT, s.getCurrentMode());
        assertTrue(moves.startsWith("C".repeat(19)), moves);
        assertTrue(moves.endsWith("DD"), moves);
    }
}
