package edu.brandeis.cosi103a.dilemma.strategy;

import edu.brandeis.cosi103a.dilemma.engine.Action;
import org.junit.jupiter.api.Test;

import static edu.brandeis.cosi103a.dilemma.strategy.StrategyTestSupport.h;
import static edu.brandeis.cosi103a.dilemma.strategy.StrategyTestSupport.play;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Rule tests for the strategies that never draw random numbers.
 */
class DeterministicStrategiesTest {

    @Test
    void constantStrategies() {
        assertEquals("CCCC", play(new AlwaysCooperateStrategy(), "DDDD"));
        assertEquals("DDDD", play(new AlwaysDefectStrategy(), "CCCC"));
    }

    @Test
    void titForTatOpensWithCooperationThenMirrors() {
        assertEquals("CCDDC", play(new TitForTatStrategy(), "CDDCC"));
    }

    @Test
    void forgivingTitForTatNeedsTwoRecentDefections() {
        ForgivingTitForTatStrategy s = new ForgivingTitForTatStrategy();

        assertEquals(Action.COOPERATE, s.decide(h("DD"), h("DD")));
        assertEquals(Action.DEFECT, s.decide(h("CCC"), h("CDD")));
        assertEquals(Action.DEFECT, s.decide(h("CCC"), h("DCD")));
        assertEquals(Action.COOPERATE, s.decide(h("CCC"), h("DCC")));
        assertEquals(Action.COOPERATE, s.decide(h("CCCC"), h("DDCC")));
    }

    @Test
    void grudgeNeverForgivesWithinAMatch() {
        GrudgeStrategy grudge = new GrudgeStrategy();

        assertEquals("CCCDDDD", play(grudge, "CCDCCCC"));
        assertTrue(grudge.isHoldingGrudge());
    }

    @Test
    void grudgeResetClearsTheGrudge() {
        GrudgeStrategy grudge = new GrudgeStrategy();
        play(grudge, "DC");

        grudge.reset();

        assertFalse(grudge.isHoldingGrudge());
        assertEquals(Action.COOPERATE, grudge.decide(h(""), h("")));
        assertEquals(Action.COOPERATE, grudge.decide(h("C"), h("C")));
    }

    @Test
    void winStayLoseShift() {
        WinStayLoseShiftStrategy s = new WinStayLoseShiftStrategy();

        assertEquals(Action.COOPERATE, s.decide(h(""), h("")));
        assertEquals(Action.COOPERATE, s.decide(h("C"), h("C")));
        assertEquals(Action.DEFECT, s.decide(h("D"), h("C")));
        assertEquals(Action.DEFECT, s.decide(h("C"), h("D")));
        assertEquals(Action.COOPERATE, s.decide(h("D"), h("D")));
    }

    @Test
    void pavlovTable() {
        PavlovStrategy s = new PavlovStrategy();

        assertEquals(Action.COOPERATE, s.decide(h(""), h("")));
        assertEquals(Action.COOPERATE, s.decide(h("C"), h("C")));
        assertEquals(Action.DEFECT, s.decide(h("D"), h("C")));
        assertEquals(Action.DEFECT, s.decide(h("C"), h("D")));
        assertEquals(Action.COOPERATE, s.decide(h("D"), h("D")));
    }

    @Test
    void twoCoopOneDefectCyclesRegardlessOfOpponent() {
        TwoCoopOneDefectStrategy s = new TwoCoopOneDefectStrategy();

        assertEquals("CCDCCDC", play(s, "DDDDDDD"));
        s.reset();
        assertEquals("CCD", play(s, "CCC"));
    }

    @Test
    void adaptiveFollowsOpponentCooperationRate() {
        AdaptiveStrategy s = new AdaptiveStrategy();

        assertEquals(Action.COOPERATE, s.decide(h(""), h("")));
        assertEquals(Action.COOPERATE, s.decide(h("CCCCCCCC"), h("CCCCCCCD")));
        assertEquals(0.875, s.getCooperationRate(), 1e-9);
        assertEquals(Action.DEFECT, s.decide(h("CCCC"), h("DDDC")));
        assertEquals(Action.DEFECT, s.decide(h("CCCC"), h("CDCD")));
        assertEquals(Action.COOPERATE, s.decide(h("CCCC"), h("DCDC")));
    }

    @Test
    void gradualAnswersNthBetrayalWithNDefections() {
        GradualStrategy s = new GradualStrategy();

        assertEquals(Action.DEFECT, s.decide(h("C"), h("D")));
        assertEquals(Action.COOPERATE, s.decide(h("CD"), h("DC")));
        assertEquals(Action.DEFECT, s.decide(h("CDC"), h("DCD")));
        // Defection against our own defection is not a betrayal
        assertEquals(Action.DEFECT, s.decide(h("CDCD"), h("DCDD")));
        assertEquals(Action.COOPERATE, s.decide(h("CDCDD"), h("DCDDC")));
        assertEquals(2, s.getDefectCount());

        s.reset();
        assertEquals(0, s.getDefectCount());
    }

    @Test
    void punishmentEscalationGrowsStreaks() {
        PunishmentEscalationStrategy s = new PunishmentEscalationStrategy();

        // 1st defection: streak 0; 2nd: streak 1
        assertEquals("CCDCDD", play(s, "CDCDCC"));
    }

    @Test
    void punishmentEscalationPunishesRelentlessDefector() {
        PunishmentEscalationStrategy s = new PunishmentEscalationStrategy();

        assertEquals("C" + "D".repeat(39), play(s, "D".repeat(40)));
    }

    @Test
    void punishmentEscalationForgivesAfterStreak() {
        PunishmentEscalationStrategy s = new PunishmentEscalationStrategy();
        play(s, "DDDD");
        s.reset();

        assertEquals("CCDC", play(s, "CDCC"));
    }

    @Test
    void adaptivePunishmentScalesWithDefectionRate() {
        AdaptivePunishmentStrategy hostile = new AdaptivePunishmentStrategy();
        assertEquals("CDDDDC", play(hostile, "DCCCCC"));
        assertEquals(3, hostile.getPunishmentLevel());

        AdaptivePunishmentStrategy mild = new AdaptivePunishmentStrategy();
        assertEquals("CCCCDDC", play(mild, "CCCDCCC"));
        assertEquals(1, mild.getPunishmentLevel());
    }

    @Test
    void rewardPunishmentCounterIsBounded() {
        RewardPunishmentStrategy s = new RewardPunishmentStrategy();

        assertEquals("CDDDC", play(s, "DDDCC"));
        assertEquals(4, s.getPunishmentCounter());

        s.reset();
        assertEquals(0, s.getPunishmentCounter());
    }

    @Test
    void escapeTigerExploitsUnpunishedProbe() {
        EscapeTigerStrategy s = new EscapeTigerStrategy();

        assertEquals("CCCCCDDD", play(s, "CCCCCCCC"));
        assertTrue(s.isExploiting());
    }

    @Test
    void escapeTigerStopsExploitingOnRetaliation() {
        EscapeTigerStrategy s = new EscapeTigerStrategy();

        assertEquals("CCCCCDDC", play(s, "CCCCCCDC"));
        assertFalse(s.isExploiting());
    }

    @Test
    void escapeTigerBacksOffWhenProbeIsPunished() {
        EscapeTigerStrategy s = new EscapeTigerStrategy();

        assertEquals("CCCCCDC", play(s, "CCCCCDC"));
        assertFalse(s.isExploiting());
    }
}
