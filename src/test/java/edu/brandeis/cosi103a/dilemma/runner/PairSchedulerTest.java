package edu.brandeis.cosi103a.dilemma.runner;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PairSchedulerTest {

    @Test
    void allPairs_coversEveryUnorderedPairOnce() {
        List<PairScheduler.Pairing> pairs = PairScheduler.allPairs(5);

        assertEquals(10, pairs.size());
        assertEquals(PairScheduler.pairCount(5), pairs.size());
        Set<PairScheduler.Pairing> unique = new HashSet<>(pairs);
        assertEquals(pairs.size(), unique.size(), "No pair should be scheduled twice");
        for (PairScheduler.Pairing pairing : pairs) {
            assertTrue(pairing.first() < pairing.second(), "Nobody plays themselves: " + pairing);
        }
    }

    @Test
    void allPairs_orderedByFirstThenSecond() {
        List<PairScheduler.Pairing> pairs = PairScheduler.allPairs(3);

        assertEquals(List.of(
            new PairScheduler.Pairing(0, 1),
            new PairScheduler.Pairing(0, 2),
            new PairScheduler.Pairing(1, 2)), pairs);
    }

    @Test
    void allPairs_everyStrategyPlaysSameNumberOfPairs() {
        int n = 7;
        Map<Integer, Integer> counts = new HashMap<>();
        for (PairScheduler.Pairing pairing : PairScheduler.allPairs(n)) {
            counts.merge(pairing.first(), 1, Integer::sum);
            counts.merge(pairing.second(), 1, Integer::sum);
        }

        for (int i = 0; i < n; i++) {
            assertEquals(n - 1, counts.get(i), "Strategy " + i + " should meet every other once");
        }
    }

    @Test
    void allPairs_emptyForTinyRosters() {
        assertTrue(PairScheduler.allPairs(0).isEmpty());
        assertTrue(PairScheduler.allPairs(1).isEmpty());
    }

    @Test
    void dedupeNames_keepsUniqueNames() {
        List<String> names = List.of("TitForTat", "Grudge", "Random");

        assertEquals(names, PairScheduler.dedupeNames(names));
    }

    @Test
    void dedupeNames_suffixesRepeatsInOrder() {
        assertEquals(List.of("TitForTat", "Grudge", "TitForTat_1", "TitForTat_2"),
            PairScheduler.dedupeNames(List.of("TitForTat", "Grudge", "TitForTat", "TitForTat")));
    }

    @Test
    void dedupeNames_skipsSuffixAlreadyTaken() {
        assertEquals(List.of("A", "A_1", "A_2"),
            PairScheduler.dedupeNames(List.of("A", "A_1", "A")));
    }
}
