package edu.brandeis.cosi103a.dilemma.strategy;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static edu.brandeis.cosi103a.dilemma.strategy.StrategyTestSupport.play;
import static org.junit.jupiter.api.Assertions.*;

class StrategyCatalogTest {

    private static final String OPPONENT = "CCDCDDCCCDCCDDDCCCCDCDCCDDCCCDCCCCDD";

    @Test
    void catalogHasThirtyStrategiesInRosterOrder() {
        List<String> names = StrategyCatalog.names();

        assertEquals(30, names.size());
        assertEquals("TitForTat", names.get(0));
        assertEquals("Pavlov", names.get(29));
        assertEquals(names, StrategyCatalog.defaultRoster(RandomSource.seeded(1)).stream()
            .map(Strategy::getName)
            .collect(Collectors.toList()));
    }

    @Test
    void lookupIgnoresCase() {
        assertEquals("TitForTat", StrategyCatalog.canonicalName("titfortat").orElseThrow());
        assertEquals("EscapeTiger", StrategyCatalog.canonicalName("ESCAPETIGER").orElseThrow());
        assertTrue(StrategyCatalog.contains("pavlov"));
        assertFalse(StrategyCatalog.contains("Nope"));
        assertFalse(StrategyCatalog.contains(null));
    }

    @Test
    void createUsesCatalogSpelling() {
        Strategy strategy = StrategyCatalog.create("grudge", RandomSource.seeded(1));

        assertInstanceOf(GrudgeStrategy.class, strategy);
        assertEquals("Grudge", strategy.getName());
    }

    @Test
    void createWithDisplayName() {
        Strategy strategy = StrategyCatalog.create("TitForTat", "Copycat", RandomSource.seeded(1));

        assertInstanceOf(TitForTatStrategy.class, strategy);
        assertEquals("Copycat", strategy.getName());
    }

    @Test
    void unknownNameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> StrategyCatalog.create("Nope", RandomSource.seeded(1)));
        assertTrue(e.getMessage().contains("Nope"));
    }

    @Test
    void defaultRosterBuildsFreshInstances() {
        List<Strategy> first = StrategyCatalog.defaultRoster(RandomSource.seeded(1));
        List<Strategy> second = StrategyCatalog.defaultRoster(RandomSource.seeded(1));

        for (int i = 0; i < first.size(); i++) {
            assertNotSame(first.get(i), second.get(i), first.get(i).getName());
        }
    }

    @Test
    void resetRestoresInitialBehaviour() {
        for (String name : StrategyCatalog.names()) {
            ReseedableSource random = new ReseedableSource();
            Strategy strategy = StrategyCatalog.create(name, random);

            String firstMatch = play(strategy, OPPONENT);
            strategy.reset();
            random.reseed();
            String secondMatch = play(strategy, OPPONENT);

            assertEquals(firstMatch, secondMatch, name + " carried state across reset");
        }
    }

    @Test
    void describeReadsAnnotation() {
        assertFalse(StrategyCatalog.describe(TitForTatStrategy.class).isEmpty());
        assertEquals("", StrategyCatalog.describe(String.class));
    }

    private static final class ReseedableSource implements RandomSource {
        private Random random = new Random(7);

        void reseed() {
            random = new Random(7);
        }

        @Override
        public double nextDouble() {
            return random.nextDouble();
        }
    }
}
