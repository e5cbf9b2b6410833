package edu.brandeis.cosi103a.dilemma.runner;

import edu.brandeis.cosi103a.dilemma.strategy.RandomSource;
import edu.brandeis.cosi103a.dilemma.strategy.Strategy;
import edu.brandeis.cosi103a.dilemma.strategy.StrategyCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyDiscoveryServiceTest {

    private static final String PACKAGE = "edu.brandeis.cosi103a.dilemma.strategy.";

    private StrategyDiscoveryService service;

    @BeforeEach
    void setUp() {
        service = new StrategyDiscoveryService();
        service.initialize();
    }

    @Test
    void discoversEveryBuiltInStrategy() {
        List<DiscoveredStrategy> strategies = service.getDiscoveredStrategies();

        for (Strategy builtIn : StrategyCatalog.defaultRoster(RandomSource.seeded(1))) {
            String className = builtIn.getClass().getName();
            assertTrue(strategies.stream().anyMatch(s -> s.className().equals(className)),
                "Should discover " + className);
        }
    }

    @Test
    void skipsAbstractBaseClass() {
        assertTrue(service.findByClassName(PACKAGE + "NamedStrategy").isEmpty());
    }

    @Test
    void recordsConstructorShapes() {
        DiscoveredStrategy tft = service.findByClassName(PACKAGE + "TitForTatStrategy").orElseThrow();
        assertTrue(tft.hasZeroArgConstructor());
        assertTrue(tft.hasNameConstructor());
        assertFalse(tft.isProbabilistic());

        DiscoveredStrategy random = service.findByClassName(PACKAGE + "RandomStrategy").orElseThrow();
        assertTrue(random.hasRandomConstructor());
        assertTrue(random.hasNameRandomConstructor());
        assertTrue(random.isProbabilistic());
    }

    @Test
    void readsDescriptionAnnotation() {
        DiscoveredStrategy grudge = service.findByClassName(PACKAGE + "GrudgeStrategy").orElseThrow();

        assertFalse(grudge.description().isEmpty());
    }

    @Test
    void createsStrategyWithName() throws Exception {
        DiscoveredStrategy discovered = service.findByClassName(PACKAGE + "ProbeStrategy").orElseThrow();

        Strategy strategy = service.createStrategy(discovered, "Prober", RandomSource.seeded(1));

        assertEquals("Prober", strategy.getName());
    }

    @Test
    void returnsEmptyForUnknownClassName() {
        assertTrue(service.findByClassName("com.example.NonexistentStrategy").isEmpty());
    }

    @Test
    void getDiscoveredStrategiesReturnsSortedList() {
        List<DiscoveredStrategy> strategies = service.getDiscoveredStrategies();

        for (int i = 1; i < strategies.size(); i++) {
            assertTrue(strategies.get(i - 1).displayName().compareTo(strategies.get(i).displayName()) <= 0,
                "Strategies should be sorted by displayName");
        }
    }

    @Test
    void displayNameEqualsSimpleNameWhenUnique() {
        DiscoveredStrategy pavlov = service.findByClassName(PACKAGE + "PavlovStrategy").orElseThrow();

        assertEquals(pavlov.simpleName(), pavlov.displayName());
    }

    @Test
    void clearThenRescan() {
        service.clear();
        assertTrue(service.getDiscoveredStrategies().isEmpty());

        service.scanClasspath();

        assertFalse(service.getDiscoveredStrategies().isEmpty(), "After rescan, should find strategies again");
    }
}
