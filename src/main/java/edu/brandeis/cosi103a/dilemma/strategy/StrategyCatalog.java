package edu.brandeis.cosi103a.dilemma.strategy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * The built-in strategies, in the order the default roster plays them.
 *
 * <p>Lookups ignore case. Every factory takes the display name and the run's random
 * source; deterministic strategies ignore the latter.
 */
public final class StrategyCatalog {

    private static final ImmutableMap<String, BiFunction<String, RandomSource, Strategy>> FACTORIES =
        ImmutableMap.<String, BiFunction<String, RandomSource, Strategy>>builder()
            .put("TitForTat", (name, random) -> new TitForTatStrategy(name))
            .put("AlwaysDefect", (name, random) -> new AlwaysDefectStrategy(name))
            .put("AlwaysCooperate", (name, random) -> new AlwaysCooperateStrategy(name))
            .put("Random", RandomStrategy::new)
            .put("ForgivingTitForTat", (name, random) -> new ForgivingTitForTatStrategy(name))
            .put("Gradual", (name, random) -> new GradualStrategy(name))
            .put("PatternDetector", (name, random) -> new PatternDetectorStrategy(name))
            .put("Adaptive", (name, random) -> new AdaptiveStrategy(name))
            .put("WinStayLoseShift", (name, random) -> new WinStayLoseShiftStrategy(name))
            .put("TwoCoopOneDefect", (name, random) -> new TwoCoopOneDefectStrategy(name))
            .put("RewardPunishment", (name, random) -> new RewardPunishmentStrategy(name))
            .put("EscapeTiger", (name, random) -> new EscapeTigerStrategy(name))
            .put("Inching", InchingStrategy::new)
            .put("TrustBuilding", TrustBuildingStrategy::new)
            .put("Grudge", (name, random) -> new GrudgeStrategy(name))
            .put("PunishmentEscalation", (name, random) -> new PunishmentEscalationStrategy(name))
            .put("Consensus", ConsensusStrategy::new)
            .put("Probe", ProbeStrategy::new)
            .put("Capped", CappedStrategy::new)
            .put("ShortMemory", ShortMemoryStrategy::new)
            .put("MediumMemory", MediumMemoryStrategy::new)
            .put("LongMemory", LongMemoryStrategy::new)
            .put("TitForTatStartMediumMemory", TitForTatStartMediumMemoryStrategy::new)
            .put("AdaptivePunishment", (name, random) -> new AdaptivePunishmentStrategy(name))
            .put("GradualForgiving", GradualForgivingStrategy::new)
            .put("PatternMatchingTitForTat", (name, random) -> new PatternMatchingTitForTatStrategy(name))
            .put("FrequencyAnalysis", (name, random) -> new FrequencyAnalysisStrategy(name))
            .put("RhythmDetector", RhythmDetectorStrategy::new)
            .put("Hybrid", (name, random) -> new HybridStrategy(name))
            .put("Pavlov", (name, random) -> new PavlovStrategy(name))
            .build();

    private static final ImmutableMap<String, String> CANONICAL_NAMES;

    static {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (String name : FACTORIES.keySet()) {
            builder.put(name.toLowerCase(Locale.ROOT), name);
        }
        CANONICAL_NAMES = builder.build();
    }

    private StrategyCatalog() {
        // Utility class
    }

    /**
     * Catalog names in roster order.
     */
    public static List<String> names() {
        return FACTORIES.keySet().asList();
    }

    /**
     * Resolves a name case-insensitively to its catalog spelling.
     */
    public static Optional<String> canonicalName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CANONICAL_NAMES.get(name.toLowerCase(Locale.ROOT)));
    }

    public static boolean contains(String name) {
        return canonicalName(name).isPresent();
    }

    /**
     * Creates a strategy under its catalog name.
     *
     * @throws IllegalArgumentException if the name is not in the catalog
     */
    public static Strategy create(String name, RandomSource random) {
        String canonical = canonicalName(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + name));
        return create(canonical, canonical, random);
    }

    /**
     * Creates the catalog strategy {@code catalogName} under a different display name.
     *
     * @throws IllegalArgumentException if the catalog name is unknown
     */
    public static Strategy create(String catalogName, String displayName, RandomSource random) {
        String canonical = canonicalName(catalogName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + catalogName));
        return FACTORIES.get(canonical).apply(displayName, random);
    }

    /**
     * One fresh instance of every built-in strategy, sharing {@code random}.
     */
    public static ImmutableList<Strategy> defaultRoster(RandomSource random) {
        ImmutableList.Builder<Strategy> roster = ImmutableList.builder();
        for (Map.Entry<String, BiFunction<String, RandomSource, Strategy>> entry : FACTORIES.entrySet()) {
            roster.add(entry.getValue().apply(entry.getKey(), random));
        }
        return roster.build();
    }

    /**
     * The one-line description attached to a strategy class, or an empty string.
     */
    public static String describe(Class<?> strategyClass) {
        StrategyDescription description = strategyClass.getAnnotation(StrategyDescription.class);
        return description != null ? description.value() : "";
    }
}
