package edu.brandeis.cosi103a.dilemma.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata for a discovered Strategy implementation on the classpath.
 *
 * @param simpleName               simple class name (e.g., "TitForTatStrategy")
 * @param className                fully-qualified class name
 * @param displayName              simple name if unique, full name if duplicates exist
 * @param description              from the StrategyDescription annotation, or empty
 * @param hasZeroArgConstructor    public {@code ()} constructor
 * @param hasNameConstructor       public {@code (String)} constructor
 * @param hasRandomConstructor     public {@code (RandomSource)} constructor
 * @param hasNameRandomConstructor public {@code (String, RandomSource)} constructor
 */
public record DiscoveredStrategy(
        @JsonProperty("simpleName") String simpleName,
        @JsonProperty("className") String className,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("hasZeroArgConstructor") boolean hasZeroArgConstructor,
        @JsonProperty("hasNameConstructor") boolean hasNameConstructor,
        @JsonProperty("hasRandomConstructor") boolean hasRandomConstructor,
        @JsonProperty("hasNameRandomConstructor") boolean hasNameRandomConstructor
) {
    /**
     * Whether any supported constructor is available.
     */
    public boolean isInstantiable() {
        return hasZeroArgConstructor || hasNameConstructor || hasRandomConstructor || hasNameRandomConstructor;
    }

    /**
     * Whether the strategy takes a random source.
     */
    public boolean isProbabilistic() {
        return hasRandomConstructor || hasNameRandomConstructor;
    }
}
