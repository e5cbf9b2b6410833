package edu.brandeis.cosi103a.dilemma.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration for a single roster entry.
 *
 * @param name   display name
 * @param source a catalog name (e.g. "TitForTat") or {@code classpath:<class-name>}
 */
public record StrategyConfig(
    @JsonProperty("name") String name,
    @JsonProperty("source") String source
) {

    public static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Parses {@code Name}, {@code Alias=Name} or {@code Alias=classpath:<class-name>}.
     *
     * @throws IllegalArgumentException if either side is blank
     */
    public static StrategyConfig parse(String entry) {
        if (entry == null || entry.isBlank()) {
            throw new IllegalArgumentException("Empty strategy entry");
        }
        int eq = entry.indexOf('=');
        if (eq < 0) {
            return new StrategyConfig(entry.trim(), entry.trim());
        }
        String name = entry.substring(0, eq).trim();
        String source = entry.substring(eq + 1).trim();
        if (name.isEmpty() || source.isEmpty()) {
            throw new IllegalArgumentException("Invalid strategy entry: " + entry);
        }
        return new StrategyConfig(name, source);
    }

    @JsonIgnore
    public boolean isClasspath() {
        return source.startsWith(CLASSPATH_PREFIX);
    }
}
