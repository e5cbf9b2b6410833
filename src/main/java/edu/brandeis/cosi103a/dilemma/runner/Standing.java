package edu.brandeis.cosi103a.dilemma.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A strategy's final position. Ranks start at 1.
 */
public record Standing(
    @JsonProperty("rank") int rank,
    @JsonProperty("name") String name,
    @JsonProperty("score") double score
) {}
