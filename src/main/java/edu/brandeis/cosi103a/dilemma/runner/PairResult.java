package edu.brandeis.cosi103a.dilemma.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.dilemma.engine.MatchResult;

/**
 * One pair-run within a tournament, under the roster's deduplicated names.
 *
 * @param nameA     first strategy's name
 * @param nameB     second strategy's name
 * @param result    every match the two played
 * @param quartileA first-quartile match total for A
 * @param quartileB first-quartile match total for B
 */
public record PairResult(
    @JsonProperty("nameA") String nameA,
    @JsonProperty("nameB") String nameB,
    @JsonIgnore MatchResult result,
    @JsonProperty("quartileA") double quartileA,
    @JsonProperty("quartileB") double quartileB
) {}
