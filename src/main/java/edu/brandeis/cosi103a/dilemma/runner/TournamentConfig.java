package edu.brandeis.cosi103a.dilemma.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.dilemma.engine.PayoffModel;

import java.util.List;

/**
 * Top-level tournament configuration parsed from CLI args or an API request.
 *
 * @param name       tournament name, also its output directory
 * @param payoffs    payoff matrix and sizing
 * @param seed       seed for the shared random source, or null for an unseeded one
 * @param strategies roster entries in play order
 */
public record TournamentConfig(
    @JsonProperty("name") String name,
    @JsonProperty("payoffs") PayoffModel payoffs,
    @JsonProperty("seed") Long seed,
    @JsonProperty("strategies") List<StrategyConfig> strategies
) {

    /**
     * Convenience constructor for an unseeded run.
     */
    public TournamentConfig(String name, PayoffModel payoffs, List<StrategyConfig> strategies) {
        this(name, payoffs, null, strategies);
    }
}
