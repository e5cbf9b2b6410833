package edu.brandeis.cosi103a.dilemma.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;

/**
 * DTO for tournament configuration requests. Omitted payoffs, sizes and strategies
 * fall back to the runner's defaults.
 */
public record TournamentConfigRequest(
    @JsonProperty("tournamentName") @NotBlank @Pattern(regexp = "[A-Za-z0-9_-][A-Za-z0-9._-]*") String tournamentName,
    @JsonProperty("defectWin") Integer defectWin,
    @JsonProperty("mutualCooperate") Integer mutualCooperate,
    @JsonProperty("mutualDefect") Integer mutualDefect,
    @JsonProperty("cooperateLoss") Integer cooperateLoss,
    @JsonProperty("rounds") @Min(1) Integer rounds,
    @JsonProperty("matches") @Min(1) Integer matches,
    @JsonProperty("seed") Long seed,
    @JsonProperty("strategies") @Valid List<StrategyConfigRequest> strategies
) {}
