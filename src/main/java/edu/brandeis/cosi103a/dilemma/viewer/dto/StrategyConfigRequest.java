package edu.brandeis.cosi103a.dilemma.viewer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * DTO for one roster entry in tournament requests. {@code source} defaults to {@code name}.
 */
public record StrategyConfigRequest(
    @JsonProperty("name") @NotBlank String name,
    @JsonProperty("source") String source
) {}
