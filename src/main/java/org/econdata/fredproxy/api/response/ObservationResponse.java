package org.econdata.fredproxy.api.response;

import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

import org.econdata.fredproxy.service.dto.ObservationData;

/** Response DTO for a single observation. */
@Schema(description = "Observation of an economic data series")
public record ObservationResponse(
    @Schema(
            description = "Observation date",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-01-02")
        LocalDate date,
    @Schema(
            description = "Observation value as reported by FRED; \".\" marks a missing value",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "4742.83")
        String value) {

  public static ObservationResponse from(ObservationData observation) {
    return new ObservationResponse(observation.date(), observation.value());
  }
}
