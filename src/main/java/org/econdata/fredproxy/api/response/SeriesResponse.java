package org.econdata.fredproxy.api.response;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.swagger.v3.oas.annotations.media.Schema;

import org.econdata.fredproxy.client.fred.FredDateFormats;
import org.econdata.fredproxy.service.dto.SeriesMetadata;

/** Response DTO for series metadata, using FRED's field names. */
@Schema(description = "Economic data series metadata")
public record SeriesResponse(
    @Schema(description = "FRED series id", example = "SP500") String id,
    @JsonProperty("realtime_start") LocalDate realtimeStart,
    @JsonProperty("realtime_end") LocalDate realtimeEnd,
    String title,
    @JsonProperty("observation_start") LocalDate observationStart,
    @JsonProperty("observation_end") LocalDate observationEnd,
    @Schema(example = "Daily, Close") String frequency,
    @JsonProperty("frequency_short") String frequencyShort,
    String units,
    @JsonProperty("units_short") String unitsShort,
    @JsonProperty("seasonal_adjustment") String seasonalAdjustment,
    @JsonProperty("seasonal_adjustment_short") String seasonalAdjustmentShort,
    @Schema(
            description = "Time of the last update at offset UTC",
            type = "string",
            example = "2024-01-02 20:11:04+00")
        @JsonProperty("last_updated")
        @JsonSerialize(using = FredDateFormats.LastUpdatedSerializer.class)
        OffsetDateTime lastUpdated,
    int popularity,
    String notes) {

  public static SeriesResponse from(SeriesMetadata metadata) {
    return new SeriesResponse(
        metadata.id(),
        metadata.realtimeStart(),
        metadata.realtimeEnd(),
        metadata.title(),
        metadata.observationStart(),
        metadata.observationEnd(),
        metadata.frequency(),
        metadata.frequencyShort(),
        metadata.units(),
        metadata.unitsShort(),
        metadata.seasonalAdjustment(),
        metadata.seasonalAdjustmentShort(),
        metadata.lastUpdated(),
        metadata.popularity(),
        metadata.notes());
  }
}
