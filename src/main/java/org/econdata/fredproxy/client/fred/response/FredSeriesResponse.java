package org.econdata.fredproxy.client.fred.response;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import org.econdata.fredproxy.client.fred.FredDateFormats;

/**
 * Response of the FRED {@code /series} endpoint.
 *
 * <p>FRED names the array {@code seriess}; it holds at most one entry for a series id lookup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FredSeriesResponse(
    @JsonProperty("realtime_start")
        @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
        LocalDate realtimeStart,
    @JsonProperty("realtime_end")
        @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
        LocalDate realtimeEnd,
    List<Series> seriess) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Series(
      String id,
      @JsonProperty("realtime_start")
          @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
          LocalDate realtimeStart,
      @JsonProperty("realtime_end")
          @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
          LocalDate realtimeEnd,
      String title,
      @JsonProperty("observation_start")
          @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
          LocalDate observationStart,
      @JsonProperty("observation_end")
          @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
          LocalDate observationEnd,
      String frequency,
      @JsonProperty("frequency_short") String frequencyShort,
      String units,
      @JsonProperty("units_short") String unitsShort,
      @JsonProperty("seasonal_adjustment") String seasonalAdjustment,
      @JsonProperty("seasonal_adjustment_short") String seasonalAdjustmentShort,
      @JsonProperty("last_updated")
          @JsonDeserialize(using = FredDateFormats.LastUpdatedDeserializer.class)
          OffsetDateTime lastUpdated,
      Integer popularity,
      String notes) {}
}
