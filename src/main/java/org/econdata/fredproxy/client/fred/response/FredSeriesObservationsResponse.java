package org.econdata.fredproxy.client.fred.response;

import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import org.econdata.fredproxy.client.fred.FredDateFormats;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FredSeriesObservationsResponse(
    @JsonProperty("realtime_start")
        @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
        LocalDate realtimeStart,
    @JsonProperty("realtime_end")
        @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
        LocalDate realtimeEnd,
    @JsonProperty("observation_start")
        @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
        LocalDate observationStart,
    @JsonProperty("observation_end")
        @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
        LocalDate observationEnd,
    String units,
    @JsonProperty("sort_order") String sortOrder,
    Integer count,
    Integer offset,
    Integer limit,
    List<Observation> observations) {

  /** Observations of this page, never null. */
  public List<Observation> observationsOrEmpty() {
    return observations != null ? observations : List.of();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Observation(
      @JsonProperty("realtime_start")
          @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
          LocalDate realtimeStart,
      @JsonProperty("realtime_end")
          @JsonDeserialize(using = FredDateFormats.OptionalDateDeserializer.class)
          LocalDate realtimeEnd,
      LocalDate date,
      String value) {}
}
