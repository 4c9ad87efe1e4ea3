package org.econdata.fredproxy.api;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.econdata.fredproxy.api.response.ApiErrorResponse;
import org.econdata.fredproxy.api.response.ObservationResponse;
import org.econdata.fredproxy.exception.InvalidRequestException;
import org.econdata.fredproxy.service.ObservationService;
import org.econdata.fredproxy.service.dto.ObservationQuery;

@Tag(name = "Observations Handler", description = "Endpoints for querying series observations")
@RestController
@RequestMapping(path = "/v0/observations")
public class ObservationController {

  private static final Logger log = LoggerFactory.getLogger(ObservationController.class);

  private final ObservationService observationService;

  public ObservationController(ObservationService observationService) {
    this.observationService = observationService;
  }

  @Operation(
      summary = "Get observations",
      description =
          "Get the observations of a series, served from the local cache where it can answer the"
              + " window. Realtime queries are always forwarded to FRED.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema = @Schema(implementation = ObservationResponse.class)))),
        @ApiResponse(
            responseCode = "400",
            description = "Missing series id or invalid date range",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples =
                        @ExampleObject(
                            name = "Invalid Date Range",
                            value =
                                """
                      {
                        "type": "INVALID_REQUEST",
                        "message": "observation_start must be before or equal to observation_end",
                        "code": "INVALID_REQUEST"
                      }
                      """))),
        @ApiResponse(
            responseCode = "429",
            description = "FRED rate limit exceeded; any other FRED error keeps its status too",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "", produces = "application/json")
  public List<ObservationResponse> getObservations(
      @Parameter(description = "FRED series id", example = "SP500") @RequestParam("series_id")
          String seriesId,
      @Parameter(description = "First observation date (inclusive)", example = "2024-01-01")
          @RequestParam("observation_start")
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> observationStart,
      @Parameter(description = "Last observation date (inclusive)", example = "2024-12-31")
          @RequestParam("observation_end")
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> observationEnd,
      @Parameter(description = "Start of the realtime period, bypasses the cache")
          @RequestParam("realtime_start")
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> realtimeStart,
      @Parameter(description = "End of the realtime period, bypasses the cache")
          @RequestParam("realtime_end")
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> realtimeEnd) {
    log.info(
        "Received getObservations request - series_id: {}, observation_start: {},"
            + " observation_end: {}, realtime_start: {}, realtime_end: {}",
        seriesId,
        observationStart.orElse(null),
        observationEnd.orElse(null),
        realtimeStart.orElse(null),
        realtimeEnd.orElse(null));

    if (seriesId.isBlank()) {
      throw new InvalidRequestException("series_id must not be blank");
    }

    if (observationStart.isPresent()
        && observationEnd.isPresent()
        && observationStart.get().isAfter(observationEnd.get())) {
      throw new InvalidRequestException(
          "observation_start must be before or equal to observation_end");
    }

    var query =
        new ObservationQuery(
            seriesId.trim(),
            observationStart.orElse(null),
            observationEnd.orElse(null),
            realtimeStart.orElse(null),
            realtimeEnd.orElse(null));

    return observationService.getObservations(query).stream()
        .map(ObservationResponse::from)
        .toList();
  }
}
