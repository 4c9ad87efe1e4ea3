package org.econdata.fredproxy.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.econdata.fredproxy.api.response.ApiErrorResponse;
import org.econdata.fredproxy.api.response.SeriesResponse;
import org.econdata.fredproxy.exception.InvalidRequestException;
import org.econdata.fredproxy.service.SeriesService;

@Tag(name = "Series Handler", description = "Endpoints for querying series metadata")
@RestController
@RequestMapping(path = "/v0/series")
public class SeriesController {

  private static final Logger log = LoggerFactory.getLogger(SeriesController.class);

  private final SeriesService seriesService;

  public SeriesController(SeriesService seriesService) {
    this.seriesService = seriesService;
  }

  @Operation(
      summary = "Get series metadata",
      description = "Get the current metadata of a series from FRED and refresh the cached copy")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = SeriesResponse.class))),
        @ApiResponse(
            responseCode = "404",
            description = "Series not known to FRED",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "", produces = "application/json")
  public SeriesResponse getSeries(
      @Parameter(description = "FRED series id", example = "SP500") @RequestParam("series_id")
          String seriesId) {
    log.info("Received getSeries request - series_id: {}", seriesId);

    if (seriesId.isBlank()) {
      throw new InvalidRequestException("series_id must not be blank");
    }

    return SeriesResponse.from(seriesService.refresh(seriesId.trim()));
  }
}
