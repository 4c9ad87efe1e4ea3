package org.econdata.fredproxy.client.fred;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import org.econdata.fredproxy.client.fred.response.FredErrorResponse;
import org.econdata.fredproxy.client.fred.response.FredSeriesObservationsResponse;
import org.econdata.fredproxy.client.fred.response.FredSeriesResponse;
import org.econdata.fredproxy.config.FredProxyProperties;
import org.econdata.fredproxy.exception.FredApiException;

/**
 * HTTP client for the FRED API.
 *
 * <p>Every request asks for JSON. FRED reports some errors as an {@code error_code}/{@code
 * error_message} body with HTTP 200, so successful bodies are inspected before they are mapped to
 * a response type. No request is retried.
 */
@Component
public class FredClient {

  private static final Logger log = LoggerFactory.getLogger(FredClient.class);

  private static final String USER_AGENT = "FredProxyServiceClient/1.0";
  private static final String OBSERVATIONS_PATH = "/series/observations";
  private static final String SERIES_PATH = "/series";
  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final String fredApiKey;
  private final Duration timeout;
  private final int pageSize;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public FredClient(
      WebClient.Builder webClientBuilder,
      FredProxyProperties properties,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {

    var fredConfig = properties.getFred();

    // properties have @Validated but double checking
    if (fredConfig.getApiKey() == null || fredConfig.getApiKey().isBlank()) {
      throw new IllegalArgumentException("FRED API key must be configured");
    }

    this.fredApiKey = fredConfig.getApiKey();
    this.timeout = Duration.ofSeconds(fredConfig.getTimeoutSeconds());
    this.pageSize = fredConfig.getPageSize();
    this.webClient =
        webClientBuilder
            .baseUrl(fredConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;

    log.info(
        "FredClient initialized with base URL: {}, page size: {}",
        fredConfig.getBaseUrl(),
        pageSize);
  }

  /**
   * Fetches every observation of a series in the requested window, following FRED's offset
   * pagination until a short page is returned.
   *
   * @param seriesId FRED series id, e.g. {@code SP500}
   * @param observationStart first observation date (inclusive), or null for no lower bound
   * @param observationEnd last observation date (inclusive), or null for no upper bound
   * @param realtimeStart start of the realtime period, or null for FRED's default (today)
   * @param realtimeEnd end of the realtime period, or null for FRED's default (today)
   * @return observations of all pages in the order received (ascending by date)
   * @throws FredApiException if any page fails; earlier pages are discarded
   */
  public List<FredSeriesObservationsResponse.Observation> getSeriesObservations(
      String seriesId,
      LocalDate observationStart,
      LocalDate observationEnd,
      LocalDate realtimeStart,
      LocalDate realtimeEnd) {
    log.info(
        "Requesting FRED observations for series: {} observationStart: {} observationEnd: {}"
            + " realtimeStart: {} realtimeEnd: {}",
        seriesId,
        observationStart,
        observationEnd,
        realtimeStart,
        realtimeEnd);

    var observations = new ArrayList<FredSeriesObservationsResponse.Observation>();
    var offset = 0;
    while (true) {
      var url =
          buildSeriesObservationsUrl(
              seriesId, observationStart, observationEnd, realtimeStart, realtimeEnd, offset);
      var page =
          get(url, OBSERVATIONS_PATH, FredSeriesObservationsResponse.class).observationsOrEmpty();
      observations.addAll(page);

      log.debug(
          "Received {} observations for series: {} at offset: {}", page.size(), seriesId, offset);

      if (page.size() < pageSize) {
        break;
      }
      offset += page.size();
    }

    log.info("Fetched {} observations from FRED for series: {}", observations.size(), seriesId);
    return observations;
  }

  /**
   * Fetches the metadata of a series. Not paginated.
   *
   * @param seriesId FRED series id
   * @return the FRED response; {@code seriess} is empty when FRED knows no such series
   * @throws FredApiException on any transport or provider failure
   */
  public FredSeriesResponse getSeries(String seriesId) {
    log.info("Requesting FRED series metadata: {}", seriesId);
    return get(buildSeriesUrl(seriesId), SERIES_PATH, FredSeriesResponse.class);
  }

  private <T> T get(String url, String endpoint, Class<T> responseType) {
    var sample = Timer.start(meterRegistry);
    var status = "success";

    try {
      var body =
          webClient
              .get()
              .uri(url)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(String.class)
              .timeout(timeout)
              .block();

      if (body == null || body.isBlank()) {
        throw new FredApiException(502, "Received empty response from FRED API");
      }

      return readPayload(body, responseType);
    } catch (FredApiException fe) {
      status = String.valueOf(fe.getStatusCode());
      throw fe;
    } catch (Exception e) {
      var cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException || cause instanceof WebClientRequestException) {
        status = "unavailable";
        log.warn("FRED API unreachable at {}: {}", endpoint, cause.getMessage());
        throw new FredApiException(503, "FRED API unavailable: " + cause.getMessage(), cause);
      }

      status = "error";
      log.warn("Unexpected error calling FRED API {}: {}", endpoint, e.getMessage(), e);
      throw new FredApiException(500, "Failed to call FRED API: " + e.getMessage(), e);
    } finally {
      sample.stop(
          Timer.builder("fred.proxy.upstream.requests")
              .tag("endpoint", endpoint)
              .tag("status", status)
              .register(meterRegistry));
    }
  }

  private <T> T readPayload(String body, Class<T> responseType) {
    JsonNode node;
    try {
      node = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      log.warn("Could not parse FRED response as JSON: {}", e.getMessage());
      throw new FredApiException(502, "Malformed response from FRED API", e);
    }

    if (node.has("error_code") || node.has("error_message")) {
      var error = objectMapper.convertValue(node, FredErrorResponse.class);
      var code = error.errorCode() != null ? error.errorCode() : 500;
      log.warn(
          "FRED API returned error payload - Error Code: {} - Message: {}",
          code,
          error.errorMessage());
      throw new FredApiException(code, error.errorMessage());
    }

    try {
      return objectMapper.treeToValue(node, responseType);
    } catch (JsonProcessingException e) {
      log.warn(
          "Could not map FRED response to {}: {}", responseType.getSimpleName(), e.getMessage());
      throw new FredApiException(502, "Unexpected response shape from FRED API", e);
    }
  }

  private String buildSeriesObservationsUrl(
      String seriesId,
      LocalDate observationStart,
      LocalDate observationEnd,
      LocalDate realtimeStart,
      LocalDate realtimeEnd,
      int offset) {
    var url =
        new StringBuilder(OBSERVATIONS_PATH)
            .append("?series_id=")
            .append(encode(seriesId))
            .append("&api_key=")
            .append(encode(fredApiKey))
            .append("&file_type=json")
            .append("&limit=")
            .append(pageSize)
            .append("&sort_order=asc");

    appendDate(url, "observation_start", observationStart);
    appendDate(url, "observation_end", observationEnd);
    appendDate(url, "realtime_start", realtimeStart);
    appendDate(url, "realtime_end", realtimeEnd);

    if (offset > 0) {
      url.append("&offset=").append(offset);
    }

    return url.toString();
  }

  private String buildSeriesUrl(String seriesId) {
    return new StringBuilder(SERIES_PATH)
        .append("?series_id=")
        .append(encode(seriesId))
        .append("&api_key=")
        .append(encode(fredApiKey))
        .append("&file_type=json")
        .toString();
  }

  private static void appendDate(StringBuilder url, String name, LocalDate date) {
    if (date != null) {
      url.append('&').append(name).append('=').append(date.format(FredDateFormats.DATE));
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> parseErrorAndCreateException(response, body));
  }

  private Throwable parseErrorAndCreateException(ClientResponse response, String body) {
    var statusCode = response.statusCode().value();
    Integer errorCode = null;
    String errorMessage = body;

    // Try to parse structured error response
    if (body != null && !body.isBlank()) {
      try {
        var errorResponse = objectMapper.readValue(body, FredErrorResponse.class);

        if (errorResponse.errorMessage() != null) {
          errorMessage = errorResponse.errorMessage();
        }
        errorCode = errorResponse.errorCode();

      } catch (JsonProcessingException e) {
        // Not JSON or doesn't match the error structure, keep the raw body as the message
        log.debug("Could not parse FRED error response as JSON: {}", e.getMessage());

        if (body.length() > MAX_ERROR_BODY_LENGTH) {
          errorMessage = body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
        }
      }
    }

    log.warn(
        "FRED API error: HTTP {} - Error Code: {} - Message: {}",
        statusCode,
        errorCode,
        errorMessage);

    return new FredApiException(isHttpStatus(errorCode) ? errorCode : statusCode, errorMessage);
  }

  private static boolean isHttpStatus(Integer code) {
    return code != null && code >= 100 && code <= 599;
  }
}
