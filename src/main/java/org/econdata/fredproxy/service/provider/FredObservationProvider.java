package org.econdata.fredproxy.service.provider;

import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.econdata.fredproxy.client.fred.FredClient;
import org.econdata.fredproxy.exception.ResourceNotFoundException;
import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.dto.SeriesMetadata;

/**
 * FRED (Federal Reserve Economic Data) implementation of ObservationProvider.
 *
 * <p>Fetches observations and series metadata from the St. Louis Federal Reserve FRED API.
 */
@Service
public class FredObservationProvider implements ObservationProvider {

  private static final Logger log = LoggerFactory.getLogger(FredObservationProvider.class);

  private final FredClient fredClient;

  /**
   * Constructs a new FredObservationProvider.
   *
   * @param fredClient The FRED API client
   */
  public FredObservationProvider(FredClient fredClient) {
    this.fredClient = fredClient;
  }

  @Override
  public List<ObservationData> fetchObservations(
      String seriesId,
      LocalDate observationStart,
      LocalDate observationEnd,
      LocalDate realtimeStart,
      LocalDate realtimeEnd) {
    return fredClient
        .getSeriesObservations(
            seriesId, observationStart, observationEnd, realtimeStart, realtimeEnd)
        .stream()
        .map(ObservationData::from)
        .toList();
  }

  @Override
  public SeriesMetadata fetchSeries(String seriesId) {
    var response = fredClient.getSeries(seriesId);
    var seriess = response.seriess();

    if (seriess == null || seriess.isEmpty()) {
      log.info("FRED returned no series for id: {}", seriesId);
      throw new ResourceNotFoundException("Series not found: " + seriesId);
    }

    return SeriesMetadata.from(seriess.get(0));
  }
}
