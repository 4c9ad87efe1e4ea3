package org.econdata.fredproxy.service.provider;

import java.time.LocalDate;
import java.util.List;

import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.dto.SeriesMetadata;

/** Provider interface for fetching economic data from an external source. */
public interface ObservationProvider {

  /**
   * Retrieves all observations of a series in the requested window. Null bounds are omitted from
   * the upstream request.
   *
   * @param seriesId The provider series id
   * @param observationStart First observation date (inclusive)
   * @param observationEnd Last observation date (inclusive)
   * @param realtimeStart Start of the realtime period
   * @param realtimeEnd End of the realtime period
   * @return Observations in ascending date order
   * @throws org.econdata.fredproxy.exception.FredApiException on any upstream failure
   */
  List<ObservationData> fetchObservations(
      String seriesId,
      LocalDate observationStart,
      LocalDate observationEnd,
      LocalDate realtimeStart,
      LocalDate realtimeEnd);

  /**
   * Retrieves the metadata of a series.
   *
   * @param seriesId The provider series id
   * @return Series metadata
   * @throws org.econdata.fredproxy.exception.ResourceNotFoundException if the provider knows no
   *     such series
   * @throws org.econdata.fredproxy.exception.FredApiException on any upstream failure
   */
  SeriesMetadata fetchSeries(String seriesId);
}
