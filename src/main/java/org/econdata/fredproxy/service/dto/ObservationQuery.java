package org.econdata.fredproxy.service.dto;

import java.time.LocalDate;

/**
 * An observations request. Null bounds are open.
 *
 * @param seriesId FRED series id
 * @param observationStart first observation date (inclusive)
 * @param observationEnd last observation date (inclusive)
 * @param realtimeStart start of the realtime (ALFRED) period
 * @param realtimeEnd end of the realtime (ALFRED) period
 */
public record ObservationQuery(
    String seriesId,
    LocalDate observationStart,
    LocalDate observationEnd,
    LocalDate realtimeStart,
    LocalDate realtimeEnd) {

  /** Query for the latest revision of a series in the given window. */
  public static ObservationQuery of(
      String seriesId, LocalDate observationStart, LocalDate observationEnd) {
    return new ObservationQuery(seriesId, observationStart, observationEnd, null, null);
  }

  /**
   * Whether this is a point-in-time query. The cache only holds the latest revision of each date,
   * so these queries never touch it.
   */
  public boolean isRealtime() {
    return realtimeStart != null || realtimeEnd != null;
  }
}
