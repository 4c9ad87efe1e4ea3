package org.econdata.fredproxy.service.dto;

import java.time.LocalDate;

import org.econdata.fredproxy.client.fred.response.FredSeriesObservationsResponse;
import org.econdata.fredproxy.domain.Observation;

/**
 * One observation of a series.
 *
 * @param date observation date
 * @param value raw FRED value; {@code "."} marks a missing observation and is passed through as is
 */
public record ObservationData(LocalDate date, String value) {

  public static ObservationData from(FredSeriesObservationsResponse.Observation observation) {
    return new ObservationData(observation.date(), observation.value());
  }

  public static ObservationData from(Observation entity) {
    return new ObservationData(entity.getDate(), entity.getValue());
  }
}
