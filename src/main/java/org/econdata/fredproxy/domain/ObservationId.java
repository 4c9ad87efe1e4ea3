package org.econdata.fredproxy.domain;

import java.io.Serializable;
import java.util.Objects;

/** Composite primary key of {@link Observation}: series id plus ISO date text. */
public class ObservationId implements Serializable {

  private static final long serialVersionUID = 1L;

  private String seriesId;
  private String date;

  public ObservationId() {}

  public ObservationId(String seriesId, String date) {
    this.seriesId = seriesId;
    this.date = date;
  }

  public String getSeriesId() {
    return seriesId;
  }

  public String getDate() {
    return date;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ObservationId other)) {
      return false;
    }
    return Objects.equals(seriesId, other.seriesId) && Objects.equals(date, other.date);
  }

  @Override
  public int hashCode() {
    return Objects.hash(seriesId, date);
  }
}
