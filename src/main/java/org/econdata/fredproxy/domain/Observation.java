package org.econdata.fredproxy.domain;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

/**
 * A cached observation of an economic data series.
 *
 * <p>Keyed by {@code (seriesId, date)}. Holds only the latest revision FRED reported for the date;
 * point-in-time revisions are never stored.
 *
 * <p>The date is persisted as ISO {@code yyyy-MM-dd} text so that SQLite compares it correctly in
 * range scans. JPA attribute converters do not apply to id attributes, hence the String field
 * behind the {@link LocalDate} accessors.
 */
@Entity
@Table(name = "observation")
@IdClass(ObservationId.class)
public class Observation {

  @Id
  @Column(name = "series_id", nullable = false)
  private String seriesId;

  @Id
  @Column(name = "date", nullable = false, length = 10)
  private String date;

  /** Raw FRED value, e.g. {@code "3230.78"} or {@code "."} for missing data. */
  @NotNull
  @Column(name = "value", nullable = false)
  private String value;

  public Observation() {}

  public Observation(String seriesId, LocalDate date, String value) {
    this.seriesId = seriesId;
    setDate(date);
    this.value = value;
  }

  public String getSeriesId() {
    return seriesId;
  }

  public void setSeriesId(String seriesId) {
    this.seriesId = seriesId;
  }

  public LocalDate getDate() {
    return date != null ? LocalDate.parse(date) : null;
  }

  public void setDate(LocalDate date) {
    this.date = date != null ? date.toString() : null;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }
}
