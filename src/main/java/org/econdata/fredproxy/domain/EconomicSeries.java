package org.econdata.fredproxy.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

/**
 * Cached metadata of an economic data series as last reported by FRED.
 *
 * <p>Rows are overwritten only when FRED reports a strictly newer {@code lastUpdated}; see {@code
 * SeriesService}.
 */
@Entity
@Table(name = "economic_series")
public class EconomicSeries {

  /** FRED series id, e.g. {@code SP500}. */
  @Id
  @Column(name = "id", nullable = false)
  private String id;

  @NotNull
  @Column(name = "last_updated", nullable = false)
  @Convert(converter = UtcTimestampAttributeConverter.class)
  private OffsetDateTime lastUpdated;

  @Column(name = "observation_start")
  @Convert(converter = LocalDateAttributeConverter.class)
  private LocalDate observationStart;

  @Column(name = "observation_end")
  @Convert(converter = LocalDateAttributeConverter.class)
  private LocalDate observationEnd;

  @Column(name = "realtime_start")
  @Convert(converter = LocalDateAttributeConverter.class)
  private LocalDate realtimeStart;

  @Column(name = "realtime_end")
  @Convert(converter = LocalDateAttributeConverter.class)
  private LocalDate realtimeEnd;

  private String title;

  private String frequency;

  @Column(name = "frequency_short")
  private String frequencyShort;

  private String units;

  @Column(name = "units_short")
  private String unitsShort;

  @Column(name = "seasonal_adjustment")
  private String seasonalAdjustment;

  @Column(name = "seasonal_adjustment_short")
  private String seasonalAdjustmentShort;

  @Column(nullable = false)
  private int popularity;

  private String notes;

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public OffsetDateTime getLastUpdated() {
    return lastUpdated;
  }

  public void setLastUpdated(OffsetDateTime lastUpdated) {
    this.lastUpdated = lastUpdated;
  }

  public LocalDate getObservationStart() {
    return observationStart;
  }

  public void setObservationStart(LocalDate observationStart) {
    this.observationStart = observationStart;
  }

  public LocalDate getObservationEnd() {
    return observationEnd;
  }

  public void setObservationEnd(LocalDate observationEnd) {
    this.observationEnd = observationEnd;
  }

  public LocalDate getRealtimeStart() {
    return realtimeStart;
  }

  public void setRealtimeStart(LocalDate realtimeStart) {
    this.realtimeStart = realtimeStart;
  }

  public LocalDate getRealtimeEnd() {
    return realtimeEnd;
  }

  public void setRealtimeEnd(LocalDate realtimeEnd) {
    this.realtimeEnd = realtimeEnd;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getFrequency() {
    return frequency;
  }

  public void setFrequency(String frequency) {
    this.frequency = frequency;
  }

  public String getFrequencyShort() {
    return frequencyShort;
  }

  public void setFrequencyShort(String frequencyShort) {
    this.frequencyShort = frequencyShort;
  }

  public String getUnits() {
    return units;
  }

  public void setUnits(String units) {
    this.units = units;
  }

  public String getUnitsShort() {
    return unitsShort;
  }

  public void setUnitsShort(String unitsShort) {
    this.unitsShort = unitsShort;
  }

  public String getSeasonalAdjustment() {
    return seasonalAdjustment;
  }

  public void setSeasonalAdjustment(String seasonalAdjustment) {
    this.seasonalAdjustment = seasonalAdjustment;
  }

  public String getSeasonalAdjustmentShort() {
    return seasonalAdjustmentShort;
  }

  public void setSeasonalAdjustmentShort(String seasonalAdjustmentShort) {
    this.seasonalAdjustmentShort = seasonalAdjustmentShort;
  }

  public int getPopularity() {
    return popularity;
  }

  public void setPopularity(int popularity) {
    this.popularity = popularity;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }
}
