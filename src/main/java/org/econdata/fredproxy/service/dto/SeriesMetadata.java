package org.econdata.fredproxy.service.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import org.econdata.fredproxy.client.fred.response.FredSeriesResponse;
import org.econdata.fredproxy.domain.EconomicSeries;

/** Metadata of an economic data series. {@code lastUpdated} is always at offset UTC. */
public record SeriesMetadata(
    String id,
    OffsetDateTime lastUpdated,
    LocalDate observationStart,
    LocalDate observationEnd,
    LocalDate realtimeStart,
    LocalDate realtimeEnd,
    String title,
    String frequency,
    String frequencyShort,
    String units,
    String unitsShort,
    String seasonalAdjustment,
    String seasonalAdjustmentShort,
    int popularity,
    String notes) {

  /**
   * Whether this metadata is strictly newer than {@code other}.
   *
   * @param other stored metadata, may be null
   * @return true when {@code other} is null or was last updated earlier; false when this metadata
   *     carries no timestamp
   */
  public boolean isNewerThan(SeriesMetadata other) {
    if (lastUpdated == null) {
      return false;
    }
    return other == null
        || other.lastUpdated() == null
        || other.lastUpdated().isBefore(lastUpdated);
  }

  public static SeriesMetadata from(FredSeriesResponse.Series series) {
    return new SeriesMetadata(
        series.id(),
        series.lastUpdated(),
        series.observationStart(),
        series.observationEnd(),
        series.realtimeStart(),
        series.realtimeEnd(),
        series.title(),
        series.frequency(),
        series.frequencyShort(),
        series.units(),
        series.unitsShort(),
        series.seasonalAdjustment(),
        series.seasonalAdjustmentShort(),
        series.popularity() != null ? series.popularity() : 0,
        series.notes() != null ? series.notes() : "");
  }

  public static SeriesMetadata from(EconomicSeries entity) {
    return new SeriesMetadata(
        entity.getId(),
        entity.getLastUpdated(),
        entity.getObservationStart(),
        entity.getObservationEnd(),
        entity.getRealtimeStart(),
        entity.getRealtimeEnd(),
        entity.getTitle(),
        entity.getFrequency(),
        entity.getFrequencyShort(),
        entity.getUnits(),
        entity.getUnitsShort(),
        entity.getSeasonalAdjustment(),
        entity.getSeasonalAdjustmentShort(),
        entity.getPopularity(),
        entity.getNotes());
  }
}
