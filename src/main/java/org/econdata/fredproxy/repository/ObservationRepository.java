package org.econdata.fredproxy.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.econdata.fredproxy.domain.Observation;
import org.econdata.fredproxy.domain.ObservationId;

/**
 * Repository for cached observations.
 *
 * <p>Dates are passed as ISO {@code yyyy-MM-dd} text, which orders the same way as the dates
 * themselves.
 */
public interface ObservationRepository extends JpaRepository<Observation, ObservationId> {

  /**
   * Find the observations of a series within an inclusive date range, oldest first.
   *
   * @param seriesId The FRED series id
   * @param since First date (inclusive) as ISO text
   * @param until Last date (inclusive) as ISO text
   * @return Observations sorted ascending by date
   */
  List<Observation> findBySeriesIdAndDateBetweenOrderByDateAsc(
      String seriesId, String since, String until);

  /**
   * Insert an observation, or overwrite the value of the existing row with the same key.
   *
   * @param seriesId The FRED series id
   * @param date Observation date as ISO text
   * @param value Raw observation value
   * @return Number of rows written
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value =
          "INSERT INTO observation (series_id, date, value) VALUES (:seriesId, :date, :value)"
              + " ON CONFLICT (series_id, date) DO UPDATE SET value = excluded.value",
      nativeQuery = true)
  int upsert(
      @Param("seriesId") String seriesId,
      @Param("date") String date,
      @Param("value") String value);

  long countBySeriesId(String seriesId);
}
