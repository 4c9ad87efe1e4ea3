package org.econdata.fredproxy.service.store;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.econdata.fredproxy.exception.StorageException;
import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.dto.SeriesMetadata;

/**
 * Durable local storage for observations and series metadata.
 *
 * <p>Observations are keyed by {@code (seriesId, date)} and metadata by series id. Every write is
 * an upsert, so callers may store overlapping or repeated rows. Freshness checks belong to the
 * caller; the store never compares versions.
 *
 * <p>All methods throw {@link StorageException} on I/O failure.
 */
public interface CacheStore {

  /**
   * Returns the cached observations of a series within an inclusive date range.
   *
   * @param seriesId The FRED series id
   * @param since First date (inclusive), or null for no lower bound
   * @param until Last date (inclusive), or null for no upper bound
   * @return Observations sorted ascending by date, empty when nothing is cached
   */
  List<ObservationData> getObservations(String seriesId, LocalDate since, LocalDate until);

  /**
   * Upserts observations of a series. A later value for the same date replaces the earlier one.
   *
   * @param seriesId The FRED series id
   * @param rows Observations to store
   */
  void putObservations(String seriesId, List<ObservationData> rows);

  Optional<SeriesMetadata> getSeries(String seriesId);

  /**
   * Unconditionally upserts series metadata.
   *
   * @param metadata Metadata to store, keyed by its id
   */
  void putSeries(SeriesMetadata metadata);

  /** Creates or migrates the cache schema. Idempotent; safe to call on every start. */
  void initialize();
}
