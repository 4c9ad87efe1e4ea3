package org.econdata.fredproxy.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.econdata.fredproxy.exception.StorageException;
import org.econdata.fredproxy.service.dto.SeriesMetadata;
import org.econdata.fredproxy.service.provider.ObservationProvider;
import org.econdata.fredproxy.service.store.CacheStore;

/**
 * Service for series metadata.
 *
 * <p>Metadata is always read from the provider; the cached copy is kept current as a side effect
 * and never regresses to an older {@code lastUpdated}.
 */
@Service
public class SeriesService {

  private static final Logger log = LoggerFactory.getLogger(SeriesService.class);

  private final ObservationProvider observationProvider;
  private final CacheStore cacheStore;

  /**
   * Constructs a new SeriesService.
   *
   * @param observationProvider The provider to fetch metadata from
   * @param cacheStore The local metadata cache
   */
  public SeriesService(ObservationProvider observationProvider, CacheStore cacheStore) {
    this.observationProvider = observationProvider;
    this.cacheStore = cacheStore;
  }

  /**
   * Fetches the current metadata of a series and writes it through to the cache when nothing is
   * stored yet or the stored copy is strictly older.
   *
   * <p>A cache failure is logged and does not affect the result.
   *
   * @param seriesId The FRED series id
   * @return the metadata as reported by the provider, whether or not it was cached
   * @throws org.econdata.fredproxy.exception.ResourceNotFoundException if the series is unknown
   * @throws org.econdata.fredproxy.exception.FredApiException if the upstream call fails
   */
  public SeriesMetadata refresh(String seriesId) {
    var fetched = observationProvider.fetchSeries(seriesId);

    try {
      var stored = cacheStore.getSeries(fetched.id()).orElse(null);

      if (fetched.isNewerThan(stored)) {
        cacheStore.putSeries(fetched);
        log.info(
            "Updated cached series: {} lastUpdated: {} (was: {})",
            fetched.id(),
            fetched.lastUpdated(),
            stored != null ? stored.lastUpdated() : null);
      } else {
        log.debug("Cached copy of series {} is not older, leaving it as is", fetched.id());
      }
    } catch (StorageException e) {
      log.warn("Failed to cache metadata for series {}: {}", seriesId, e.getMessage(), e);
    }

    return fetched;
  }
}
