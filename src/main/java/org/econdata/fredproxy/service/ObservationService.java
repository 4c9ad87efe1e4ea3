package org.econdata.fredproxy.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;

import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.dto.ObservationQuery;
import org.econdata.fredproxy.service.provider.ObservationProvider;
import org.econdata.fredproxy.service.store.CacheStore;

/**
 * Serves observation windows from the local cache, fetching from the provider only what the cache
 * cannot answer.
 *
 * <p><b>Reconciliation:</b> the cached rows inside the requested window are compared with its
 * bounds and the request is classified as one {@link ReconciliationCase}:
 *
 * <ol>
 *   <li>No cached rows in the window: the whole window is fetched in one call and cached.
 *   <li>Cached rows reach both requested bounds (or the bounds are open): the cached rows are the
 *       answer and the provider is not called.
 *   <li>Otherwise the missing edges are probed: {@code [start, first - 1 day]} on the left and
 *       {@code [last + 1 day, end]} on the right. If either probe returns rows, the cache is stale
 *       or incomplete for this window and the whole window is fetched again in one call, so the
 *       answer matches what the provider reports for exactly this window. If both probes come back
 *       empty (weekends, holidays, not yet published) the cached rows stand.
 * </ol>
 *
 * <p>The cache is written only after every upstream call of the request has succeeded; a failed
 * call aborts the request with no cache write. An exact hit writes nothing.
 *
 * <p>Point-in-time (realtime) queries bypass the cache completely: the cache holds only the latest
 * revision per date and must not be mixed with historical vintages.
 *
 * <p>Concurrent requests for the same series are not deduplicated. Both may fetch and upsert the
 * same rows, which is safe because upserts are idempotent.
 */
@Service
public class ObservationService {

  private static final Logger log = LoggerFactory.getLogger(ObservationService.class);

  static final String RECONCILIATION_METRIC = "fred.proxy.observations.reconciliations";
  static final String REALTIME_BYPASS = "REALTIME_BYPASS";

  private final ObservationProvider observationProvider;
  private final CacheStore cacheStore;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs a new ObservationService.
   *
   * @param observationProvider The upstream provider for cache misses and realtime queries
   * @param cacheStore The local observation cache
   * @param meterRegistry Registry for reconciliation counters
   */
  public ObservationService(
      ObservationProvider observationProvider,
      CacheStore cacheStore,
      MeterRegistry meterRegistry) {
    this.observationProvider = observationProvider;
    this.cacheStore = cacheStore;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Returns the observations of a series for the requested window.
   *
   * @param query series id and optional observation/realtime bounds; the observation start must
   *     not be after the observation end
   * @return observations sorted strictly ascending by date; realtime queries return the provider
   *     response unchanged
   * @throws org.econdata.fredproxy.exception.FredApiException if an upstream call fails
   * @throws org.econdata.fredproxy.exception.StorageException if the cache cannot be read or
   *     written
   */
  public List<ObservationData> getObservations(ObservationQuery query) {
    var seriesId = query.seriesId();
    var start = query.observationStart();
    var end = query.observationEnd();

    if (query.isRealtime()) {
      log.info(
          "Bypassing cache for realtime query - series: {} realtimeStart: {} realtimeEnd: {}",
          seriesId,
          query.realtimeStart(),
          query.realtimeEnd());
      record(REALTIME_BYPASS);
      return observationProvider.fetchObservations(
          seriesId, start, end, query.realtimeStart(), query.realtimeEnd());
    }

    var cached = cacheStore.getObservations(seriesId, start, end);
    if (cached.isEmpty()) {
      return fullMiss(seriesId, start, end);
    }

    var first = cached.get(0).date();
    var last = cached.get(cached.size() - 1).date();

    var leftGap =
        start != null && first.isAfter(start)
            ? Optional.of(fetch(seriesId, start, first.minusDays(1)))
            : Optional.<List<ObservationData>>empty();
    var rightGap =
        end != null && last.isBefore(end)
            ? Optional.of(fetch(seriesId, last.plusDays(1), end))
            : Optional.<List<ObservationData>>empty();

    var reconciliationCase = classify(cached, leftGap, rightGap);
    log.info(
        "Reconciled series: {} window: [{}, {}] cached: {} rows [{}, {}] - {}",
        seriesId,
        start,
        end,
        cached.size(),
        first,
        last,
        reconciliationCase);
    record(reconciliationCase.name());

    return switch (reconciliationCase) {
      case EXACT_HIT, GAP_FILL -> cached;
      case INCOMPLETE_REFETCH -> refetch(seriesId, start, end);
      case FULL_MISS ->
          throw new IllegalStateException("Cached rows present but classified as miss");
    };
  }

  /**
   * Classifies a reconciliation from the cached rows and the gap probe results.
   *
   * @param cached cached rows inside the requested window
   * @param leftGap rows fetched for the left gap, empty optional when there was no left gap
   * @param rightGap rows fetched for the right gap, empty optional when there was no right gap
   * @return the reconciliation case
   */
  static ReconciliationCase classify(
      List<ObservationData> cached,
      Optional<List<ObservationData>> leftGap,
      Optional<List<ObservationData>> rightGap) {
    if (cached.isEmpty()) {
      return ReconciliationCase.FULL_MISS;
    }
    if (leftGap.isEmpty() && rightGap.isEmpty()) {
      return ReconciliationCase.EXACT_HIT;
    }

    var incomplete =
        leftGap.map(rows -> !rows.isEmpty()).orElse(false)
            || rightGap.map(rows -> !rows.isEmpty()).orElse(false);

    return incomplete ? ReconciliationCase.INCOMPLETE_REFETCH : ReconciliationCase.GAP_FILL;
  }

  private List<ObservationData> fullMiss(String seriesId, LocalDate start, LocalDate end) {
    log.info("Cache miss for series: {} window: [{}, {}]", seriesId, start, end);
    record(ReconciliationCase.FULL_MISS.name());

    var fetched = sortedByDate(fetch(seriesId, start, end));
    cacheStore.putObservations(seriesId, fetched);
    return fetched;
  }

  private List<ObservationData> refetch(String seriesId, LocalDate start, LocalDate end) {
    log.info("Cache incomplete for series: {}, refetching window [{}, {}]", seriesId, start, end);

    var fetched = sortedByDate(fetch(seriesId, start, end));
    cacheStore.putObservations(seriesId, fetched);
    return fetched;
  }

  private List<ObservationData> fetch(String seriesId, LocalDate start, LocalDate end) {
    return observationProvider.fetchObservations(seriesId, start, end, null, null);
  }

  /** Sorts ascending by date, keeping the last row seen for a repeated date. */
  private static List<ObservationData> sortedByDate(List<ObservationData> rows) {
    var byDate = new TreeMap<LocalDate, ObservationData>();
    rows.forEach(row -> byDate.put(row.date(), row));
    return List.copyOf(byDate.values());
  }

  private void record(String reconciliationCase) {
    meterRegistry.counter(RECONCILIATION_METRIC, "case", reconciliationCase).increment();
  }
}
