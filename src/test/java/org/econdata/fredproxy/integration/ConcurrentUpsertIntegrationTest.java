package org.econdata.fredproxy.integration;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.econdata.fredproxy.base.AbstractIntegrationTest;
import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.store.CacheStore;

/**
 * Concurrent writers of the same keys, as happens when overlapping requests for one series both
 * miss the cache. Every write must succeed and leave one row per key.
 */
@DisplayName("Concurrent Upsert Integration Tests")
class ConcurrentUpsertIntegrationTest extends AbstractIntegrationTest {

  private static final String SERIES = "SP500";
  private static final int WRITERS = 8;
  private static final int DAYS = 30;

  @Autowired private CacheStore cacheStore;

  @Test
  @DisplayName("Should keep exactly one row per key when writers race on the same rows")
  void shouldSurviveConcurrentUpsertsOfSameKeys() throws Exception {
    var start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(WRITERS);
    var results = new ArrayList<Future<?>>();

    try {
      for (int writer = 0; writer < WRITERS; writer++) {
        var rows = rowsWrittenBy(writer);
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  cacheStore.putObservations(SERIES, rows);
                  return null;
                }));
      }

      start.countDown();
      for (var result : results) {
        result.get(60, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    var stored = cacheStore.getObservations(SERIES, null, null);
    assertThat(stored).hasSize(DAYS);
    assertThat(testDatabaseHelper.countObservations(SERIES)).isEqualTo(DAYS);
    assertThat(stored)
        .allSatisfy(row -> assertThat(row.value()).matches("writer-[0-7]"));
  }

  private static List<ObservationData> rowsWrittenBy(int writer) {
    var rows = new ArrayList<ObservationData>();
    for (int day = 0; day < DAYS; day++) {
      rows.add(new ObservationData(LocalDate.of(2020, 1, 1).plusDays(day), "writer-" + writer));
    }
    return rows;
  }
}
