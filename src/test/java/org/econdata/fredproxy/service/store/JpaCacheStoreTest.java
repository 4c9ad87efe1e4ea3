package org.econdata.fredproxy.service.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import org.econdata.fredproxy.base.AbstractRepositoryTest;
import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.dto.SeriesMetadata;

@DisplayName("JpaCacheStore Tests")
@Import(JpaCacheStore.class)
class JpaCacheStoreTest extends AbstractRepositoryTest {

  private static final String SERIES = "SP500";

  @Autowired private JpaCacheStore cacheStore;

  @Test
  @DisplayName("Should overwrite values of existing keys and add new ones")
  void shouldUpsertObservations() {
    cacheStore.putObservations(
        SERIES,
        List.of(
            new ObservationData(LocalDate.of(2020, 1, 2), "3257.85"),
            new ObservationData(LocalDate.of(2020, 1, 3), "3234.85")));
    cacheStore.putObservations(
        SERIES,
        List.of(
            new ObservationData(LocalDate.of(2020, 1, 3), "3235.00"),
            new ObservationData(LocalDate.of(2020, 1, 6), "3246.28")));

    var rows = cacheStore.getObservations(SERIES, null, null);

    assertThat(rows)
        .containsExactly(
            new ObservationData(LocalDate.of(2020, 1, 2), "3257.85"),
            new ObservationData(LocalDate.of(2020, 1, 3), "3235.00"),
            new ObservationData(LocalDate.of(2020, 1, 6), "3246.28"));
  }

  @Test
  @DisplayName("Should treat null bounds as open")
  void shouldTreatNullBoundsAsOpen() {
    cacheStore.putObservations(
        SERIES,
        List.of(
            new ObservationData(LocalDate.of(1776, 7, 4), "1"),
            new ObservationData(LocalDate.of(2020, 1, 2), "2"),
            new ObservationData(LocalDate.of(9999, 12, 31), "3")));

    assertThat(cacheStore.getObservations(SERIES, null, null)).hasSize(3);
    assertThat(cacheStore.getObservations(SERIES, LocalDate.of(2000, 1, 1), null))
        .extracting(ObservationData::value)
        .containsExactly("2", "3");
    assertThat(cacheStore.getObservations(SERIES, null, LocalDate.of(2020, 1, 2)))
        .extracting(ObservationData::value)
        .containsExactly("1", "2");
  }

  @Test
  @DisplayName("Should return an empty list when nothing is cached")
  void shouldReturnEmptyWhenNothingCached() {
    assertThat(cacheStore.getObservations("UNRATE", null, null)).isEmpty();
  }

  @Test
  @DisplayName("Should accept an empty batch")
  void shouldAcceptEmptyBatch() {
    cacheStore.putObservations(SERIES, List.of());

    assertThat(cacheStore.getObservations(SERIES, null, null)).isEmpty();
  }

  @Test
  @DisplayName("Should store and replace series metadata")
  void shouldUpsertSeries() {
    var first = metadata(OffsetDateTime.of(2024, 1, 2, 20, 11, 4, 0, ZoneOffset.UTC), "S&P 500");
    var second = metadata(OffsetDateTime.of(2024, 1, 3, 20, 12, 40, 0, ZoneOffset.UTC), "S&P");

    assertThat(cacheStore.getSeries(SERIES)).isEmpty();

    cacheStore.putSeries(first);
    assertThat(cacheStore.getSeries(SERIES)).contains(first);

    cacheStore.putSeries(second);
    assertThat(cacheStore.getSeries(SERIES)).contains(second);
  }

  // Flyway needs its own connection and the pool holds one, so this runs without the test
  // transaction and commits.
  @Test
  @Transactional(propagation = Propagation.NOT_SUPPORTED)
  @DisplayName("Should be safe to initialize repeatedly")
  void shouldInitializeIdempotently() {
    cacheStore.initialize();
    cacheStore.initialize();

    cacheStore.putObservations(
        SERIES, List.of(new ObservationData(LocalDate.of(2020, 1, 2), "3257.85")));
    assertThat(cacheStore.getObservations(SERIES, null, null)).hasSize(1);

    testDatabaseHelper.cleanupAllTables();
  }

  @Test
  @DisplayName("Should not see rows committed by earlier tests")
  void shouldStartFromEmptyTables() {
    testDatabaseHelper.insertObservation(SERIES, "2020-01-01", "writer-5");

    cleanDatabase();

    assertThat(testDatabaseHelper.countObservations(SERIES)).isZero();
    assertThat(cacheStore.getObservations(SERIES, null, null)).isEmpty();
  }

  private static SeriesMetadata metadata(OffsetDateTime lastUpdated, String title) {
    return new SeriesMetadata(
        SERIES,
        lastUpdated,
        LocalDate.of(2014, 1, 2),
        LocalDate.of(2024, 1, 2),
        LocalDate.of(2024, 1, 3),
        LocalDate.of(2024, 1, 3),
        title,
        "Daily, Close",
        "D",
        "Index",
        "Index",
        "Not Seasonally Adjusted",
        "NSA",
        83,
        "");
  }
}
