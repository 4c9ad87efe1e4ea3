package org.econdata.fredproxy.service.store;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import org.econdata.fredproxy.domain.EconomicSeries;
import org.econdata.fredproxy.exception.StorageException;
import org.econdata.fredproxy.repository.EconomicSeriesRepository;
import org.econdata.fredproxy.repository.ObservationRepository;
import org.econdata.fredproxy.service.dto.ObservationData;
import org.econdata.fredproxy.service.dto.SeriesMetadata;

/**
 * {@link CacheStore} backed by Spring Data JPA over SQLite.
 *
 * <p>Writes run in a {@link TransactionTemplate} rather than under {@code @Transactional} so that
 * commit failures are translated to {@link StorageException} as well. A batch of observations is
 * written in a single transaction.
 */
@Service
public class JpaCacheStore implements CacheStore {

  private static final Logger log = LoggerFactory.getLogger(JpaCacheStore.class);

  // Open bounds; dates are compared as ISO text and the schema keeps them within this window
  private static final LocalDate EARLIEST_DATE = LocalDate.of(0, 1, 1);
  private static final LocalDate LATEST_DATE = LocalDate.of(9999, 12, 31);

  private final ObservationRepository observationRepository;
  private final EconomicSeriesRepository economicSeriesRepository;
  private final TransactionTemplate transactionTemplate;
  private final Flyway flyway;

  public JpaCacheStore(
      ObservationRepository observationRepository,
      EconomicSeriesRepository economicSeriesRepository,
      PlatformTransactionManager transactionManager,
      Flyway flyway) {
    this.observationRepository = observationRepository;
    this.economicSeriesRepository = economicSeriesRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.flyway = flyway;
  }

  @Override
  public List<ObservationData> getObservations(String seriesId, LocalDate since, LocalDate until) {
    var from = since != null ? since : EARLIEST_DATE;
    var to = until != null ? until : LATEST_DATE;

    try {
      return observationRepository
          .findBySeriesIdAndDateBetweenOrderByDateAsc(seriesId, from.toString(), to.toString())
          .stream()
          .map(ObservationData::from)
          .toList();
    } catch (DataAccessException e) {
      throw new StorageException("Failed to read cached observations for series: " + seriesId, e);
    }
  }

  @Override
  public void putObservations(String seriesId, List<ObservationData> rows) {
    if (rows.isEmpty()) {
      return;
    }

    try {
      transactionTemplate.executeWithoutResult(
          status ->
              rows.forEach(
                  row ->
                      observationRepository.upsert(
                          seriesId, row.date().toString(), row.value())));
    } catch (DataAccessException | TransactionException e) {
      throw new StorageException("Failed to cache observations for series: " + seriesId, e);
    }

    log.debug("Cached {} observations for series: {}", rows.size(), seriesId);
  }

  @Override
  public Optional<SeriesMetadata> getSeries(String seriesId) {
    try {
      return economicSeriesRepository.findById(seriesId).map(SeriesMetadata::from);
    } catch (DataAccessException e) {
      throw new StorageException("Failed to read cached series: " + seriesId, e);
    }
  }

  @Override
  public void putSeries(SeriesMetadata metadata) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> economicSeriesRepository.save(toEntity(metadata)));
    } catch (DataAccessException | TransactionException e) {
      throw new StorageException("Failed to cache series: " + metadata.id(), e);
    }

    log.debug("Cached series metadata: {} lastUpdated: {}", metadata.id(), metadata.lastUpdated());
  }

  @Override
  public void initialize() {
    try {
      var result = flyway.migrate();
      log.info("Cache schema ready ({} migrations applied)", result.migrationsExecuted);
    } catch (FlywayException e) {
      throw new StorageException("Failed to initialize cache schema", e);
    }
  }

  private static EconomicSeries toEntity(SeriesMetadata metadata) {
    var entity = new EconomicSeries();
    entity.setId(metadata.id());
    entity.setLastUpdated(metadata.lastUpdated());
    entity.setObservationStart(metadata.observationStart());
    entity.setObservationEnd(metadata.observationEnd());
    entity.setRealtimeStart(metadata.realtimeStart());
    entity.setRealtimeEnd(metadata.realtimeEnd());
    entity.setTitle(metadata.title());
    entity.setFrequency(metadata.frequency());
    entity.setFrequencyShort(metadata.frequencyShort());
    entity.setUnits(metadata.units());
    entity.setUnitsShort(metadata.unitsShort());
    entity.setSeasonalAdjustment(metadata.seasonalAdjustment());
    entity.setSeasonalAdjustmentShort(metadata.seasonalAdjustmentShort());
    entity.setPopularity(metadata.popularity());
    entity.setNotes(metadata.notes());
    return entity;
  }
}
