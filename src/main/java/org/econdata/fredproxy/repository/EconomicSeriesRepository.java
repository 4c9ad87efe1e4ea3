package org.econdata.fredproxy.repository;

import org.springframework.data.jpa.repository.JpaRepository;

import org.econdata.fredproxy.domain.EconomicSeries;

/** Repository for cached series metadata, keyed by FRED series id. */
public interface EconomicSeriesRepository extends JpaRepository<EconomicSeries, String> {}
