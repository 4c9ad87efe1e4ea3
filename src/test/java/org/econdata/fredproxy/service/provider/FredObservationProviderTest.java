package org.econdata.fredproxy.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import org.econdata.fredproxy.client.fred.FredClient;
import org.econdata.fredproxy.client.fred.response.FredSeriesObservationsResponse;
import org.econdata.fredproxy.client.fred.response.FredSeriesResponse;
import org.econdata.fredproxy.exception.ResourceNotFoundException;
import org.econdata.fredproxy.service.dto.ObservationData;

@ExtendWith(MockitoExtension.class)
@DisplayName("FredObservationProvider Tests")
class FredObservationProviderTest {

  @Mock private FredClient fredClient;

  private FredObservationProvider provider;

  @BeforeEach
  void setUp() {
    provider = new FredObservationProvider(fredClient);
  }

  @Test
  @DisplayName("Should map FRED observations to date and value only")
  void shouldMapObservations() {
    var realtime = LocalDate.of(2024, 1, 3);
    when(fredClient.getSeriesObservations("SP500", null, null, null, null))
        .thenReturn(
            List.of(
                new FredSeriesObservationsResponse.Observation(
                    realtime, realtime, LocalDate.of(2020, 1, 2), "3257.85"),
                new FredSeriesObservationsResponse.Observation(
                    realtime, realtime, LocalDate.of(2020, 1, 3), ".")));

    var result = provider.fetchObservations("SP500", null, null, null, null);

    assertThat(result)
        .containsExactly(
            new ObservationData(LocalDate.of(2020, 1, 2), "3257.85"),
            new ObservationData(LocalDate.of(2020, 1, 3), "."));
  }

  @Test
  @DisplayName("Should take the first series and default absent popularity and notes")
  void shouldMapSeries() {
    var lastUpdated = OffsetDateTime.of(2024, 1, 2, 20, 11, 4, 0, ZoneOffset.UTC);
    var series =
        new FredSeriesResponse.Series(
            "SP500",
            null,
            null,
            "S&P 500",
            null,
            null,
            "Daily, Close",
            "D",
            "Index",
            "Index",
            "Not Seasonally Adjusted",
            "NSA",
            lastUpdated,
            null,
            null);
    when(fredClient.getSeries("SP500"))
        .thenReturn(new FredSeriesResponse(null, null, List.of(series)));

    var metadata = provider.fetchSeries("SP500");

    assertThat(metadata.id()).isEqualTo("SP500");
    assertThat(metadata.lastUpdated()).isEqualTo(lastUpdated);
    assertThat(metadata.popularity()).isZero();
    assertThat(metadata.notes()).isEmpty();
  }

  @Test
  @DisplayName("Should raise ResourceNotFoundException when FRED returns no series")
  void shouldRaiseNotFoundForEmptySeries() {
    when(fredClient.getSeries("NOSUCHSERIES"))
        .thenReturn(new FredSeriesResponse(null, null, List.of()));

    assertThatThrownBy(() -> provider.fetchSeries("NOSUCHSERIES"))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("Series not found: NOSUCHSERIES");
  }
}
