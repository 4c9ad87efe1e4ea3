package org.econdata.fredproxy.service.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SeriesMetadata Tests")
class SeriesMetadataTest {

  private static final OffsetDateTime T1 =
      OffsetDateTime.of(2024, 1, 2, 20, 11, 4, 0, ZoneOffset.UTC);
  private static final OffsetDateTime T2 = T1.plusSeconds(1);

  @Test
  void isNewerThanNothing() {
    assertThat(withLastUpdated(T1).isNewerThan(null)).isTrue();
  }

  @Test
  void isNewerOnlyWhenStrictlyLater() {
    assertThat(withLastUpdated(T2).isNewerThan(withLastUpdated(T1))).isTrue();
    assertThat(withLastUpdated(T1).isNewerThan(withLastUpdated(T1))).isFalse();
    assertThat(withLastUpdated(T1).isNewerThan(withLastUpdated(T2))).isFalse();
  }

  @Test
  void comparesInstantsNotOffsets() {
    var sameInstantOtherOffset = T1.withOffsetSameInstant(ZoneOffset.ofHours(-5));

    assertThat(withLastUpdated(sameInstantOtherOffset).isNewerThan(withLastUpdated(T1))).isFalse();
  }

  @Test
  void missingTimestampIsNeverNewer() {
    assertThat(withLastUpdated(null).isNewerThan(null)).isFalse();
    assertThat(withLastUpdated(T1).isNewerThan(withLastUpdated(null))).isTrue();
  }

  private static SeriesMetadata withLastUpdated(OffsetDateTime lastUpdated) {
    return new SeriesMetadata(
        "SP500",
        lastUpdated,
        null,
        null,
        null,
        null,
        "S&P 500",
        null,
        null,
        null,
        null,
        null,
        null,
        0,
        "");
  }
}
