package org.econdata.fredproxy.client.fred;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.econdata.fredproxy.client.fred.response.FredSeriesResponse;

@DisplayName("FredDateFormats Tests")
class FredDateFormatsTest {

  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

  @Test
  @DisplayName("Should normalize a negative offset to UTC")
  void shouldNormalizeNegativeOffset() {
    var parsed = FredDateFormats.parseLastUpdated("2013-07-31 09:26:16-05");

    assertThat(parsed).isEqualTo(OffsetDateTime.of(2013, 7, 31, 14, 26, 16, 0, ZoneOffset.UTC));
    assertThat(parsed.getOffset()).isEqualTo(ZoneOffset.UTC);
  }

  @Test
  @DisplayName("Should normalize a positive offset across midnight")
  void shouldNormalizePositiveOffsetAcrossMidnight() {
    var parsed = FredDateFormats.parseLastUpdated("2024-03-01 01:00:00+07");

    assertThat(parsed).isEqualTo(OffsetDateTime.of(2024, 2, 29, 18, 0, 0, 0, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Should write last_updated back out in the FRED shape at +00")
  void shouldFormatAtUtc() {
    var timestamp = OffsetDateTime.of(2013, 7, 31, 9, 26, 16, 0, ZoneOffset.ofHours(-5));

    assertThat(FredDateFormats.formatLastUpdated(timestamp)).isEqualTo("2013-07-31 14:26:16+00");
  }

  @Test
  @DisplayName("Should reject a timestamp without an offset")
  void shouldRejectMissingOffset() {
    assertThatThrownBy(() -> FredDateFormats.parseLastUpdated("2013-07-31 09:26:16"))
        .isInstanceOf(DateTimeParseException.class);
  }

  @Test
  @DisplayName("Should read empty optional dates as absent")
  void shouldReadEmptyOptionalDatesAsAbsent() throws Exception {
    var json =
        """
        {"id": "SP500", "observation_start": "", "observation_end": "2024-01-02",
         "last_updated": "2024-01-02 15:11:04-05"}
        """;

    var series = objectMapper.readValue(json, FredSeriesResponse.Series.class);

    assertThat(series.observationStart()).isNull();
    assertThat(series.observationEnd()).isEqualTo(LocalDate.of(2024, 1, 2));
    assertThat(series.lastUpdated().getHour()).isEqualTo(20);
  }

  @Test
  @DisplayName("Should fail to read a malformed last_updated")
  void shouldFailOnMalformedLastUpdated() {
    var json = "{\"id\": \"SP500\", \"last_updated\": \"yesterday\"}";

    assertThatThrownBy(() -> objectMapper.readValue(json, FredSeriesResponse.Series.class))
        .isInstanceOf(InvalidFormatException.class);
  }
}
