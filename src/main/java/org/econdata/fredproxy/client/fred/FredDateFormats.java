package org.econdata.fredproxy.client.fred;

import java.io.IOException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

/**
 * Date and timestamp wire formats used by the FRED API.
 *
 * <ul>
 *   <li>Plain dates: {@code 2013-07-31}
 *   <li>{@code last_updated}: {@code 2013-07-31 09:26:16-05}, an hour-only zone offset
 * </ul>
 *
 * <p>Timestamps are normalized to UTC when read and written back in the same shape, e.g. {@code
 * 2013-07-31 14:26:16+00}.
 */
public final class FredDateFormats {

  public static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

  public static final DateTimeFormatter LAST_UPDATED =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssx");

  private FredDateFormats() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  /**
   * Parses a FRED {@code last_updated} value and normalizes it to UTC.
   *
   * @param text timestamp such as {@code 2013-07-31 09:26:16-05}
   * @return the same instant at offset UTC
   * @throws DateTimeParseException if the text does not match the FRED format
   */
  public static OffsetDateTime parseLastUpdated(String text) {
    return OffsetDateTime.parse(text.trim(), LAST_UPDATED).withOffsetSameInstant(ZoneOffset.UTC);
  }

  public static String formatLastUpdated(OffsetDateTime timestamp) {
    return timestamp.withOffsetSameInstant(ZoneOffset.UTC).format(LAST_UPDATED);
  }

  /** Reads {@code last_updated} into a UTC {@link OffsetDateTime}. */
  public static class LastUpdatedDeserializer extends JsonDeserializer<OffsetDateTime> {
    @Override
    public OffsetDateTime deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      var text = parser.getValueAsString();
      if (text == null || text.isBlank()) {
        return null;
      }
      try {
        return parseLastUpdated(text);
      } catch (DateTimeParseException e) {
        return (OffsetDateTime)
            context.handleWeirdStringValue(OffsetDateTime.class, text, e.getMessage());
      }
    }
  }

  /** Writes a timestamp in the FRED {@code last_updated} shape at offset UTC. */
  public static class LastUpdatedSerializer extends JsonSerializer<OffsetDateTime> {
    @Override
    public void serialize(
        OffsetDateTime value, JsonGenerator generator, SerializerProvider serializers)
        throws IOException {
      generator.writeString(formatLastUpdated(value));
    }
  }

  /** Reads an optional {@code YYYY-MM-DD} date, treating an empty string as absent. */
  public static class OptionalDateDeserializer extends JsonDeserializer<LocalDate> {
    @Override
    public LocalDate deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      var text = parser.getValueAsString();
      if (text == null || text.isBlank()) {
        return null;
      }
      try {
        return LocalDate.parse(text.trim(), DATE);
      } catch (DateTimeParseException e) {
        return (LocalDate) context.handleWeirdStringValue(LocalDate.class, text, e.getMessage());
      }
    }
  }
}
