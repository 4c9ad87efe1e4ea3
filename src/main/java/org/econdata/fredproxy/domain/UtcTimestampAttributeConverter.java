package org.econdata.fredproxy.domain;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores timestamps as ISO-8601 instants in UTC, e.g. {@code 2013-07-31T14:26:16Z}. */
@Converter
public class UtcTimestampAttributeConverter
    implements AttributeConverter<OffsetDateTime, String> {

  @Override
  public String convertToDatabaseColumn(OffsetDateTime attribute) {
    return attribute != null ? attribute.toInstant().toString() : null;
  }

  @Override
  public OffsetDateTime convertToEntityAttribute(String dbData) {
    return dbData != null && !dbData.isBlank()
        ? Instant.parse(dbData).atOffset(ZoneOffset.UTC)
        : null;
  }
}
