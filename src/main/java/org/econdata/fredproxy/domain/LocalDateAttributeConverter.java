package org.econdata.fredproxy.domain;

import java.time.LocalDate;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link LocalDate} as ISO {@code yyyy-MM-dd} text. */
@Converter
public class LocalDateAttributeConverter implements AttributeConverter<LocalDate, String> {

  @Override
  public String convertToDatabaseColumn(LocalDate attribute) {
    return attribute != null ? attribute.toString() : null;
  }

  @Override
  public LocalDate convertToEntityAttribute(String dbData) {
    return dbData != null && !dbData.isBlank() ? LocalDate.parse(dbData) : null;
  }
}
