package com.gentoro.medigraph.sync.mapping;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Converts raw JDBC values into the property types stored on graph nodes. Every method returns
 * null for null input and throws {@link IllegalArgumentException} for values that cannot be
 * represented (a malformed row).
 */
public final class ValueConverter {

  private ValueConverter() {}

  /** Trimmed text; blank becomes null. Numbers keep their plain decimal form. */
  public static String asText(Object value) {
    if (value == null) return null;
    String text =
        value instanceof BigDecimal
            ? ((BigDecimal) value).stripTrailingZeros().toPlainString()
            : String.valueOf(value);
    text = text.trim();
    return text.isEmpty() ? null : text;
  }

  /** Whole number; fractional values are rejected. */
  public static Long asInteger(Object value) {
    if (value == null) return null;
    try {
      if (value instanceof BigDecimal) {
        return ((BigDecimal) value).longValueExact();
      }
      if (value instanceof Double || value instanceof Float) {
        return new BigDecimal(value.toString()).longValueExact();
      }
      if (value instanceof Number) {
        return ((Number) value).longValue();
      }
      String text = asText(value);
      return text == null ? null : new BigDecimal(text).longValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new IllegalArgumentException("Not a whole number: '" + value + "'", e);
    }
  }

  public static Double asDouble(Object value) {
    if (value == null) return null;
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    String text = asText(value);
    if (text == null) return null;
    try {
      return Double.valueOf(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: '" + value + "'", e);
    }
  }

  /** Date/time values as ISO-8601 text; strings pass through unchanged. */
  public static String asTimestampText(Object value) {
    if (value == null) return null;
    if (value instanceof Timestamp) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(((Timestamp) value).toLocalDateTime());
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().toString();
    }
    if (value instanceof LocalDateTime) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((TemporalAccessor) value);
    }
    if (value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((TemporalAccessor) value);
    }
    if (value instanceof LocalDate) {
      return value.toString();
    }
    if (value instanceof java.util.Date) {
      return ((java.util.Date) value).toInstant().toString();
    }
    return asText(value);
  }
}
