package com.gentoro.medigraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One raw row returned by an extract. Column names are case-insensitive (stored upper-cased);
 * values are kept exactly as the JDBC driver returned them.
 */
public final class SourceRow {
  private final Map<String, Object> values;

  public SourceRow(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    Map<String, Object> copy = new LinkedHashMap<>();
    values.forEach((k, v) -> copy.put(normalize(k), v));
    this.values = Collections.unmodifiableMap(copy);
  }

  public static SourceRow of(Object... columnsAndValues) {
    if (columnsAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected column/value pairs");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < columnsAndValues.length; i += 2) {
      map.put(String.valueOf(columnsAndValues[i]), columnsAndValues[i + 1]);
    }
    return new SourceRow(map);
  }

  public Object get(String column) {
    return values.get(normalize(column));
  }

  public boolean has(String column) {
    return values.containsKey(normalize(column));
  }

  /** Value as trimmed text; null and blank values are both returned as null. */
  public String getString(String column) {
    Object v = get(column);
    if (v == null) return null;
    String s = String.valueOf(v).trim();
    return s.isEmpty() ? null : s;
  }

  public Map<String, Object> asMap() {
    return values;
  }

  private static String normalize(String column) {
    return Objects.requireNonNull(column, "column").trim().toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "SourceRow" + values;
  }
}
