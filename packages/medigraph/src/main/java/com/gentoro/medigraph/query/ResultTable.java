package com.gentoro.medigraph.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Fixed-column tabular result. Always carries its column names, even with no rows. */
public final class ResultTable {
  private final List<String> columns;
  private final List<List<Object>> rows;

  public ResultTable(List<String> columns, List<List<Object>> rows) {
    this.columns = List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      if (row.size() != this.columns.size()) {
        throw new IllegalArgumentException(
            "Row has " + row.size() + " values, expected " + this.columns.size());
      }
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public List<String> columns() {
    return columns;
  }

  public List<List<Object>> rows() {
    return rows;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }

  /** Value at a row by column name; null for unknown columns. */
  public Object value(int row, String column) {
    int index = columns.indexOf(column);
    return index < 0 ? null : rows.get(row).get(index);
  }

  /** Rows as column-to-value maps in column order. */
  public List<Map<String, Object>> asMaps() {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        map.put(columns.get(i), row.get(i));
      }
      out.add(map);
    }
    return out;
  }

  /** Left-aligned plain-text grid; nulls render as blanks. */
  public String render() {
    int[] widths = new int[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      widths[i] = columns.get(i).length();
    }
    for (List<Object> row : rows) {
      for (int i = 0; i < row.size(); i++) {
        widths[i] = Math.max(widths[i], text(row.get(i)).length());
      }
    }

    StringBuilder sb = new StringBuilder();
    appendLine(sb, new ArrayList<>(columns), widths);
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) sb.append("-+-");
      sb.append("-".repeat(widths[i]));
    }
    sb.append('\n');
    for (List<Object> row : rows) {
      appendLine(sb, row, widths);
    }
    return sb.toString();
  }

  private static void appendLine(StringBuilder sb, List<?> values, int[] widths) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) line.append(" | ");
      String cell = text(values.get(i));
      line.append(cell).append(" ".repeat(widths[i] - cell.length()));
    }
    sb.append(line.toString().stripTrailing()).append('\n');
  }

  private static String text(Object value) {
    return value == null ? "" : String.valueOf(value);
  }

  @Override
  public String toString() {
    return "ResultTable" + columns + " (" + rows.size() + " rows)";
  }
}
