package com.gentoro.medigraph.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Projects raw query records onto a declared column list. Missing keys become nulls, extra keys are
 * dropped, and an empty record list still yields a table with the declared headers.
 */
public final class ResultProjector {

  private ResultProjector() {}

  public static ResultTable project(List<Map<String, Object>> records, List<String> columns) {
    List<List<Object>> rows = new ArrayList<>(records.size());
    for (Map<String, Object> record : records) {
      List<Object> row = new ArrayList<>(columns.size());
      for (String column : columns) {
        row.add(record.get(column));
      }
      rows.add(row);
    }
    return new ResultTable(columns, rows);
  }

  /** Use the keys of the first record as columns. For queries whose shape is not known upfront. */
  public static ResultTable projectByKeys(List<Map<String, Object>> records) {
    List<String> columns =
        records.isEmpty() ? List.of() : new ArrayList<>(records.get(0).keySet());
    return project(records, columns);
  }
}
