package com.gentoro.medigraph.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultProjectorTest {

  private static final List<String> COLUMNS = List.of("rxnorm", "medication", "patients_on_med");

  @Test
  @DisplayName("No records still yields the declared headers")
  void emptyTableKeepsColumns() {
    ResultTable table = ResultProjector.project(List.of(), COLUMNS);

    assertTrue(table.isEmpty());
    assertEquals(COLUMNS, table.columns());
    assertTrue(table.render().startsWith("rxnorm | medication | patients_on_med"));
  }

  @Test
  @DisplayName("Rows follow the declared column order; missing keys are null")
  void projectsInDeclaredOrder() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("patients_on_med", 3L);
    record.put("rxnorm", "860975");
    record.put("ignored", "x");

    ResultTable table = ResultProjector.project(List.of(record), COLUMNS);

    assertEquals("860975", table.rows().get(0).get(0));
    assertNull(table.value(0, "medication"));
    assertEquals(3L, table.value(0, "patients_on_med"));
    assertEquals(3, table.rows().get(0).size());
  }

  @Test
  @DisplayName("Plain-text rendering pads columns")
  void render() {
    ResultTable table =
        new ResultTable(List.of("id", "name"), List.of(List.of("P001", "Alice Nguyen")));

    assertEquals(
        "id   | name\n" + "-----+-------------\n" + "P001 | Alice Nguyen\n", table.render());
  }
}
