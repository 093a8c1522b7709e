package com.gentoro.medigraph.source;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.exception.SourceQueryException;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcExtractorTest {

  private Connection connection;
  private JdbcExtractor extractor;

  @BeforeEach
  void setUp() throws Exception {
    // VALUE is a keyword in H2 but a plain column name in the warehouse
    connection =
        DriverManager.getConnection(
            "jdbc:h2:mem:extract_" + System.nanoTime() + ";NON_KEYWORDS=VALUE", "sa", "");
    try (Statement st = connection.createStatement()) {
      st.execute(
          "CREATE TABLE V_PATIENTS (PATIENT_ID VARCHAR(20), FIRST_NAME VARCHAR(50),"
              + " LAST_NAME VARCHAR(50), SEX VARCHAR(1), ZIP VARCHAR(10), AGE INT, EXTRA VARCHAR(5))");
      for (int i = 1; i <= 5; i++) {
        st.execute(
            "INSERT INTO V_PATIENTS VALUES ('P00" + i + "', 'First" + i + "', 'Last', 'F', '02115', 40, 'x')");
      }
      st.execute(
          "CREATE TABLE OBSERVATIONS (OBSERVATION_ID VARCHAR(20), PATIENT_ID VARCHAR(20),"
              + " ENCOUNTER_ID VARCHAR(20), DESCRIPTION VARCHAR(50), VALUE DOUBLE,"
              + " UNIT VARCHAR(10), CATEGORY VARCHAR(20), CODE VARCHAR(20), OBS_DATETIME TIMESTAMP)");
      st.execute(
          "INSERT INTO OBSERVATIONS VALUES ('O2', 'P001', NULL, 'A1c', 7.1, '%', 'lab', '4548-4',"
              + " TIMESTAMP '2024-02-01 08:00:00')");
      st.execute(
          "INSERT INTO OBSERVATIONS VALUES ('O1', 'P001', NULL, 'A1c', 7.4, '%', 'lab', '4548-4',"
              + " TIMESTAMP '2024-01-01 08:00:00')");
      st.execute(
          "INSERT INTO OBSERVATIONS VALUES (NULL, 'P001', NULL, 'A1c', 6.9, '%', 'lab', '4548-4',"
              + " TIMESTAMP '2023-12-01 08:00:00')");
      st.execute("CREATE TABLE V_PROVIDERS_DRIFTED (PROVIDER_ID VARCHAR(20), PROVIDER_NAME VARCHAR(50))");
    }
    Map<EntityType, String> views = new EnumMap<>(EntityType.class);
    views.put(EntityType.PATIENT, "PUBLIC.V_PATIENTS");
    views.put(EntityType.OBSERVATION, "OBSERVATIONS");
    views.put(EntityType.PROVIDER, "V_PROVIDERS_DRIFTED");
    views.put(EntityType.MEDICATION, "V_MISSING");
    extractor = new JdbcExtractor(connection, views);
  }

  @AfterEach
  void tearDown() throws Exception {
    connection.close();
  }

  @Test
  @DisplayName("Selects exactly the entity's columns and caps rows at the source")
  void columnsAndLimit() {
    assertEquals(
        "SELECT PATIENT_ID, FIRST_NAME, LAST_NAME, SEX, ZIP, AGE FROM PUBLIC.V_PATIENTS LIMIT 3",
        extractor.buildQuery(EntityType.PATIENT, 3));

    List<SourceRow> rows = extractor.fetch(EntityType.PATIENT, 3);

    assertEquals(3, rows.size());
    assertEquals(EntityType.PATIENT.sourceColumns().size(), rows.get(0).asMap().size());
    assertFalse(rows.get(0).has("EXTRA"));
    assertEquals("02115", rows.get(0).get("zip"));
  }

  @Test
  @DisplayName("Observations come back in ascending timestamp order without null ids")
  void observationOrdering() {
    List<SourceRow> rows = extractor.fetch(EntityType.OBSERVATION, 10);

    assertEquals(2, rows.size());
    assertEquals("O1", rows.get(0).getString("OBSERVATION_ID"));
    assertEquals("O2", rows.get(1).getString("OBSERVATION_ID"));
  }

  @Test
  @DisplayName("Missing columns are reported as a source query error")
  void schemaDrift() {
    SourceQueryException ex =
        assertThrows(SourceQueryException.class, () -> extractor.fetch(EntityType.PROVIDER, 10));
    assertTrue(ex.getMessage().contains("SPECIALTY"));
  }

  @Test
  @DisplayName("A missing view is a source query error, not an outage")
  void missingView() {
    assertThrows(SourceQueryException.class, () -> extractor.fetch(EntityType.MEDICATION, 10));
  }

  @Test
  @DisplayName("Row caps are validated")
  void rowCaps() {
    assertThrows(IllegalArgumentException.class, () -> extractor.fetch(EntityType.PATIENT, -1));
    assertTrue(extractor.fetch(EntityType.PATIENT, 0).isEmpty());
  }

  @Test
  @DisplayName("View names must be plain qualified identifiers")
  void rejectsInjectedViewName() {
    Map<EntityType, String> views = new EnumMap<>(EntityType.class);
    views.put(EntityType.PATIENT, "V_PATIENTS; DROP TABLE V_PATIENTS");
    assertThrows(ConfigurationException.class, () -> new JdbcExtractor(connection, views));
  }
}
