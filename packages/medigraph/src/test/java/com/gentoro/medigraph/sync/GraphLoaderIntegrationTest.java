package com.gentoro.medigraph.sync;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medigraph.exception.RowUpsertException;
import com.gentoro.medigraph.graph.GraphSchema;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.driver.embedded.EmbeddedNeo4jGraphStore;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.mapping.EntityMappings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphLoaderIntegrationTest {

  @TempDir Path tmp;

  private EmbeddedNeo4jGraphStore store;
  private GraphSession session;
  private GraphLoader loader;

  @BeforeEach
  void setUp() {
    store = new EmbeddedNeo4jGraphStore(tmp.resolve("graph"), "neo4j");
    store.initialize();
    session = store.openSession();
    GraphSchema.ensureConstraints(session);
    loader = new GraphLoader(session, EntityMappings.defaults(), 1);
  }

  @AfterEach
  void tearDown() {
    session.close();
    store.shutdown();
  }

  private static SourceRow alice() {
    return SourceRow.of(
        "PATIENT_ID", "P001",
        "FIRST_NAME", "Alice",
        "LAST_NAME", "Nguyen",
        "SEX", "F",
        "ZIP", "02115",
        "AGE", 45);
  }

  private long count(String pattern) {
    Object c = session.read("MATCH " + pattern + " RETURN count(*) AS c").get(0).get("c");
    return ((Number) c).longValue();
  }

  @Test
  @DisplayName("Loading a patient row produces a node with the combined full name")
  void loadsPatient() {
    assertEquals(1, loader.upsert(EntityType.PATIENT, List.of(alice())));

    Map<String, Object> p =
        session
            .read("MATCH (p:Patient {id: 'P001'}) RETURN p.full_name AS name, p.zip AS zip, p.age AS age")
            .get(0);
    assertEquals("Alice Nguyen", p.get("name"));
    assertEquals("02115", p.get("zip"));
    assertEquals(45L, ((Number) p.get("age")).longValue());
  }

  @Test
  @DisplayName("Applying the same batch twice leaves node and edge counts unchanged")
  void idempotentReload() {
    List<SourceRow> encounters =
        List.of(
            SourceRow.of("ENC_ID", "E1", "PATIENT_ID", "P001", "PROVIDER_NPI", "NPI1"),
            SourceRow.of("ENC_ID", "E2", "PATIENT_ID", "P001", "PROVIDER_NPI", "NPI1"));

    loader.upsert(EntityType.PATIENT, List.of(alice()));
    loader.upsert(EntityType.ENCOUNTER, encounters);
    long nodes = count("(n)");
    long edges = count("()-[r]->()");

    loader.upsert(EntityType.PATIENT, List.of(alice()));
    loader.upsert(EntityType.ENCOUNTER, encounters);

    assertEquals(1, count("(p:Patient)"));
    assertEquals(nodes, count("(n)"));
    assertEquals(edges, count("()-[r]->()"));
    assertEquals(1, count("(:Patient)-[:HAS_PROVIDER]->(:Provider)"));
  }

  @Test
  @DisplayName("Forward references create stubs that a later full load enriches")
  void stubThenEnrich() {
    loader.upsert(
        EntityType.ENCOUNTER,
        List.of(SourceRow.of("ENC_ID", "E1", "PATIENT_ID", "P009", "PROVIDER_NPI", "NPI7")));

    Map<String, Object> stub =
        session.read("MATCH (pr:Provider {id: 'NPI7'}) RETURN pr.name AS name").get(0);
    assertNull(stub.get("name"));

    loader.upsert(
        EntityType.PROVIDER,
        List.of(
            SourceRow.of(
                "PROVIDER_ID", "NPI7", "PROVIDER_NAME", "Dr. Rivera", "SPECIALTY", "Cardiology")));
    // A second encounter referencing the provider must not wipe its attributes
    loader.upsert(
        EntityType.ENCOUNTER,
        List.of(SourceRow.of("ENC_ID", "E2", "PATIENT_ID", "P009", "PROVIDER_NPI", "NPI7")));

    Map<String, Object> provider =
        session
            .read("MATCH (pr:Provider {id: 'NPI7'}) RETURN pr.name AS name, pr.specialty AS specialty")
            .get(0);
    assertEquals("Dr. Rivera", provider.get("name"));
    assertEquals("Cardiology", provider.get("specialty"));
    assertEquals(1, count("(pr:Provider)"));
  }

  @Test
  @DisplayName("Every edge joins two existing nodes")
  void noDanglingEdges() {
    loader.upsert(
        EntityType.CONDITION,
        List.of(
            SourceRow.of("ICD_CODE", "E11.9", "NAME", "Type 2 diabetes", "PATIENT_ID", "P1", "ENC_ID", "E1"),
            SourceRow.of("ICD_CODE", "I10", "NAME", "Hypertension", "PATIENT_ID", "P1", "ENC_ID", null)));

    assertEquals(3, count("()-[r:HAS_CONDITION]->()"));
    assertEquals(
        0,
        count("()-[r]->(n) WHERE n.code IS NULL AND n.id IS NULL"),
        "edge endpoint without a natural key");
  }

  @Test
  @DisplayName("An empty batch applies nothing")
  void emptyBatch() {
    assertEquals(0, loader.upsert(EntityType.MEDICATION, List.of()));
    assertEquals(0, count("(n)"));
  }

  @Test
  @DisplayName("Rows without a key are skipped and not counted")
  void skipsKeylessRows() {
    int applied =
        loader.upsert(
            EntityType.PATIENT,
            List.of(alice(), SourceRow.of("PATIENT_ID", null, "FIRST_NAME", "Ghost")));
    assertEquals(1, applied);
    assertEquals(1, count("(p:Patient)"));
  }

  @Test
  @DisplayName("A failing row aborts the batch and earlier rows stay committed")
  void rowFailureKeepsEarlierRows() {
    List<SourceRow> rows =
        List.of(
            alice(),
            SourceRow.of("PATIENT_ID", "P002", "AGE", "not-a-number"),
            SourceRow.of("PATIENT_ID", "P003", "AGE", 30));

    RowUpsertException ex =
        assertThrows(RowUpsertException.class, () -> loader.upsert(EntityType.PATIENT, rows));

    assertEquals(EntityType.PATIENT, ex.getEntityType());
    assertEquals(2, ex.getRowIndex());
    assertEquals("P002", ex.getNaturalKey());
    assertEquals(1, count("(p:Patient)"));
    assertEquals(0, count("(p:Patient {id: 'P003'})"));
  }
}
