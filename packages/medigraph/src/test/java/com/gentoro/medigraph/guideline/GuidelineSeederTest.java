package com.gentoro.medigraph.guideline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medigraph.graph.GraphSchema;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.driver.embedded.EmbeddedNeo4jGraphStore;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.GraphLoader;
import com.gentoro.medigraph.sync.mapping.EntityMappings;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GuidelineSeederTest {

  @TempDir Path tmp;

  private EmbeddedNeo4jGraphStore store;
  private GraphSession session;

  @BeforeEach
  void setUp() {
    store = new EmbeddedNeo4jGraphStore(tmp.resolve("graph"), "neo4j");
    store.initialize();
    session = store.openSession();
    GraphSchema.ensureConstraints(session);
    GraphLoader loader = new GraphLoader(session, EntityMappings.defaults(), 500);
    loader.upsert(
        EntityType.CONDITION,
        List.of(
            SourceRow.of("ICD_CODE", "E11.9", "NAME", "Type 2 diabetes mellitus", "PATIENT_ID", "P1"),
            SourceRow.of("ICD_CODE", "I10", "NAME", "Essential hypertension", "PATIENT_ID", "P1"),
            SourceRow.of("ICD_CODE", "N18.4", "NAME", "Chronic kidney disease stage 4", "PATIENT_ID", "P2")));
    loader.upsert(
        EntityType.MEDICATION,
        List.of(
            SourceRow.of("RXNORM", "860975", "NAME", "Metformin 500 MG", "PATIENT_ID", "P1"),
            SourceRow.of("RXNORM", "314076", "NAME", "Lisinopril 10 MG", "PATIENT_ID", "P1")));
  }

  @AfterEach
  void tearDown() {
    session.close();
    store.shutdown();
  }

  private long count(String pattern) {
    Object c = session.read("MATCH " + pattern + " RETURN count(*) AS c").get(0).get("c");
    return ((Number) c).longValue();
  }

  @Test
  @DisplayName("Bundled catalogue seeds guidelines and keyword links")
  void seedsBundledCatalogue() {
    GuidelineSeeder seeder = new GuidelineSeeder(GuidelineSeeder.loadCatalog(null));

    assertEquals(2, seeder.seed(session));

    assertEquals(2, count("(g:Guideline)"));
    assertEquals(1, count("(:Guideline {id: 'GL_DM_001'})-[:MENTIONS_MEDICATION]->(:Medication {code: '860975'})"));
    assertEquals(1, count("(:Guideline {id: 'GL_HTN_001'})-[:MENTIONS_CONDITION]->(:Condition {code: 'I10'})"));
    assertEquals(
        "first-line therapy",
        session
            .read("MATCH (:Guideline {id: 'GL_DM_001'})-[r:RECOMMENDS]->(:Medication) RETURN r.reason AS reason")
            .get(0)
            .get("reason"));
    assertEquals(1, count("(:Guideline {id: 'GL_DM_001'})-[:TARGETS_CONDITION]->(:Condition {code: 'E11.9'})"));
    assertEquals(1, count("(:Guideline {id: 'GL_DM_001'})-[:CONTRAINDICATED_FOR]->(:Condition {code: 'N18.4'})"));
    assertEquals(0, count("(:Guideline {id: 'GL_HTN_001'})-[:RECOMMENDS]->()"));
  }

  @Test
  @DisplayName("Seeding twice creates no duplicates")
  void idempotent() {
    GuidelineSeeder seeder = new GuidelineSeeder(GuidelineSeeder.loadCatalog(null));
    seeder.seed(session);
    long edges = count("(:Guideline)-[r]->()");

    seeder.seed(session);

    assertEquals(2, count("(g:Guideline)"));
    assertEquals(edges, count("(:Guideline)-[r]->()"));
  }
}
