package com.gentoro.medigraph.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.medigraph.exception.GraphStoreUnavailableException;
import com.gentoro.medigraph.exception.SourceQueryException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.graph.driver.embedded.EmbeddedNeo4jGraphStore;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.source.Extractor;
import com.gentoro.medigraph.source.SourceConnectionFactory;
import com.gentoro.medigraph.sync.mapping.EntityMappings;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class SyncPipelineTest {

  @TempDir Path tmp;

  private EmbeddedNeo4jGraphStore store;
  private GraphSession session;

  @BeforeEach
  void setUp() {
    store = new EmbeddedNeo4jGraphStore(tmp.resolve("graph"), "neo4j");
    store.initialize();
    session = store.openSession();
  }

  @AfterEach
  void tearDown() {
    session.close();
    store.shutdown();
  }

  private static SyncPipeline pipeline(SyncOptions options) {
    return new SyncPipeline(null, null, null, EntityMappings.defaults(), options);
  }

  private static Extractor extractorWithProviders() {
    Extractor extractor = mock(Extractor.class);
    when(extractor.fetch(any(), anyInt())).thenReturn(List.of());
    when(extractor.fetch(eq(EntityType.PROVIDER), anyInt()))
        .thenReturn(
            List.of(
                SourceRow.of("PROVIDER_ID", "NPI1", "PROVIDER_NAME", "Dr. A"),
                SourceRow.of("PROVIDER_ID", "NPI2", "PROVIDER_NAME", "Dr. B")));
    when(extractor.fetch(eq(EntityType.PATIENT), anyInt()))
        .thenReturn(List.of(SourceRow.of("PATIENT_ID", "P001", "FIRST_NAME", "Alice")));
    return extractor;
  }

  @Test
  @DisplayName("Entity types are extracted in dependency order with the configured cap")
  void extractsInOrder() {
    Extractor extractor = extractorWithProviders();

    SyncReport report = pipeline(new SyncOptions(7000, 500, true)).run(extractor, session);

    InOrder order = inOrder(extractor);
    for (EntityType type : EntityType.LOAD_ORDER) {
      order.verify(extractor).fetch(type, 7000);
    }
    assertEquals(3, report.totalApplied());
    assertEquals(
        EntityLoadResult.Status.LOADED, report.result(EntityType.PROVIDER).get().status());
    assertEquals(2, report.result(EntityType.PROVIDER).get().applied());
  }

  @Test
  @DisplayName("A second run skips types already present without extracting them")
  void skipGateOnRerun() {
    pipeline(SyncOptions.defaults()).run(extractorWithProviders(), session);

    Extractor second = mock(Extractor.class);
    when(second.fetch(any(), anyInt())).thenReturn(List.of());
    SyncReport report = pipeline(SyncOptions.defaults()).run(second, session);

    verify(second, never()).fetch(eq(EntityType.PROVIDER), anyInt());
    verify(second, never()).fetch(eq(EntityType.PATIENT), anyInt());
    verify(second).fetch(eq(EntityType.ENCOUNTER), anyInt());
    assertEquals(
        EntityLoadResult.Status.SKIPPED, report.result(EntityType.PROVIDER).get().status());
    assertEquals(0, report.totalApplied());
  }

  @Test
  @DisplayName("With the gate disabled every type is extracted again")
  void gateDisabled() {
    pipeline(SyncOptions.defaults()).run(extractorWithProviders(), session);

    Extractor second = extractorWithProviders();
    SyncReport report = pipeline(new SyncOptions(10, 500, false)).run(second, session);

    verify(second).fetch(EntityType.PROVIDER, 10);
    assertEquals(2, report.result(EntityType.PROVIDER).get().applied());
    Object providers =
        session.read("MATCH (p:Provider) RETURN count(p) AS c").get(0).get("c");
    assertEquals(2L, ((Number) providers).longValue());
  }

  @Test
  @DisplayName("A fatal extract error stops the run; earlier types stay loaded")
  void fatalErrorStopsRun() {
    Extractor extractor = extractorWithProviders();
    when(extractor.fetch(eq(EntityType.ENCOUNTER), anyInt()))
        .thenThrow(new SourceQueryException(EntityType.ENCOUNTER, "missing columns [ENC_ID]"));

    assertThrows(
        SourceQueryException.class,
        () -> pipeline(SyncOptions.defaults()).run(extractor, session));

    verify(extractor, never()).fetch(eq(EntityType.CONDITION), anyInt());
    Object providers =
        session.read("MATCH (p:Provider) RETURN count(p) AS c").get(0).get("c");
    assertEquals(2L, ((Number) providers).longValue());
  }

  @Test
  @DisplayName("Source connection and graph store are released when the run fails")
  void releasesResourcesOnFailure() throws Exception {
    SourceConnectionFactory sources = mock(SourceConnectionFactory.class);
    Connection connection = mock(Connection.class);
    when(sources.open("123456")).thenReturn(connection);
    GraphStore graph = mock(GraphStore.class);
    doThrow(new GraphStoreUnavailableException("down", null)).when(graph).initialize();

    SyncPipeline pipeline =
        new SyncPipeline(
            sources,
            c -> mock(Extractor.class),
            () -> graph,
            EntityMappings.defaults(),
            SyncOptions.defaults());

    assertThrows(GraphStoreUnavailableException.class, () -> pipeline.run("123456"));

    verify(graph).close();
    verify(connection).close();
  }
}
