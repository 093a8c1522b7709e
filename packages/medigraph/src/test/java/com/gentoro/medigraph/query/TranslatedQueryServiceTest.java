package com.gentoro.medigraph.query;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.medigraph.exception.QueryExecutionException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TranslatedQueryServiceTest {

  @Test
  @DisplayName("Markdown fences and the language tag are stripped")
  void stripsFences() {
    assertEquals(
        "MATCH (p:Patient) RETURN p.id AS id",
        TranslatedQueryService.sanitize("```cypher\nMATCH (p:Patient) RETURN p.id AS id\n```"));
    assertEquals("RETURN 1", TranslatedQueryService.sanitize("  RETURN 1 "));
  }

  @Test
  @DisplayName("Updating clauses are refused")
  void rejectsWrites() {
    assertThrows(
        QueryExecutionException.class,
        () -> TranslatedQueryService.sanitize("MATCH (n) DETACH DELETE n"));
    assertThrows(
        QueryExecutionException.class,
        () -> TranslatedQueryService.sanitize("MERGE (p:Patient {id: 'x'})"));
    assertThrows(QueryExecutionException.class, () -> TranslatedQueryService.sanitize("```\n```"));
  }

  @Test
  @DisplayName("Results are projected on the keys the query returned")
  void projectsByKeys() {
    GraphStore graph = mock(GraphStore.class);
    GraphSession session = mock(GraphSession.class);
    when(graph.openSession()).thenReturn(session);
    when(session.read(anyString(), anyMap()))
        .thenReturn(List.of(Map.of("id", "P001"), Map.of("id", "P002")));

    QueryAnswer answer =
        new TranslatedQueryService(graph, q -> "MATCH (p:Patient) RETURN p.id AS id")
            .answer("who are the patients?");

    assertEquals(List.of("id"), answer.table().orElseThrow().columns());
    assertEquals(2, answer.table().get().size());
  }

  @Test
  @DisplayName("A refused or failing translation never reaches the graph")
  void softFailures() {
    GraphStore graph = mock(GraphStore.class);

    QueryAnswer refused =
        new TranslatedQueryService(graph, q -> "CREATE (n:Patient {id: 'evil'})").answer("x");
    QueryAnswer broken =
        new TranslatedQueryService(
                graph,
                q -> {
                  throw new IllegalStateException("model offline");
                })
            .answer("x");

    assertEquals(QuestionAnsweringService.SOFT_FAILURE_MESSAGE, refused.message());
    assertEquals(QuestionAnsweringService.SOFT_FAILURE_MESSAGE, broken.message());
    verifyNoInteractions(graph);
  }
}
