package com.gentoro.medigraph.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.model.EntityType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LoadStateGateTest {

  @Test
  @DisplayName("Skips a type once any node of its label exists")
  void skipsWhenPresent() {
    GraphSession session = mock(GraphSession.class);
    when(session.read("MATCH (n:Provider) RETURN count(n) AS count"))
        .thenReturn(List.of(Map.of("count", 1L)));
    when(session.read("MATCH (n:Patient) RETURN count(n) AS count"))
        .thenReturn(List.of(Map.of("count", 0L)));

    LoadStateGate gate = new LoadStateGate(session, true);

    assertTrue(gate.shouldSkip(EntityType.PROVIDER));
    assertFalse(gate.shouldSkip(EntityType.PATIENT));
  }

  @Test
  @DisplayName("A disabled gate never skips and never queries")
  void disabledGate() {
    GraphSession session = mock(GraphSession.class);

    LoadStateGate gate = new LoadStateGate(session, false);

    assertFalse(gate.shouldSkip(EntityType.PROVIDER));
    verify(session, never()).read(anyString());
  }
}
