package com.gentoro.medigraph.sync;

import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.model.EntityType;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Coarse re-import guard: an entity type is skipped when the graph already holds at least one
 * node of that type. It cannot tell a partial load from a complete one.
 */
public class LoadStateGate {
  private final GraphSession session;
  private final boolean enabled;

  public LoadStateGate(GraphSession session, boolean enabled) {
    this.session = Objects.requireNonNull(session, "session");
    this.enabled = enabled;
  }

  public boolean shouldSkip(EntityType entityType) {
    return enabled && countNodes(entityType) > 0;
  }

  public long countNodes(EntityType entityType) {
    List<Map<String, Object>> rows =
        session.read("MATCH (n:" + entityType.label() + ") RETURN count(n) AS count");
    if (rows.isEmpty()) return 0L;
    Object count = rows.get(0).get("count");
    return count instanceof Number ? ((Number) count).longValue() : 0L;
  }
}
