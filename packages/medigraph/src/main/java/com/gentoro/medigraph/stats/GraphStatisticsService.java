package com.gentoro.medigraph.stats;

import com.gentoro.medigraph.graph.GraphSchema;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.model.EntityType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Read-only node and relationship counts. */
public class GraphStatisticsService {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(GraphStatisticsService.class);

  private final GraphStore graphStore;

  public GraphStatisticsService(GraphStore graphStore) {
    this.graphStore = Objects.requireNonNull(graphStore, "graphStore");
  }

  public GraphStatistics collect() {
    List<String> labels = new ArrayList<>();
    for (EntityType type : EntityType.values()) labels.add(type.label());
    labels.add(GraphSchema.GUIDELINE_LABEL);

    try (GraphSession session = graphStore.openSession()) {
      Map<String, Long> nodes = new LinkedHashMap<>();
      for (String label : labels) {
        List<Map<String, Object>> rows =
            session.read("MATCH (n:" + label + ") RETURN count(n) AS c");
        nodes.put(label, rows.isEmpty() ? 0L : asLong(rows.get(0).get("c")));
      }

      Map<String, Long> relationships = new LinkedHashMap<>();
      for (Map<String, Object> row :
          session.read(
              "MATCH ()-[r]->() RETURN type(r) AS relationship_type, count(r) AS total"
                  + " ORDER BY total DESC, relationship_type")) {
        relationships.put(String.valueOf(row.get("relationship_type")), asLong(row.get("total")));
      }
      log.debug("Collected statistics for {} labels, {} relationship types", nodes.size(), relationships.size());
      return new GraphStatistics(nodes, relationships);
    }
  }

  private static long asLong(Object value) {
    return value instanceof Number ? ((Number) value).longValue() : 0L;
  }
}
