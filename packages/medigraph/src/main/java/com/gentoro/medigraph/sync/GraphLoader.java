package com.gentoro.medigraph.sync;

import com.gentoro.medigraph.exception.GraphStoreUnavailableException;
import com.gentoro.medigraph.exception.RowUpsertException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.mapping.EntityMapping;
import com.gentoro.medigraph.sync.mapping.EntityMappings;
import com.gentoro.medigraph.sync.plan.CypherRenderer;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies one entity type's batch to the graph, row by row. Each row is one statement in its own
 * transaction: the node is merged by natural key, its attributes overwritten, referenced nodes
 * merged as stubs and edges merged. Re-applying a row is a no-op apart from attribute refresh.
 *
 * <p>The first failing row aborts the batch with a {@link RowUpsertException}; rows applied
 * before it stay committed.
 */
public class GraphLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(GraphLoader.class);

  private final GraphSession session;
  private final EntityMappings mappings;
  private final int progressInterval;

  public GraphLoader(GraphSession session, EntityMappings mappings, int progressInterval) {
    this.session = Objects.requireNonNull(session, "session");
    this.mappings = Objects.requireNonNull(mappings, "mappings");
    this.progressInterval = progressInterval;
  }

  /**
   * Upsert a batch.
   *
   * @return number of rows applied; skipped rows (no natural key) are not counted
   * @throws RowUpsertException on the first row that cannot be applied
   * @throws GraphStoreUnavailableException if the store goes away mid-batch
   */
  public int upsert(EntityType entityType, List<SourceRow> rows) {
    EntityMapping mapping = mappings.forType(entityType);
    int total = rows.size();
    int applied = 0;
    int skipped = 0;

    for (int i = 0; i < total; i++) {
      SourceRow row = rows.get(i);
      Object key = row.get(entityType.keyColumn());
      try {
        Optional<UpsertPlan> plan = mapping.plan(row);
        if (plan.isEmpty()) {
          skipped++;
          log.warn("Skipping {} row {}: missing identifying key in {}", entityType, i + 1, row);
          continue;
        }
        CypherRenderer.Statement statement = CypherRenderer.render(plan.get());
        session.write(statement.cypher(), statement.params());
        applied++;
      } catch (GraphStoreUnavailableException e) {
        throw e;
      } catch (RuntimeException e) {
        log.error("{} row {}/{} (key {}) failed: {}", entityType, i + 1, total, key, e.getMessage());
        throw new RowUpsertException(
            entityType,
            i + 1,
            key,
            "Failed to upsert " + entityType + " row " + (i + 1) + "/" + total + ": " + e.getMessage(),
            e);
      }
      if (progressInterval > 0 && (i + 1) % progressInterval == 0) {
        log.info("{} loaded: {}/{}", entityType.pluralName(), i + 1, total);
      }
    }

    log.info(
        "{} loaded: {}/{} ({} skipped)", entityType.pluralName(), applied, total, skipped);
    return applied;
  }
}
