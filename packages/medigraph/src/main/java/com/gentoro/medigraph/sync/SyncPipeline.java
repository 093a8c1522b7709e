package com.gentoro.medigraph.sync;

import com.gentoro.medigraph.graph.GraphSchema;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.source.Extractor;
import com.gentoro.medigraph.source.SourceConnectionFactory;
import com.gentoro.medigraph.sync.mapping.EntityMappings;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The batch job: for each entity type in {@link EntityType#LOAD_ORDER}, consult the {@link
 * LoadStateGate}, extract a capped batch and upsert it.
 *
 * <p>The source connection and the graph store are opened once per run and always released. The
 * first fatal error stops the run; entity types loaded before it stay in the graph.
 */
public class SyncPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(SyncPipeline.class);

  private final SourceConnectionFactory sourceConnections;
  private final Function<Connection, Extractor> extractors;
  private final Supplier<GraphStore> graphStores;
  private final EntityMappings mappings;
  private final SyncOptions options;

  public SyncPipeline(
      SourceConnectionFactory sourceConnections,
      Function<Connection, Extractor> extractors,
      Supplier<GraphStore> graphStores,
      EntityMappings mappings,
      SyncOptions options) {
    this.sourceConnections = sourceConnections;
    this.extractors = extractors;
    this.graphStores = graphStores;
    this.mappings = Objects.requireNonNull(mappings, "mappings");
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Whether {@link #run(String)} needs a one-time passcode for the source. */
  public boolean requiresPasscode() {
    return sourceConnections != null && sourceConnections.requiresPasscode();
  }

  /** Connect to the source with {@code passcode}, then the graph, and run the full load. */
  public SyncReport run(String passcode) {
    Objects.requireNonNull(sourceConnections, "No source connection factory configured");
    Connection connection = sourceConnections.open(passcode);
    try {
      Extractor extractor = extractors.apply(connection);
      try (GraphStore store = graphStores.get()) {
        store.initialize();
        try (GraphSession session = store.openSession()) {
          return run(extractor, session);
        }
      }
    } finally {
      closeSource(connection);
    }
  }

  /** Run the load against already opened endpoints. The caller owns both. */
  public SyncReport run(Extractor extractor, GraphSession session) {
    GraphSchema.ensureConstraints(session);
    LoadStateGate gate = new LoadStateGate(session, options.skipLoadedTypes());
    GraphLoader loader = new GraphLoader(session, mappings, options.progressInterval());
    SyncReport report = new SyncReport();

    for (EntityType type : EntityType.LOAD_ORDER) {
      if (gate.shouldSkip(type)) {
        log.warn("{} already exist in the graph, skipping import", type.pluralName());
        report.add(EntityLoadResult.skipped(type));
        continue;
      }
      log.info("Importing {} (up to {} rows)", type.pluralName(), options.maxRowsPerEntity());
      List<SourceRow> rows = extractor.fetch(type, options.maxRowsPerEntity());
      int applied = loader.upsert(type, rows);
      report.add(EntityLoadResult.loaded(type, rows.size(), applied));
    }
    log.info("Load complete: {}", report.summary());
    return report;
  }

  private static void closeSource(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Error while closing source connection: {}", e.getMessage());
    }
  }
}
