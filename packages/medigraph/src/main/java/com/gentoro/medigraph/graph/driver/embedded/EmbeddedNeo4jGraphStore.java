package com.gentoro.medigraph.graph.driver.embedded;

import com.gentoro.medigraph.exception.GraphStoreException;
import com.gentoro.medigraph.exception.GraphStoreUnavailableException;
import com.gentoro.medigraph.exception.MedigraphException;
import com.gentoro.medigraph.exception.StateException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.neo4j.configuration.GraphDatabaseSettings;
import org.neo4j.dbms.api.DatabaseManagementService;
import org.neo4j.dbms.api.DatabaseManagementServiceBuilder;
import org.neo4j.graphdb.Entity;
import org.neo4j.graphdb.GraphDatabaseService;
import org.neo4j.graphdb.Result;
import org.neo4j.graphdb.Transaction;

/**
 * {@link GraphStore} backed by an embedded Neo4j DBMS rooted at a local directory. Used for local
 * runs without a server and by the integration tests.
 */
public class EmbeddedNeo4jGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(EmbeddedNeo4jGraphStore.class);

  private final File rootDir;
  private final String database;

  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private DatabaseManagementService managementService;
  private GraphDatabaseService graphDb;

  public EmbeddedNeo4jGraphStore(Path rootDir, String database) {
    this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toFile();
    this.database = database != null && !database.isBlank() ? database : "neo4j";
  }

  public static EmbeddedNeo4jGraphStore fromConfiguration(Configuration configuration) {
    String root =
        configuration.getString(
            "graph.neo4j.embedded.rootDir", new File("data/neo4j").getAbsolutePath());
    String database = configuration.getString("graph.neo4j.database", "neo4j");
    return new EmbeddedNeo4jGraphStore(Path.of(root), database);
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;
    if (!rootDir.exists() && !rootDir.mkdirs()) {
      throw new GraphStoreUnavailableException(
          "Unable to create Neo4j root directory: " + rootDir, null);
    }
    log.info("Starting embedded Neo4j database '{}' at {}", database, rootDir);
    try {
      managementService =
          new DatabaseManagementServiceBuilder(rootDir.toPath())
              .setConfig(GraphDatabaseSettings.initial_default_database, database)
              .build();
      graphDb = managementService.database(database);
    } catch (RuntimeException ex) {
      shutdown();
      throw new GraphStoreUnavailableException(
          "Failed to open embedded Neo4j database '" + database + "' at " + rootDir, ex);
    }
    initialized.set(true);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public GraphSession openSession() {
    if (!initialized.get()) {
      throw new StateException("Embedded graph store is not initialized");
    }
    return new EmbeddedSession();
  }

  @Override
  public String getDriverName() {
    return "neo4j-embedded";
  }

  @Override
  public String getDatabaseName() {
    return database;
  }

  @Override
  public void shutdown() {
    initialized.set(false);
    if (managementService != null) {
      try {
        managementService.shutdown();
      } catch (RuntimeException ex) {
        log.warn("Error while shutting down embedded Neo4j at {}: {}", rootDir, ex.getMessage());
      } finally {
        managementService = null;
        graphDb = null;
      }
    }
  }

  private final class EmbeddedSession implements GraphSession {
    private boolean open = true;

    @Override
    public void write(String cypher, Map<String, Object> params) {
      ensureOpen();
      try (Transaction tx = graphDb.beginTx()) {
        try (Result result = tx.execute(cypher, params)) {
          // Updating statements run as the result is consumed
          while (result.hasNext()) {
            result.next();
          }
        }
        tx.commit();
      } catch (MedigraphException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        throw new GraphStoreException("Graph write failed: " + ex.getMessage(), ex);
      }
    }

    @Override
    public List<Map<String, Object>> read(String cypher, Map<String, Object> params) {
      ensureOpen();
      try (Transaction tx = graphDb.beginTx();
          Result result = tx.execute(cypher, params)) {
        List<String> columns = result.columns();
        List<Map<String, Object>> out = new ArrayList<>();
        while (result.hasNext()) {
          Map<String, Object> row = result.next();
          Map<String, Object> ordered = new LinkedHashMap<>();
          for (String column : columns) {
            ordered.put(column, toPlainValue(row.get(column)));
          }
          out.add(ordered);
        }
        return out;
      } catch (MedigraphException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        throw new GraphStoreException("Graph read failed: " + ex.getMessage(), ex);
      }
    }

    @Override
    public void close() {
      open = false;
    }

    private void ensureOpen() {
      if (!open) throw new StateException("Graph session already closed");
      if (!initialized.get()) throw new StateException("Embedded graph store is shut down");
    }
  }

  /** Nodes and relationships must not escape their transaction; keep only their properties. */
  private static Object toPlainValue(Object value) {
    if (value instanceof Entity) {
      return new LinkedHashMap<>(((Entity) value).getAllProperties());
    }
    if (value instanceof List<?>) {
      List<Object> copy = new ArrayList<>();
      for (Object item : (List<?>) value) copy.add(toPlainValue(item));
      return copy;
    }
    if (value instanceof Object[]) {
      List<Object> copy = new ArrayList<>();
      for (Object item : (Object[]) value) copy.add(toPlainValue(item));
      return copy;
    }
    return value;
  }
}
