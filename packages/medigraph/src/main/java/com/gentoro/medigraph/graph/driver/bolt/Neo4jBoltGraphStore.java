package com.gentoro.medigraph.graph.driver.bolt;

import com.gentoro.medigraph.ConfigurationProvider;
import com.gentoro.medigraph.exception.GraphStoreException;
import com.gentoro.medigraph.exception.GraphStoreUnavailableException;
import com.gentoro.medigraph.exception.StateException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.types.Entity;

/** {@link GraphStore} for a remote Neo4j server (self-hosted or Aura) reached over Bolt. */
public class Neo4jBoltGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(Neo4jBoltGraphStore.class);

  private final String uri;
  private final String user;
  private final String password;
  private final String database;

  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private Driver driver;

  public Neo4jBoltGraphStore(String uri, String user, String password, String database) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.user = Objects.requireNonNull(user, "user");
    this.password = Objects.requireNonNull(password, "password");
    this.database = database != null && !database.isBlank() ? database : "neo4j";
  }

  /**
   * Build from {@code graph.neo4j.*}. Raises {@link
   * com.gentoro.medigraph.exception.ConfigurationException} before connecting when the URI or
   * credentials are missing.
   */
  public static Neo4jBoltGraphStore fromConfiguration(Configuration configuration) {
    ConfigurationProvider.requireValues(
        configuration, "graph.neo4j.uri", "graph.neo4j.user", "graph.neo4j.password");
    return new Neo4jBoltGraphStore(
        configuration.getString("graph.neo4j.uri"),
        configuration.getString("graph.neo4j.user"),
        configuration.getString("graph.neo4j.password"),
        configuration.getString("graph.neo4j.database", "neo4j"));
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;
    log.info("Connecting to Neo4j at {} (database '{}')", uri, database);
    try {
      driver = GraphDatabase.driver(uri, AuthTokens.basic(user, password));
      driver.verifyConnectivity();
    } catch (AuthenticationException | ServiceUnavailableException | SessionExpiredException ex) {
      shutdown();
      throw new GraphStoreUnavailableException("Unable to connect to Neo4j at " + uri, ex);
    } catch (IllegalArgumentException | Neo4jException ex) {
      shutdown();
      throw new GraphStoreUnavailableException("Invalid Neo4j connection settings for " + uri, ex);
    }
    initialized.set(true);
    log.info("Connected to Neo4j at {}", uri);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public GraphSession openSession() {
    if (!initialized.get()) {
      throw new StateException("Neo4j graph store is not initialized");
    }
    return new BoltSession(driver.session(SessionConfig.forDatabase(database)));
  }

  @Override
  public String getDriverName() {
    return "neo4j";
  }

  @Override
  public String getDatabaseName() {
    return database;
  }

  @Override
  public void shutdown() {
    initialized.set(false);
    if (driver != null) {
      try {
        driver.close();
      } catch (RuntimeException ex) {
        log.warn("Error while closing Neo4j driver for {}: {}", uri, ex.getMessage());
      } finally {
        driver = null;
      }
    }
  }

  private static final class BoltSession implements GraphSession {
    private final Session session;

    BoltSession(Session session) {
      this.session = session;
    }

    @Override
    public void write(String cypher, Map<String, Object> params) {
      try {
        session.executeWrite(tx -> tx.run(cypher, params).consume());
      } catch (ServiceUnavailableException | SessionExpiredException ex) {
        throw new GraphStoreUnavailableException("Neo4j became unavailable", ex);
      } catch (Neo4jException ex) {
        throw new GraphStoreException("Graph write failed: " + ex.getMessage(), ex);
      }
    }

    @Override
    public List<Map<String, Object>> read(String cypher, Map<String, Object> params) {
      try {
        return session.executeRead(tx -> tx.run(cypher, params).list(BoltSession::toRow));
      } catch (ServiceUnavailableException | SessionExpiredException ex) {
        throw new GraphStoreUnavailableException("Neo4j became unavailable", ex);
      } catch (Neo4jException ex) {
        throw new GraphStoreException("Graph read failed: " + ex.getMessage(), ex);
      }
    }

    @Override
    public void close() {
      session.close();
    }

    private static Map<String, Object> toRow(Record record) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (String key : record.keys()) {
        row.put(key, toPlainValue(record.get(key)));
      }
      return row;
    }

    private static Object toPlainValue(Value value) {
      if (value == null || value.isNull()) return null;
      Object raw = value.asObject();
      if (raw instanceof Entity) {
        return new LinkedHashMap<>(((Entity) raw).asMap());
      }
      if (raw instanceof List<?>) {
        List<Object> copy = new ArrayList<>();
        for (Object item : (List<?>) raw) {
          copy.add(item instanceof Entity ? new LinkedHashMap<>(((Entity) item).asMap()) : item);
        }
        return copy;
      }
      return raw;
    }
  }
}
