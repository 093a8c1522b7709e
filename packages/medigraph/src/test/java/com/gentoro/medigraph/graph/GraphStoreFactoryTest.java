package com.gentoro.medigraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medigraph.TestMedigraph;
import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.graph.driver.bolt.Neo4jBoltGraphStore;
import com.gentoro.medigraph.graph.driver.embedded.EmbeddedNeo4jGraphStore;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphStoreFactoryTest {

  @TempDir Path tmp;

  @Test
  @DisplayName("graph.driver selects the embedded provider")
  void embeddedDriver() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("graph.driver", "neo4j-embedded");
    cfg.setProperty("graph.neo4j.embedded.rootDir", tmp.toString());

    GraphStore store = GraphStoreFactory.create(new TestMedigraph(cfg));

    assertInstanceOf(EmbeddedNeo4jGraphStore.class, store);
    assertEquals("neo4j-embedded", store.getDriverName());
    assertFalse(store.isInitialized());
  }

  @Test
  @DisplayName("The Bolt provider is the default and does not connect on creation")
  void boltDefault() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("graph.neo4j.uri", "neo4j+s://example.databases.neo4j.io");
    cfg.setProperty("graph.neo4j.user", "neo4j");
    cfg.setProperty("graph.neo4j.password", "secret");

    GraphStore store = GraphStoreFactory.create(new TestMedigraph(cfg));

    assertInstanceOf(Neo4jBoltGraphStore.class, store);
    assertEquals("neo4j", store.getDatabaseName());
  }

  @Test
  @DisplayName("Missing Bolt credentials are a configuration error naming every key")
  void boltMissingCredentials() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("graph.neo4j.uri", "${env:NEO4J_URI}");

    ConfigurationException ex =
        assertThrows(
            ConfigurationException.class, () -> GraphStoreFactory.create(new TestMedigraph(cfg)));
    assertTrue(ex.getMessage().contains("graph.neo4j.uri"));
    assertTrue(ex.getMessage().contains("graph.neo4j.password"));
  }

  @Test
  @DisplayName("Unknown drivers are rejected")
  void unknownDriver() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("graph.driver", "arangodb");

    assertThrows(
        ConfigurationException.class, () -> GraphStoreFactory.create(new TestMedigraph(cfg)));
  }

  @Test
  @DisplayName("Sessions require an initialized store")
  void sessionBeforeInitialize() {
    EmbeddedNeo4jGraphStore store = new EmbeddedNeo4jGraphStore(tmp, "neo4j");
    assertThrows(
        com.gentoro.medigraph.exception.StateException.class, store::openSession);
  }
}
