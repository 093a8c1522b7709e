package com.gentoro.medigraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medigraph.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tmp;

  @Test
  @DisplayName("Bundled application.yaml carries the load defaults")
  void classpathDefaults() {
    Configuration cfg = new ConfigurationProvider(null).config();

    assertEquals(7000, cfg.getInt("load.maxRowsPerEntity"));
    assertEquals(500, cfg.getInt("load.progressInterval"));
    assertEquals("neo4j", cfg.getString("graph.driver"));
    assertEquals("MEDIGRAPH.PUBLIC.OBSERVATIONS", cfg.getString("source.views.observation"));
  }

  @Test
  @DisplayName("An explicit file overrides the classpath")
  void explicitFile() throws Exception {
    Path file = tmp.resolve("custom.yaml");
    Files.writeString(file, "graph:\n  driver: neo4j-embedded\nrouter:\n  defaultConditionTerm: asthma\n");

    Configuration cfg = new ConfigurationProvider(file.toString()).config();

    assertEquals("neo4j-embedded", cfg.getString("graph.driver"));
    assertEquals("asthma", cfg.getString("router.defaultConditionTerm"));
  }

  @Test
  @DisplayName("A missing file is a configuration error")
  void missingFile() {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(tmp.resolve("nope.yaml").toString()));
  }

  @Test
  @DisplayName("requireValues reports absent, blank and unresolved keys together")
  void requireValues() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("a", "ok");
    cfg.setProperty("b", " ");
    cfg.setProperty("c", "${env:MEDIGRAPH_UNSET_VARIABLE}");

    ConfigurationException ex =
        assertThrows(
            ConfigurationException.class,
            () -> ConfigurationProvider.requireValues(cfg, "a", "b", "c", "d"));

    assertEquals("Missing required configuration values: b, c, d", ex.getMessage());
    assertDoesNotThrow(() -> ConfigurationProvider.requireValues(cfg, "a"));
  }
}
