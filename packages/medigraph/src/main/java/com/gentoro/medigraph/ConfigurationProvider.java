package com.gentoro.medigraph;

import com.gentoro.medigraph.exception.ConfigurationException;
import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Loads {@code application.yaml} either from an explicit file or from the classpath. Values may
 * reference environment variables with {@code ${env:NAME}}; placeholders that cannot be resolved
 * stay literal and are reported as missing by {@link #requireValues}.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String configFile) {
    this.config = load(configFile);
  }

  public Configuration config() {
    return config;
  }

  private static Configuration load(String configFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    FileHandler handler = new FileHandler(yaml);
    try {
      if (configFile != null && !configFile.isBlank()) {
        File file = new File(configFile);
        if (!file.isFile()) {
          throw new ConfigurationException("Configuration file not found: " + file.getAbsolutePath());
        }
        log.info("Loading configuration from {}", file.getAbsolutePath());
        handler.load(file);
      } else {
        URL resource = ConfigurationProvider.class.getClassLoader().getResource(DEFAULT_RESOURCE);
        if (resource == null) {
          throw new ConfigurationException("Classpath resource not found: " + DEFAULT_RESOURCE);
        }
        log.debug("Loading configuration from classpath {}", resource);
        handler.load(resource);
      }
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Unable to parse configuration: " + e.getMessage(), e);
    }
    return yaml;
  }

  /**
   * Ensure every key has a usable value. All missing keys are reported together.
   *
   * @throws ConfigurationException if any key is absent, blank or an unresolved placeholder
   */
  public static void requireValues(Configuration configuration, String... keys) {
    List<String> missing = new ArrayList<>();
    for (String key : keys) {
      if (!isResolved(configuration.getString(key, null))) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      throw new ConfigurationException(
          "Missing required configuration values: " + String.join(", ", missing));
    }
  }

  static boolean isResolved(String value) {
    return value != null && !value.isBlank() && !value.contains("${");
  }
}
