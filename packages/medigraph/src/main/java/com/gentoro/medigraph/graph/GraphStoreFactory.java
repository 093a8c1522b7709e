package com.gentoro.medigraph.graph;

import com.gentoro.medigraph.Medigraph;
import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.graph.driver.spi.GraphStoreProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/** Resolves the configured {@link GraphStoreProvider} through {@link ServiceLoader}. */
public final class GraphStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(GraphStoreFactory.class);

  public static final String DEFAULT_DRIVER = "neo4j";

  private GraphStoreFactory() {}

  /** Create (but do not initialize) the store selected by {@code graph.driver}. */
  public static GraphStore create(Medigraph medigraph) {
    String desired = medigraph.configuration().getString("graph.driver", DEFAULT_DRIVER);
    List<String> known = new ArrayList<>();
    for (GraphStoreProvider provider : ServiceLoader.load(GraphStoreProvider.class)) {
      known.add(provider.id());
      if (provider.id().equalsIgnoreCase(desired) && provider.isAvailable(medigraph)) {
        log.debug("Using graph store provider '{}'", provider.id());
        return provider.create(medigraph);
      }
    }
    throw new ConfigurationException(
        "No graph store provider available for graph.driver='" + desired + "'; known: " + known);
  }
}
