package com.gentoro.medigraph.graph.driver.providers;

import com.gentoro.medigraph.Medigraph;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.graph.driver.embedded.EmbeddedNeo4jGraphStore;
import com.gentoro.medigraph.graph.driver.spi.GraphStoreProvider;

public class EmbeddedNeo4jGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "neo4j-embedded";
  }

  @Override
  public GraphStore create(Medigraph medigraph) {
    return EmbeddedNeo4jGraphStore.fromConfiguration(medigraph.configuration());
  }
}
