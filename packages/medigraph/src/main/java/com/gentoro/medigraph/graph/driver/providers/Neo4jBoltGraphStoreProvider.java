package com.gentoro.medigraph.graph.driver.providers;

import com.gentoro.medigraph.Medigraph;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.graph.driver.bolt.Neo4jBoltGraphStore;
import com.gentoro.medigraph.graph.driver.spi.GraphStoreProvider;

/** Service provider for a remote Neo4j server reached over Bolt. */
public class Neo4jBoltGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "neo4j";
  }

  @Override
  public GraphStore create(Medigraph medigraph) {
    return Neo4jBoltGraphStore.fromConfiguration(medigraph.configuration());
  }
}
