package com.gentoro.medigraph.graph.driver.spi;

import com.gentoro.medigraph.Medigraph;
import com.gentoro.medigraph.graph.GraphStore;

/**
 * Service Provider Interface for pluggable graph store backends.
 *
 * <p>Implementations register through ServiceLoader by adding their fully qualified class name to:
 * META-INF/services/com.gentoro.medigraph.graph.driver.spi.GraphStoreProvider
 */
public interface GraphStoreProvider {
  /** Unique driver id used in configuration ({@code graph.driver}). */
  String id();

  /** Whether the provider can operate in the current runtime. */
  default boolean isAvailable(Medigraph medigraph) {
    return true;
  }

  /** Create a new, not yet initialized store bound to this application's configuration. */
  GraphStore create(Medigraph medigraph);
}
