package com.gentoro.medigraph.graph;

import java.util.List;
import java.util.Map;

/** Scoped unit of work against a {@link GraphStore}. Every call runs in its own transaction. */
public interface GraphSession extends AutoCloseable {

  /**
   * Run an updating statement and commit it. Either all of its effects are applied or none are.
   *
   * @throws com.gentoro.medigraph.exception.GraphStoreException if the statement fails
   * @throws com.gentoro.medigraph.exception.GraphStoreUnavailableException if the backend is gone
   */
  void write(String cypher, Map<String, Object> params);

  default void write(String cypher) {
    write(cypher, Map.of());
  }

  /**
   * Run a read query and materialize its records. Each record preserves the query's column order.
   */
  List<Map<String, Object>> read(String cypher, Map<String, Object> params);

  default List<Map<String, Object>> read(String cypher) {
    return read(cypher, Map.of());
  }

  @Override
  void close();
}
