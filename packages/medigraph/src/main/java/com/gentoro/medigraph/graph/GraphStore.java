package com.gentoro.medigraph.graph;

/**
 * Property-graph store used by both the loader and the question router.
 *
 * <p>A store owns the connection to the backend (a remote server or an embedded DBMS) and hands
 * out short-lived {@link GraphSession}s. The loader opens one session per pipeline run; the router
 * opens one per question. Implementations must not leak vendor types to callers.
 */
public interface GraphStore extends AutoCloseable {
  /** Connect to (or start) the backend. Idempotent. */
  void initialize();

  boolean isInitialized();

  /** Open a new session. The caller must close it. */
  GraphSession openSession();

  /** Logical backend/driver name. */
  String getDriverName();

  /** Database the store reads from and writes to. */
  String getDatabaseName();

  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
