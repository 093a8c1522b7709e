package com.gentoro.medigraph.exception;

/** Authentication or network failure against the graph store. */
public class GraphStoreUnavailableException extends MedigraphException {
  public GraphStoreUnavailableException(String message, Throwable cause) {
    super(MedigraphErrorCode.GRAPH_STORE_UNAVAILABLE, message, cause);
  }
}
