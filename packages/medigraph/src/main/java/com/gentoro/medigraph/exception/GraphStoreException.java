package com.gentoro.medigraph.exception;

/** A statement was rejected or failed inside the graph store. */
public class GraphStoreException extends MedigraphException {
  public GraphStoreException(String message) {
    super(MedigraphErrorCode.GRAPH_STORE_ERROR, message);
  }

  public GraphStoreException(String message, Throwable cause) {
    super(MedigraphErrorCode.GRAPH_STORE_ERROR, message, cause);
  }
}
