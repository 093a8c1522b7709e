package com.gentoro.medigraph.exception;

/** Stable error categories surfaced in logs and CLI diagnostics. */
public enum MedigraphErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  STATE_ERROR,
  SOURCE_UNAVAILABLE,
  SOURCE_QUERY_ERROR,
  GRAPH_STORE_UNAVAILABLE,
  GRAPH_STORE_ERROR,
  ROW_UPSERT_ERROR,
  QUERY_EXECUTION_ERROR
}
