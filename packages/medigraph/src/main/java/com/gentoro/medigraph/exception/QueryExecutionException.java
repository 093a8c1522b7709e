package com.gentoro.medigraph.exception;

/** A read query failed. Only raised on the question-answering path, where it is absorbed. */
public class QueryExecutionException extends MedigraphException {
  public QueryExecutionException(String message) {
    super(MedigraphErrorCode.QUERY_EXECUTION_ERROR, message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(MedigraphErrorCode.QUERY_EXECUTION_ERROR, message, cause);
  }
}
