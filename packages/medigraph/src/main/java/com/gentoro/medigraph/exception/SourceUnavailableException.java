package com.gentoro.medigraph.exception;

/** The relational source could not be reached or rejected the credentials. */
public class SourceUnavailableException extends MedigraphException {
  public SourceUnavailableException(String message, Throwable cause) {
    super(MedigraphErrorCode.SOURCE_UNAVAILABLE, message, cause);
  }
}
