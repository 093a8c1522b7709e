package com.gentoro.medigraph.exception;

/** A component was used outside its lifecycle (e.g. before initialization). */
public class StateException extends MedigraphException {
  public StateException(String message) {
    super(MedigraphErrorCode.STATE_ERROR, message);
  }
}
