package com.gentoro.lexgraph.exception;

/** A component was used before {@code initialize()} or after {@code shutdown()}. */
public class StateException extends LexGraphException {
  public StateException(String message) {
    super(LexGraphErrorCode.ILLEGAL_STATE, message);
  }
}
