package com.gentoro.lexgraph.exception;

/** Command line arguments that cannot be acted on. Reported with the usage text. */
public class ValidationException extends LexGraphException {
  public ValidationException(String message) {
    super(LexGraphErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(LexGraphErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
