package com.gentoro.lexgraph.exception;

/** An input document, dialect, query template or export target could not be read or written. */
public class IoException extends LexGraphException {
  public IoException(String message) {
    super(LexGraphErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(LexGraphErrorCode.IO_ERROR, message, cause);
  }
}
