package com.gentoro.lexgraph.exception;

/** Jackson or Commons Configuration failed to read or write a YAML or JSON document. */
public class SerializationException extends LexGraphException {
  public SerializationException(String message, Throwable cause) {
    super(LexGraphErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
