package com.gentoro.lexgraph.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the LexGraph failure hierarchy. Every failure carries a {@link LexGraphErrorCode} and may
 * carry context entries such as the failing batch or the deepest unit reached; {@link
 * ExceptionUtil#describe(Throwable)} prints both on the error line.
 */
public class LexGraphException extends RuntimeException {
  private final LexGraphErrorCode code;
  private final Map<String, Object> context;

  public LexGraphException(LexGraphErrorCode code, String message) {
    this(code, message, null, null);
  }

  public LexGraphException(LexGraphErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public LexGraphException(LexGraphErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public LexGraphException(
      LexGraphErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    // LinkedHashMap keeps insertion order and tolerates null values
    Map<String, Object> copy = new LinkedHashMap<>();
    if (context != null) {
      copy.putAll(context);
    }
    this.context = Collections.unmodifiableMap(copy);
  }

  public LexGraphErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
  }
}
