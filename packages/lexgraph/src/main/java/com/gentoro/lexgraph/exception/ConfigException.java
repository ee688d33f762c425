package com.gentoro.lexgraph.exception;

/** The configuration, a markup dialect, or the selected loader is unusable. */
public class ConfigException extends LexGraphException {
  public ConfigException(String message) {
    super(LexGraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LexGraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
