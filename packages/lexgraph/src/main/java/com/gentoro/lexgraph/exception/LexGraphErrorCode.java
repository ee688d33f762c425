package com.gentoro.lexgraph.exception;

/**
 * Stable failure codes. Each code maps to the process exit status the command line reports for
 * it: bad arguments are usage errors, graph store failures are ingestion errors, and everything
 * else counts as an input error.
 */
public enum LexGraphErrorCode {
  UNKNOWN(1),
  INVALID_ARGUMENT(64),
  ILLEGAL_STATE(1),
  CONFIGURATION_ERROR(1),
  IO_ERROR(1),
  SERIALIZATION_ERROR(1),
  STRUCTURE_ERROR(1),
  LOADER_ERROR(2);

  private final int exitStatus;

  LexGraphErrorCode(int exitStatus) {
    this.exitStatus = exitStatus;
  }

  public int exitStatus() {
    return exitStatus;
  }
}
