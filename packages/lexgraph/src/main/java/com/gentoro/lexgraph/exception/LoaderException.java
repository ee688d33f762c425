package com.gentoro.lexgraph.exception;

import java.util.Map;

/**
 * The graph store was unreachable or rejected a batch. Surfaced as a fatal ingestion failure;
 * batches applied before the failure are left in place since upserts are safe to retry.
 */
public class LoaderException extends LexGraphException {
  public LoaderException(String message) {
    super(LexGraphErrorCode.LOADER_ERROR, message);
  }

  public LoaderException(String message, Throwable cause) {
    super(LexGraphErrorCode.LOADER_ERROR, message, cause);
  }

  public LoaderException(String message, Map<String, ?> context, Throwable cause) {
    super(LexGraphErrorCode.LOADER_ERROR, message, context, cause);
  }
}
