package com.gentoro.lexgraph.ingest;

import com.gentoro.lexgraph.projection.EdgeKind;
import java.util.Map;

/**
 * Outcome of one ingestion run: what was submitted and what the store holds afterwards.
 *
 * @param storedEdges edge totals read back from the store, per kind
 */
public record IngestionStats(
    int nodesSubmitted,
    int parentEdgesSubmitted,
    int referenceEdgesSubmitted,
    int batches,
    boolean cleared,
    long storedNodes,
    Map<EdgeKind, Long> storedEdges,
    long elapsedMillis) {

  public IngestionStats {
    storedEdges = Map.copyOf(storedEdges);
  }

  public long storedParentEdges() {
    return storedEdges.getOrDefault(EdgeKind.PARENT_OF, 0L);
  }

  public long storedReferenceEdges() {
    return storedEdges.getOrDefault(EdgeKind.REFERENCES, 0L);
  }
}
