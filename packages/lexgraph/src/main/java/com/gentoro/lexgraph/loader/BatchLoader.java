package com.gentoro.lexgraph.loader;

import com.gentoro.lexgraph.projection.EdgeKind;
import com.gentoro.lexgraph.projection.GraphEdge;
import com.gentoro.lexgraph.projection.GraphNode;
import java.util.List;
import java.util.Map;

/**
 * Persists projected nodes and edges in a graph store.
 *
 * <p>Every write is an upsert: nodes are keyed by {@link GraphNode#getId()}, edges by {@link
 * GraphEdge#identityKey()}, so sending the same batch twice leaves the store unchanged. Callers
 * send the nodes an edge refers to before the edge itself. Failures are reported as {@link
 * com.gentoro.lexgraph.exception.LoaderException}.
 */
public interface BatchLoader extends AutoCloseable {

  /** Initialize the loader and any underlying connections/resources. */
  void initialize();

  /** @return true when the loader is ready to accept writes. */
  boolean isInitialized();

  /** Insert or replace a batch of nodes. */
  void upsertNodes(List<GraphNode> nodes);

  /** Insert or replace a batch of edges whose endpoints are already stored. */
  void upsertEdges(List<GraphEdge> edges);

  /** Remove every node and edge. */
  void clear();

  long nodeCount();

  /** Stored edges per kind; kinds with no edges map to zero. */
  Map<EdgeKind, Long> edgeCounts();

  /** @return logical driver identifier (e.g. {@code arangodb}). */
  String getDriverName();

  /** Clean up resources. Equivalent to {@link #shutdown()}. */
  @Override
  default void close() {
    shutdown();
  }

  /** Shut down the loader and release resources. */
  void shutdown();
}
