package com.gentoro.lexgraph.projection;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Nodes and edges ready for loading, plus the warnings collected while projecting. */
public final class GraphProjection {
  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final List<ProjectionWarning> warnings;

  public GraphProjection(
      List<GraphNode> nodes, List<GraphEdge> edges, List<ProjectionWarning> warnings) {
    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
    this.warnings = List.copyOf(warnings);
  }

  public List<GraphNode> nodes() {
    return nodes;
  }

  public List<GraphEdge> edges() {
    return edges;
  }

  public List<ProjectionWarning> warnings() {
    return warnings;
  }

  public List<GraphEdge> edges(EdgeKind kind) {
    List<GraphEdge> out = new ArrayList<>();
    for (GraphEdge edge : edges) {
      if (edge.getKind() == kind) out.add(edge);
    }
    return out;
  }

  public Set<String> nodeIds() {
    Set<String> ids = new HashSet<>();
    for (GraphNode node : nodes) ids.add(node.getId());
    return ids;
  }

  /** Splits {@code items} into consecutive chunks of at most {@code size} elements. */
  public static <T> List<List<T>> batches(List<T> items, int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("Batch size must be positive: " + size);
    }
    List<List<T>> out = new ArrayList<>();
    for (int from = 0; from < items.size(); from += size) {
      out.add(items.subList(from, Math.min(items.size(), from + size)));
    }
    return out;
  }
}
