package com.gentoro.lexgraph.loader.memory;

import com.gentoro.lexgraph.exception.LoaderException;
import com.gentoro.lexgraph.exception.StateException;
import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.GraphQueryDriver;
import com.gentoro.lexgraph.projection.EdgeKind;
import com.gentoro.lexgraph.projection.GraphEdge;
import com.gentoro.lexgraph.projection.GraphNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graph store kept in process memory. Holds nodes by id and edges by identity key, so it has the
 * same upsert semantics as a persistent store; an edge whose endpoints are not stored is rejected.
 */
public class InMemoryGraphStore implements BatchLoader, GraphQueryDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(InMemoryGraphStore.class);

  private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
  private final Map<GraphEdge.Key, GraphEdge> edges = new LinkedHashMap<>();
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  @Override
  public void initialize() {
    if (initialized.compareAndSet(false, true)) {
      log.debug("In-memory graph store ready");
    }
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public synchronized void upsertNodes(List<GraphNode> batch) {
    ensureInitialized();
    if (batch == null) return;
    for (GraphNode node : batch) {
      nodes.put(node.getId(), Collections.unmodifiableMap(new LinkedHashMap<>(node.toMap())));
    }
  }

  @Override
  public synchronized void upsertEdges(List<GraphEdge> batch) {
    ensureInitialized();
    if (batch == null) return;
    for (GraphEdge edge : batch) {
      if (!nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
        throw new LoaderException(
            "Edge refers to a node that has not been stored: " + edge,
            Map.of("edge", edge.identityKey().asString()),
            null);
      }
      edges.put(edge.identityKey(), edge);
    }
  }

  @Override
  public synchronized void clear() {
    ensureInitialized();
    nodes.clear();
    edges.clear();
  }

  @Override
  public synchronized long nodeCount() {
    return nodes.size();
  }

  @Override
  public synchronized Map<EdgeKind, Long> edgeCounts() {
    Map<EdgeKind, Long> counts = new EnumMap<>(EdgeKind.class);
    for (EdgeKind kind : EdgeKind.values()) counts.put(kind, 0L);
    for (GraphEdge edge : edges.values()) counts.merge(edge.getKind(), 1L, Long::sum);
    return counts;
  }

  public synchronized Optional<Map<String, Object>> node(String id) {
    return Optional.ofNullable(nodes.get(id));
  }

  public synchronized List<GraphEdge> edges() {
    return List.copyOf(edges.values());
  }

  @Override
  public synchronized Map<String, Object> sectionWithContext(String citation) {
    Map<String, Object> unit = nodes.get(citation);
    if (unit == null) return null;

    List<Map<String, Object>> ancestors = new ArrayList<>();
    String current = parentOf(citation);
    while (current != null) {
      ancestors.add(0, summary(nodes.get(current)));
      current = parentOf(current);
    }

    List<Map<String, Object>> children = new ArrayList<>();
    List<Map<String, Object>> references = new ArrayList<>();
    for (GraphEdge edge : edges.values()) {
      if (!edge.getSourceId().equals(citation)) continue;
      if (edge.getKind() == EdgeKind.PARENT_OF) {
        children.add(summary(nodes.get(edge.getTargetId())));
      } else {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("target", edge.getTargetId());
        ref.put("type", edge.getType());
        ref.put("context", edge.getProperties().get(GraphEdge.CONTEXT));
        references.add(ref);
      }
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("unit", unit);
    result.put("ancestors", ancestors);
    result.put("children", children);
    result.put("references", references);
    return result;
  }

  @Override
  public synchronized List<Map<String, Object>> referencingUnits(String citation) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (GraphEdge edge : edges.values()) {
      if (edge.getKind() != EdgeKind.REFERENCES || !edge.getTargetId().equals(citation)) continue;
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("source", edge.getSourceId());
      row.put("heading", nodes.get(edge.getSourceId()).get("heading"));
      row.put("type", edge.getType());
      row.put("context", edge.getProperties().get(GraphEdge.CONTEXT));
      out.add(row);
    }
    out.sort((a, b) -> a.get("source").toString().compareTo(b.get("source").toString()));
    return out;
  }

  private String parentOf(String citation) {
    for (GraphEdge edge : edges.values()) {
      if (edge.getKind() == EdgeKind.PARENT_OF && edge.getTargetId().equals(citation)) {
        return edge.getSourceId();
      }
    }
    return null;
  }

  private static Map<String, Object> summary(Map<String, Object> node) {
    Map<String, Object> s = new LinkedHashMap<>();
    s.put("citation", node.get("id"));
    s.put("kind", node.get("kind"));
    s.put("heading", node.get("heading"));
    s.put("status", node.get("status"));
    return s;
  }

  private void ensureInitialized() {
    if (!initialized.get()) {
      throw new StateException("In-memory graph store is not initialized");
    }
  }

  @Override
  public String getDriverName() {
    return "in-memory";
  }

  @Override
  public void shutdown() {
    initialized.set(false);
  }

  /** Both interfaces default {@code close()} to {@link #shutdown()}; this picks one. */
  @Override
  public void close() {
    shutdown();
  }
}
