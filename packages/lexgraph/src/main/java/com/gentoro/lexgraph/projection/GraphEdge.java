package com.gentoro.lexgraph.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a directed edge between two nodes in the legal graph.
 *
 * <p>{@link EdgeKind#PARENT_OF} edges follow the hierarchy and carry no properties. {@link
 * EdgeKind#REFERENCES} edges carry the reference {@code type} and the matched {@code context}.
 */
public final class GraphEdge {
  public static final String TYPE = "type";
  public static final String CONTEXT = "context";

  private final EdgeKind kind;
  private final String sourceId;
  private final String targetId;
  private final Map<String, Object> properties;

  public GraphEdge(EdgeKind kind, String sourceId, String targetId) {
    this(kind, sourceId, targetId, Map.of());
  }

  public GraphEdge(
      EdgeKind kind, String sourceId, String targetId, Map<String, Object> properties) {
    if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
      throw new IllegalArgumentException("Edge endpoints cannot be null or empty");
    }
    this.kind = Objects.requireNonNull(kind, "kind");
    this.sourceId = sourceId;
    this.targetId = targetId;
    this.properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public static GraphEdge parentOf(String parentId, String childId) {
    return new GraphEdge(EdgeKind.PARENT_OF, parentId, childId);
  }

  public static GraphEdge references(String sourceId, String targetId, String type, String ctx) {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put(TYPE, type);
    props.put(CONTEXT, ctx);
    return new GraphEdge(EdgeKind.REFERENCES, sourceId, targetId, props);
  }

  public EdgeKind getKind() {
    return kind;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  /** Reference type for REFERENCES edges, {@code null} otherwise. */
  public String getType() {
    Object type = properties.get(TYPE);
    return type == null ? null : type.toString();
  }

  /** Upsert key: two edges with the same key are the same edge in the store. */
  public Key identityKey() {
    return new Key(kind, sourceId, targetId, getType());
  }

  /**
   * Convert this edge to a map suitable for storing.
   *
   * @return map of edge properties
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>(properties);
    map.put("kind", kind.name());
    map.put("source_id", sourceId);
    map.put("target_id", targetId);
    return map;
  }

  public record Key(EdgeKind kind, String sourceId, String targetId, String type) {
    /** Stable string form, e.g. {@code REFERENCES|26 USC 162|26 USC 274|exception}. */
    public String asString() {
      return kind.name() + "|" + sourceId + "|" + targetId + (type == null ? "" : "|" + type);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GraphEdge)) return false;
    GraphEdge that = (GraphEdge) o;
    return kind == that.kind
        && sourceId.equals(that.sourceId)
        && targetId.equals(that.targetId)
        && properties.equals(that.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, sourceId, targetId, properties);
  }

  @Override
  public String toString() {
    String type = getType() == null ? "" : ", " + getType();
    return kind + "(" + sourceId + " -> " + targetId + type + ")";
  }
}
