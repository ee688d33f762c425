package com.gentoro.lexgraph.projection;

import java.util.Map;

/**
 * A vertex handed to the graph store.
 *
 * <p>Each node has a unique id, which the store uses as its upsert key, and a flat property map.
 */
public interface GraphNode {
  /**
   * Get the unique id for this node.
   *
   * @return identity key of the node in the store
   */
  String getId();

  /**
   * Get the node type identifier (e.g., "legal_unit").
   *
   * @return node type string
   */
  String getNodeType();

  /**
   * Convert this node to a map suitable for storing.
   *
   * @return map of node properties
   */
  Map<String, Object> toMap();
}
