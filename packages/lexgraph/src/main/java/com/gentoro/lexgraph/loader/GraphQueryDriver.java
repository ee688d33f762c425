package com.gentoro.lexgraph.loader;

import java.util.List;
import java.util.Map;

/**
 * Read-only queries against a loaded legal graph, used to demonstrate a finished ingestion.
 *
 * <p>Results are plain maps so they can be printed or serialized without knowing the store.
 */
public interface GraphQueryDriver extends AutoCloseable {

  /** Initialize the driver and underlying connections/resources. */
  void initialize();

  boolean isInitialized();

  /**
   * A unit with its surroundings.
   *
   * @param citation unit citation, e.g. {@code 26 USC 1}
   * @return map with {@code unit}, {@code ancestors} (root first), {@code children} and outgoing
   *     {@code references}; {@code null} when the unit is not stored
   */
  Map<String, Object> sectionWithContext(String citation);

  /**
   * Units whose text refers to the given citation.
   *
   * @return one map per incoming reference with {@code source}, {@code heading}, {@code type} and
   *     {@code context}
   */
  List<Map<String, Object>> referencingUnits(String citation);

  String getDriverName();

  /** Shut down the driver and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
