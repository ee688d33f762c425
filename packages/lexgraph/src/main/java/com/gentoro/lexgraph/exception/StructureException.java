package com.gentoro.lexgraph.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Malformed or unexpected markup nesting. Fatal for the whole document: the parser never returns a
 * partial tree once this is raised.
 */
public class StructureException extends LexGraphException {
  private final String deepestIdentifier;

  public StructureException(String deepestIdentifier, String description) {
    super(
        LexGraphErrorCode.STRUCTURE_ERROR,
        format(deepestIdentifier, description),
        context(deepestIdentifier));
    this.deepestIdentifier = deepestIdentifier;
  }

  public StructureException(String deepestIdentifier, String description, Throwable cause) {
    super(
        LexGraphErrorCode.STRUCTURE_ERROR,
        format(deepestIdentifier, description),
        context(deepestIdentifier),
        cause);
    this.deepestIdentifier = deepestIdentifier;
  }

  /**
   * @return identifier of the deepest unit that was fully resolved before the failure, or {@code
   *     null} when the failure happened before any unit was reached.
   */
  public String getDeepestIdentifier() {
    return deepestIdentifier;
  }

  private static String format(String deepestIdentifier, String description) {
    if (deepestIdentifier == null) {
      return description + " (before any structural unit)";
    }
    return description + " (last resolved unit: " + deepestIdentifier + ")";
  }

  private static Map<String, Object> context(String deepestIdentifier) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("deepestIdentifier", deepestIdentifier);
    return ctx;
  }
}
