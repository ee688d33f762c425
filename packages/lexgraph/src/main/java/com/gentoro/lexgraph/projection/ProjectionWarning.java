package com.gentoro.lexgraph.projection;

/** A unit or edge left out of the projection because it has no citation to key it by. */
public record ProjectionWarning(String unitIdentifier, String reason) {
  public String describe() {
    return unitIdentifier + ": " + reason;
  }
}
