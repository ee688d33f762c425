package com.gentoro.lexgraph.reference;

import java.util.Locale;

/** How one unit's text points at another. */
public enum ReferenceType {
  DEFINITION,
  EXCEPTION,
  SUBJECT_TO,
  GENERAL;

  /** Lower-case form stored on graph edges, e.g. {@code subject_to}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
