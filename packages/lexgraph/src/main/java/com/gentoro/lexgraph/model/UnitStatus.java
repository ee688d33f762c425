package com.gentoro.lexgraph.model;

import java.util.Locale;

public enum UnitStatus {
  ACTIVE,
  REPEALED,
  EXPIRED,
  RESERVED;

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Whether text of a unit in this status is in force and worth scanning for references. */
  public boolean isOperative() {
    return this == ACTIVE || this == EXPIRED;
  }
}
