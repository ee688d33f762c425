package com.gentoro.lexgraph.projection;

public enum EdgeKind {
  PARENT_OF,
  REFERENCES
}
