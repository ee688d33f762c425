package com.gentoro.lexgraph.model;

import java.util.List;
import java.util.Objects;

/**
 * One node of the legal hierarchy (title, chapter, section, subsection, ...).
 *
 * <p>Units are immutable and live in a {@link UnitTree}; the parent and children are referenced by
 * identifier and resolved through the tree.
 */
public final class StructuralUnit {
  private final String identifier;
  private final String citation;
  private final UnitKind kind;
  private final String designator;
  private final String heading;
  private final String text;
  private final UnitStatus status;
  private final String parentIdentifier;
  private final List<String> childIdentifiers;
  private final String hierarchicalPath;
  private final String sourceIdentifier;
  private final int ordinal;

  public StructuralUnit(
      String identifier,
      String citation,
      UnitKind kind,
      String designator,
      String heading,
      String text,
      UnitStatus status,
      String parentIdentifier,
      List<String> childIdentifiers,
      String hierarchicalPath,
      String sourceIdentifier,
      int ordinal) {
    this.identifier = Objects.requireNonNull(identifier, "identifier");
    this.citation = citation;
    this.kind = Objects.requireNonNull(kind, "kind");
    this.designator = designator;
    this.heading = heading;
    this.text = text == null ? "" : text;
    this.status = status == null ? UnitStatus.ACTIVE : status;
    this.parentIdentifier = parentIdentifier;
    this.childIdentifiers = childIdentifiers == null ? List.of() : List.copyOf(childIdentifiers);
    this.hierarchicalPath = hierarchicalPath;
    this.sourceIdentifier = sourceIdentifier;
    this.ordinal = ordinal;
  }

  public String getIdentifier() {
    return identifier;
  }

  /** Canonical citation such as {@code 26 USC 162(a)}; {@code null} when underivable. */
  public String getCitation() {
    return citation;
  }

  public UnitKind getKind() {
    return kind;
  }

  public String getDesignator() {
    return designator;
  }

  public String getHeading() {
    return heading;
  }

  public String getText() {
    return text;
  }

  public UnitStatus getStatus() {
    return status;
  }

  public String getParentIdentifier() {
    return parentIdentifier;
  }

  public List<String> getChildIdentifiers() {
    return childIdentifiers;
  }

  public String getHierarchicalPath() {
    return hierarchicalPath;
  }

  public String getSourceIdentifier() {
    return sourceIdentifier;
  }

  public int getOrdinal() {
    return ordinal;
  }

  public boolean isContainer() {
    return kind.isContainer();
  }

  public boolean isContent() {
    return kind.isContent();
  }

  public boolean isRoot() {
    return parentIdentifier == null;
  }

  /** Short label such as {@code Section 162: Trade or business expenses}. */
  public String label() {
    return labelOf(kind, designator, heading);
  }

  public static String labelOf(UnitKind kind, String designator, String heading) {
    String base;
    if (designator == null) {
      base = kind.label();
    } else if (kind.isSubunit()) {
      base = designator;
    } else {
      base = kind.label() + " " + designator;
    }
    if (heading == null || heading.isBlank()) {
      return base;
    }
    return kind.isSubunit() ? base + " " + heading : base + ": " + heading;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StructuralUnit)) return false;
    StructuralUnit that = (StructuralUnit) o;
    return identifier.equals(that.identifier);
  }

  @Override
  public int hashCode() {
    return identifier.hashCode();
  }

  @Override
  public String toString() {
    return "StructuralUnit{"
        + "identifier='"
        + identifier
        + '\''
        + ", citation='"
        + citation
        + '\''
        + ", kind="
        + kind
        + ", status="
        + status
        + '}';
  }
}
