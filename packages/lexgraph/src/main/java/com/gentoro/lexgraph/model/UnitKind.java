package com.gentoro.lexgraph.model;

import java.util.Locale;

/** Levels of the legal hierarchy, ordered from the outermost (title) to the innermost. */
public enum UnitKind {
  TITLE("Title"),
  SUBTITLE("Subtitle"),
  CHAPTER("Chapter"),
  SUBCHAPTER("Subchapter"),
  PART("Part"),
  SUBPART("Subpart"),
  SECTION("Section"),
  SUBSECTION("Subsection"),
  PARAGRAPH("Paragraph"),
  SUBPARAGRAPH("Subparagraph"),
  CLAUSE("Clause"),
  SUBCLAUSE("Subclause"),
  ITEM("Item"),
  SUBITEM("Subitem"),
  SUBSUBITEM("Subsubitem");

  private final String label;

  UnitKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Lower-case name used in identifiers and exported documents, e.g. {@code subsection}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public int depth() {
    return ordinal();
  }

  public boolean isContainer() {
    return ordinal() < SECTION.ordinal();
  }

  public boolean isContent() {
    return ordinal() >= SECTION.ordinal();
  }

  public boolean isSubunit() {
    return ordinal() > SECTION.ordinal();
  }

  /** True when a unit of this kind may directly contain a unit of {@code child} kind. */
  public boolean canContain(UnitKind child) {
    return child.ordinal() > ordinal();
  }

  public static UnitKind fromKey(String key) {
    if (key == null) {
      throw new IllegalArgumentException("Unit kind cannot be null");
    }
    return UnitKind.valueOf(key.trim().toUpperCase(Locale.ROOT));
  }
}
