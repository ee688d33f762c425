package com.gentoro.lexgraph.reference;

import java.util.Objects;

/**
 * A directed cross-reference from one unit to another.
 *
 * @param sourceCitation citation of the unit whose text contains the phrase
 * @param targetCitation citation of the unit the phrase resolves to
 * @param type reference type of the pattern that matched
 * @param context text around the match, bounded in length
 * @param position offset of the referenced number in the source unit's text
 */
public record Reference(
    String sourceCitation,
    String targetCitation,
    ReferenceType type,
    String context,
    int position) {

  public Reference {
    Objects.requireNonNull(sourceCitation, "sourceCitation");
    Objects.requireNonNull(targetCitation, "targetCitation");
    Objects.requireNonNull(type, "type");
    if (sourceCitation.equals(targetCitation)) {
      throw new IllegalArgumentException("A unit cannot reference itself: " + sourceCitation);
    }
    context = context == null ? "" : context;
  }
}
