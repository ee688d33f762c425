package com.gentoro.lexgraph.reference;

/** A citation-shaped phrase that was not turned into a reference. */
public record ReferenceResolutionWarning(
    String sourceCitation, String phrase, String targetCitation, Reason reason) {

  public enum Reason {
    /** No unit with the target citation exists in the parsed document. */
    UNRESOLVED,
    /** The phrase points into another title or another Act. */
    EXTERNAL
  }

  public String describe() {
    return switch (reason) {
      case UNRESOLVED -> sourceCitation + ": '" + phrase + "' -> " + targetCitation + " not found";
      case EXTERNAL -> sourceCitation + ": '" + phrase + "' refers outside this document";
    };
  }
}
