package com.gentoro.lexgraph.reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** References found in a document (or one unit) plus the phrases that could not be used. */
public final class ExtractionResult {
  private final List<Reference> references;
  private final List<ReferenceResolutionWarning> warnings;

  public ExtractionResult(List<Reference> references, List<ReferenceResolutionWarning> warnings) {
    this.references = List.copyOf(references);
    this.warnings = List.copyOf(warnings);
  }

  public static ExtractionResult empty() {
    return new ExtractionResult(List.of(), List.of());
  }

  /** Concatenates results in the given order. */
  public static ExtractionResult merge(List<ExtractionResult> parts) {
    List<Reference> refs = new ArrayList<>();
    List<ReferenceResolutionWarning> warns = new ArrayList<>();
    for (ExtractionResult part : parts) {
      refs.addAll(part.references);
      warns.addAll(part.warnings);
    }
    return new ExtractionResult(refs, warns);
  }

  public List<Reference> references() {
    return references;
  }

  public List<ReferenceResolutionWarning> warnings() {
    return warnings;
  }

  public int size() {
    return references.size();
  }

  /** Outgoing references grouped by source citation, document order preserved. */
  public Map<String, List<Reference>> bySource() {
    Map<String, List<Reference>> grouped = new LinkedHashMap<>();
    for (Reference ref : references) {
      grouped.computeIfAbsent(ref.sourceCitation(), k -> new ArrayList<>()).add(ref);
    }
    return Collections.unmodifiableMap(grouped);
  }

  public List<Reference> from(String sourceCitation) {
    return bySource().getOrDefault(sourceCitation, List.of());
  }

  public List<Reference> to(String targetCitation) {
    List<Reference> out = new ArrayList<>();
    for (Reference ref : references) {
      if (ref.targetCitation().equals(targetCitation)) out.add(ref);
    }
    return out;
  }

  public Map<ReferenceType, Integer> countsByType() {
    Map<ReferenceType, Integer> counts = new EnumMap<>(ReferenceType.class);
    for (Reference ref : references) {
      counts.merge(ref.type(), 1, Integer::sum);
    }
    return counts;
  }
}
