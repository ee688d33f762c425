package com.gentoro.lexgraph.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.reference.ExtractionResult;
import com.gentoro.lexgraph.reference.Reference;
import com.gentoro.lexgraph.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the parsed hierarchy as nested JSON. Every unit carries its flat {@code identifier} as
 * well as its {@code children}, and its outgoing references when extraction results are given.
 */
public class JsonExporter {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(JsonExporter.class);

  public record ExportedDocument(
      String title,
      int totalSections,
      int totalUnits,
      int repealedSections,
      List<ExportedUnit> roots) {}

  public record ExportedUnit(
      String identifier,
      String citation,
      String kind,
      String designator,
      String heading,
      String text,
      String status,
      String parent,
      @JsonProperty("hierarchical_path") String hierarchicalPath,
      @JsonProperty("source_identifier") String sourceIdentifier,
      List<ExportedReference> references,
      List<ExportedUnit> children) {}

  public record ExportedReference(String target, String type, String context) {}

  public void export(UnitTree tree, ExtractionResult extraction, Path output) {
    String json = toJson(tree, extraction);
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(output, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write JSON export to " + output, e);
    }
    log.info("Exported {} units to {}", tree.totalUnits(), output);
  }

  /** @param extraction may be {@code null} to leave references out */
  public String toJson(UnitTree tree, ExtractionResult extraction) {
    Map<String, List<Reference>> refs = extraction == null ? Map.of() : extraction.bySource();
    List<ExportedUnit> roots = new ArrayList<>();
    for (StructuralUnit root : tree.roots()) {
      roots.add(convert(tree, root, refs, extraction != null));
    }
    ExportedDocument doc =
        new ExportedDocument(
            tree.getDocumentTitle(),
            tree.totalSections(),
            tree.totalUnits(),
            tree.repealedSections(),
            roots);
    return JacksonUtility.writeJson(doc, "unit tree of title " + tree.getDocumentTitle());
  }

  private ExportedUnit convert(
      UnitTree tree,
      StructuralUnit unit,
      Map<String, List<Reference>> refs,
      boolean withReferences) {
    List<ExportedUnit> children = new ArrayList<>();
    for (StructuralUnit child : tree.children(unit)) {
      children.add(convert(tree, child, refs, withReferences));
    }
    List<ExportedReference> outgoing = null;
    if (withReferences) {
      outgoing = new ArrayList<>();
      if (unit.getCitation() != null) {
        for (Reference ref : refs.getOrDefault(unit.getCitation(), List.of())) {
          outgoing.add(
              new ExportedReference(ref.targetCitation(), ref.type().key(), ref.context()));
        }
      }
    }
    return new ExportedUnit(
        unit.getIdentifier(),
        unit.getCitation(),
        unit.getKind().key(),
        unit.getDesignator(),
        unit.getHeading(),
        unit.getText(),
        unit.getStatus().key(),
        unit.getParentIdentifier(),
        unit.getHierarchicalPath(),
        unit.getSourceIdentifier(),
        outgoing,
        children);
  }
}
