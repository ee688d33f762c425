package com.gentoro.lexgraph.report;

import com.gentoro.lexgraph.ingest.IngestionStats;
import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitKind;
import com.gentoro.lexgraph.model.UnitStatus;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.projection.GraphProjection;
import com.gentoro.lexgraph.projection.ProjectionWarning;
import com.gentoro.lexgraph.reference.ExtractionResult;
import com.gentoro.lexgraph.reference.Reference;
import com.gentoro.lexgraph.reference.ReferenceResolutionWarning;
import com.gentoro.lexgraph.reference.ReferenceType;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Human-readable run report written to a console stream. */
public class ConsoleReport {
  private static final String RULE = "=".repeat(60);
  private static final int TEXT_PREVIEW = 500;
  private static final int WARNING_SAMPLES = 5;

  private final PrintStream out;

  public ConsoleReport(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  private void banner(String title) {
    out.println();
    out.println(RULE);
    out.println(title);
    out.println(RULE);
  }

  public void statistics(UnitTree tree, ExtractionResult extraction) {
    banner("PARSING STATISTICS");
    out.println("Total units parsed: " + tree.totalUnits());
    out.println("Total sections parsed: " + tree.totalSections());
    out.println("Repealed sections: " + tree.repealedSections());
    List<String> repealed =
        tree.sections().stream()
            .filter(s -> s.getStatus() == UnitStatus.REPEALED)
            .limit(5)
            .map(StructuralUnit::getCitation)
            .toList();
    if (!repealed.isEmpty()) {
      out.println("  Examples: " + String.join(", ", repealed));
    }
    out.println("Total cross-references found: " + extraction.size());
    Map<ReferenceType, Integer> byType = extraction.countsByType();
    if (!byType.isEmpty()) {
      out.println("Reference types:");
      byType.forEach((type, count) -> out.println("  - " + type.key() + ": " + count));
    }
    out.println();
    out.println("Units by kind:");
    for (Map.Entry<UnitKind, Integer> entry : tree.countsByKind().entrySet()) {
      out.println("  - " + entry.getKey().key() + ": " + entry.getValue());
    }
  }

  /** Indented outline, {@code maxDepth} levels below each title, with up to three references. */
  public void hierarchy(UnitTree tree, ExtractionResult extraction, int maxDepth) {
    banner("HIERARCHY");
    Map<String, List<Reference>> refs = extraction.bySource();
    for (StructuralUnit root : tree.roots()) {
      printUnit(tree, root, refs, 0, maxDepth);
    }
  }

  private void printUnit(
      UnitTree tree,
      StructuralUnit unit,
      Map<String, List<Reference>> refs,
      int depth,
      int maxDepth) {
    if (depth > maxDepth) return;
    String prefix = "  ".repeat(depth);
    String marker = unit.getStatus() == UnitStatus.ACTIVE ? "" : " [" + statusLabel(unit) + "]";
    out.println(prefix + unit.getKind().key() + ": " + unit.label() + marker);
    if (unit.getCitation() != null) {
      List<Reference> outgoing = refs.getOrDefault(unit.getCitation(), List.of());
      for (Reference ref : outgoing.subList(0, Math.min(3, outgoing.size()))) {
        out.println(
            prefix + "  -> References: " + ref.targetCitation() + " (" + ref.type().key() + ")");
      }
    }
    for (StructuralUnit child : tree.children(unit)) {
      printUnit(tree, child, refs, depth + 1, maxDepth);
    }
  }

  public void sectionDetails(UnitTree tree, StructuralUnit section, ExtractionResult extraction) {
    banner("SECTION: " + section.getCitation());
    out.println("Heading: " + Objects.toString(section.getHeading(), "(no heading)"));
    out.println("Identifier: " + section.getIdentifier());
    out.println("Path: " + section.getHierarchicalPath());
    out.println("Status: " + section.getStatus().key());

    String text = section.getText();
    if (!text.isEmpty()) {
      out.println();
      out.println("Text:");
      out.println(text.length() > TEXT_PREVIEW ? text.substring(0, TEXT_PREVIEW) + "..." : text);
    }

    List<Reference> refs = extraction.from(section.getCitation());
    if (!refs.isEmpty()) {
      out.println();
      out.println("Cross-references (" + refs.size() + "):");
      for (Reference ref : refs) {
        out.println("  - " + ref.targetCitation() + " (" + ref.type().key() + ")");
        out.println("    Context: " + ref.context());
      }
    }

    List<StructuralUnit> children = tree.children(section);
    if (!children.isEmpty()) {
      out.println();
      out.println("Subsections (" + children.size() + "):");
      for (StructuralUnit child : children) {
        out.println(
            "  - "
                + Objects.toString(child.getDesignator(), "?")
                + ": "
                + Objects.toString(child.getHeading(), "(no heading)"));
      }
    }
  }

  public void sectionNotFound(String number) {
    out.println();
    out.println("Section " + number + " not found");
  }

  public void sampleSections(UnitTree tree, ExtractionResult extraction, int limit) {
    banner("SAMPLE SECTIONS (first " + limit + ")");
    for (StructuralUnit section : tree.sections().stream().limit(limit).toList()) {
      String status =
          section.getStatus() == UnitStatus.ACTIVE ? "" : " [" + statusLabel(section) + "]";
      int count = extraction.from(section.getCitation()).size();
      String refs = count > 0 ? " (" + count + " refs)" : "";
      out.println(
          "  "
              + section.getCitation()
              + ": "
              + Objects.toString(section.getHeading(), "")
              + status
              + refs);
    }
  }

  public void projection(GraphProjection projection) {
    banner("GRAPH PROJECTION");
    out.println("Nodes:                      " + projection.nodes().size());
    out.println("Edges:                      " + projection.edges().size());
    out.println("Skipped (no citation):      " + projection.warnings().size());
  }

  public void ingestion(IngestionStats stats, ExtractionResult extraction) {
    banner("INGESTION STATISTICS");
    out.println("Nodes submitted:            " + stats.nodesSubmitted());
    out.println("PARENT_OF relationships:    " + stats.parentEdgesSubmitted());
    out.println("REFERENCES relationships:   " + stats.referenceEdgesSubmitted());
    out.println("References not resolved:    " + extraction.warnings().size());
    out.println("Batches:                    " + stats.batches());
    out.println();
    out.println("Total nodes in graph:       " + stats.storedNodes());
    out.println("Relationship counts by type:");
    stats.storedEdges().forEach((kind, count) -> out.println("  - " + kind + ": " + count));
  }

  /** Counts of collected warnings with a few examples of each. */
  public void warnings(ExtractionResult extraction, GraphProjection projection) {
    List<ReferenceResolutionWarning> refWarnings = extraction.warnings();
    List<ProjectionWarning> projWarnings =
        projection == null ? List.of() : projection.warnings();
    if (refWarnings.isEmpty() && projWarnings.isEmpty()) return;
    banner("WARNINGS");
    if (!refWarnings.isEmpty()) {
      out.println("Unresolved or external references: " + refWarnings.size());
      refWarnings.stream()
          .limit(WARNING_SAMPLES)
          .forEach(w -> out.println("  - " + w.describe()));
    }
    if (!projWarnings.isEmpty()) {
      out.println("Units left out of the graph: " + projWarnings.size());
      projWarnings.stream()
          .limit(WARNING_SAMPLES)
          .forEach(w -> out.println("  - " + w.describe()));
    }
  }

  public void demoHeader() {
    banner("DEMO QUERIES");
  }

  @SuppressWarnings("unchecked")
  public void demoSection(int number, String title, Map<String, Object> result) {
    out.println();
    out.println(number + ". " + title + ":");
    out.println("-".repeat(40));
    if (result == null) {
      out.println("   Unit not found");
      return;
    }
    Map<String, Object> unit = (Map<String, Object>) result.get("unit");
    out.println("   ID: " + unit.get("id"));
    out.println("   Heading: " + unit.get("heading"));
    out.println("   Kind: " + unit.get("kind"));
    out.println("   Path: " + unit.get("hierarchical_path"));
    List<Map<String, Object>> ancestors = (List<Map<String, Object>>) result.get("ancestors");
    if (ancestors != null && !ancestors.isEmpty()) {
      out.println();
      out.println("   Parent hierarchy (" + ancestors.size() + " levels):");
      for (Map<String, Object> a : ancestors) {
        out.println("     - " + a.get("kind") + ": " + a.get("heading"));
      }
    }
    List<Map<String, Object>> children = (List<Map<String, Object>>) result.get("children");
    if (children != null && !children.isEmpty()) {
      out.println();
      out.println("   Children (" + children.size() + "):");
      for (Map<String, Object> c : children) {
        out.println("     - " + c.get("citation") + ": " + c.get("heading"));
      }
    }
    List<Map<String, Object>> refs = (List<Map<String, Object>>) result.get("references");
    if (refs != null && !refs.isEmpty()) {
      out.println();
      out.println("   References (" + refs.size() + "):");
      for (Map<String, Object> r : refs) {
        out.println("     -> " + r.get("target") + " (" + r.get("type") + ")");
      }
    }
  }

  public void demoReferencing(int number, String citation, List<Map<String, Object>> rows) {
    out.println();
    out.println(number + ". Units that reference " + citation + ":");
    out.println("-".repeat(40));
    if (rows.isEmpty()) {
      out.println("   No references found");
      return;
    }
    for (Map<String, Object> row : rows) {
      String heading = Objects.toString(row.get("heading"), "N/A");
      if (heading.length() > 50) heading = heading.substring(0, 50);
      out.println("   - " + row.get("source") + ": " + heading + " (" + row.get("type") + ")");
    }
  }

  public void exported(String path) {
    out.println();
    out.println("Exported to: " + path);
  }

  private static String statusLabel(StructuralUnit unit) {
    return unit.getStatus().key().toUpperCase(Locale.ROOT);
  }
}
