package com.gentoro.lexgraph.projection;

import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.reference.ExtractionResult;
import com.gentoro.lexgraph.reference.Reference;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps a unit tree and its references onto graph nodes and edges.
 *
 * <p>One node per unit keyed by citation, one PARENT_OF edge per parent/child pair and one
 * REFERENCES edge per reference. Units without a citation cannot be keyed; they and every edge
 * touching them are skipped and reported as {@link ProjectionWarning}s. The projector keeps no
 * state between calls.
 */
public class GraphProjector {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(GraphProjector.class);

  public GraphProjection project(UnitTree tree, ExtractionResult extraction) {
    List<GraphNode> nodes = new ArrayList<>();
    List<GraphEdge> edges = new ArrayList<>();
    List<ProjectionWarning> warnings = new ArrayList<>();
    Set<String> ids = new HashSet<>();

    for (StructuralUnit unit : tree.units()) {
      if (unit.getCitation() == null) {
        warnings.add(new ProjectionWarning(unit.getIdentifier(), "no citation; node skipped"));
        continue;
      }
      nodes.add(LegalUnitNode.of(unit));
      ids.add(unit.getCitation());
    }

    for (StructuralUnit unit : tree.units()) {
      for (StructuralUnit child : tree.children(unit)) {
        if (unit.getCitation() == null) {
          if (child.getCitation() != null) {
            String reason = "PARENT_OF edge from " + unit.getIdentifier() + " skipped";
            warnings.add(new ProjectionWarning(child.getIdentifier(), reason));
          }
          continue;
        }
        if (child.getCitation() == null) {
          String reason = "no citation; PARENT_OF edge from " + unit.getCitation() + " skipped";
          warnings.add(new ProjectionWarning(child.getIdentifier(), reason));
          continue;
        }
        edges.add(GraphEdge.parentOf(unit.getCitation(), child.getCitation()));
      }
    }

    for (Reference ref : extraction.references()) {
      if (!ids.contains(ref.sourceCitation()) || !ids.contains(ref.targetCitation())) {
        warnings.add(
            new ProjectionWarning(
                ref.sourceCitation(),
                "reference to " + ref.targetCitation() + " has an unknown endpoint; skipped"));
        continue;
      }
      edges.add(
          GraphEdge.references(
              ref.sourceCitation(), ref.targetCitation(), ref.type().key(), ref.context()));
    }

    GraphProjection projection = new GraphProjection(nodes, edges, warnings);
    log.info(
        "Projected {} nodes, {} PARENT_OF edges, {} REFERENCES edges ({} warnings)",
        nodes.size(),
        projection.edges(EdgeKind.PARENT_OF).size(),
        projection.edges(EdgeKind.REFERENCES).size(),
        warnings.size());
    return projection;
  }
}
