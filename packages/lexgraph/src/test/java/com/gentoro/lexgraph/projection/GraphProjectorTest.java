package com.gentoro.lexgraph.projection;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lexgraph.SampleDocument;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.reference.ExtractionResult;
import com.gentoro.lexgraph.reference.Reference;
import com.gentoro.lexgraph.reference.ReferenceExtractor;
import com.gentoro.lexgraph.reference.ReferenceType;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphProjectorTest {

  private static UnitTree tree;
  private static GraphProjection projection;

  @BeforeAll
  static void projectSample() {
    tree = SampleDocument.parse();
    projection = new GraphProjector().project(tree, new ReferenceExtractor().extractAll(tree));
  }

  @Test
  @DisplayName("one node per unit, one PARENT_OF per child, one REFERENCES per reference")
  void counts() {
    assertEquals(18, projection.nodes().size());
    assertEquals(17, projection.edges(EdgeKind.PARENT_OF).size());
    assertEquals(11, projection.edges(EdgeKind.REFERENCES).size());
    assertTrue(projection.warnings().isEmpty());
  }

  @Test
  @DisplayName("projecting the same tree twice gives the same nodes and edges")
  void projectionIsIdempotent() {
    UnitTree reparsed = SampleDocument.parse();
    GraphProjection again =
        new GraphProjector().project(reparsed, new ReferenceExtractor().extractAll(reparsed));

    assertEquals(new HashSet<>(projection.nodes()), new HashSet<>(again.nodes()));
    assertEquals(new HashSet<>(projection.edges()), new HashSet<>(again.edges()));
    assertEquals(projection.nodes(), again.nodes());
    assertEquals(projection.edges(), again.edges());
  }

  @Test
  @DisplayName("edges connect citations")
  void edges() {
    assertTrue(
        projection
            .edges(EdgeKind.PARENT_OF)
            .contains(GraphEdge.parentOf("26 USC Subtitle A Chapter 1", "26 USC 162")));

    GraphEdge exception =
        projection.edges(EdgeKind.REFERENCES).stream()
            .filter(e -> e.getSourceId().equals("26 USC 162"))
            .findFirst()
            .orElseThrow();
    assertEquals("26 USC 274", exception.getTargetId());
    assertEquals("exception", exception.getType());
    assertNotNull(exception.getProperties().get(GraphEdge.CONTEXT));

    for (GraphEdge edge : projection.edges()) {
      assertTrue(projection.nodeIds().contains(edge.getSourceId()), edge.toString());
      assertTrue(projection.nodeIds().contains(edge.getTargetId()), edge.toString());
    }
  }

  @Test
  @DisplayName("node properties mirror the unit")
  void nodeProperties() {
    Map<String, Object> node =
        projection.nodes().stream()
            .filter(n -> n.getId().equals("26 USC 3"))
            .findFirst()
            .orElseThrow()
            .toMap();
    assertEquals(LegalUnitNode.NODE_TYPE, node.get("nodeType"));
    assertEquals("/title26/subtitleA/chapter1/section3", node.get("identifier"));
    assertEquals("section", node.get("kind"));
    assertEquals("repealed", node.get("status"));
    assertEquals(false, node.get("is_container"));
    assertEquals(true, node.get("is_content"));
    assertEquals("", node.get("text"));
  }

  @Test
  @DisplayName("units without a citation are skipped together with their edges")
  void unitsWithoutCitation() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/><subtitle><chapter><num value=\"1\"/>"
                + "<section><num value=\"1\"/></section></chapter></subtitle></title>");
    GraphProjection p = new GraphProjector().project(t, ExtractionResult.empty());

    assertEquals(List.of("26 USC", "26 USC 1"), p.nodes().stream().map(GraphNode::getId).toList());
    assertTrue(p.edges().isEmpty());
    // subtitle and chapter have no node; both edges touching a cited unit are reported
    assertEquals(4, p.warnings().size());
    assertTrue(p.warnings().get(0).describe().contains("/title26/subtitle@1"));
  }

  @Test
  @DisplayName("references to units missing from the tree are skipped")
  void unknownEndpoint() {
    Reference dangling =
        new Reference("26 USC 162", "26 USC 9999", ReferenceType.GENERAL, "section 9999", 0);
    GraphProjection p =
        new GraphProjector()
            .project(tree, new ExtractionResult(List.of(dangling), List.of()));
    assertTrue(p.edges(EdgeKind.REFERENCES).isEmpty());
    assertEquals(1, p.warnings().size());
    assertEquals("26 USC 162", p.warnings().get(0).unitIdentifier());
  }

  @Test
  @DisplayName("batches split a list into bounded chunks")
  void batches() {
    List<List<Integer>> chunks = GraphProjection.batches(List.of(1, 2, 3, 4, 5), 2);
    assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), chunks);
    assertTrue(GraphProjection.batches(List.of(), 3).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> GraphProjection.batches(List.of(1), 0));
  }
}
