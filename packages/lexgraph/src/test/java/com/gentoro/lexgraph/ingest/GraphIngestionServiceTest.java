package com.gentoro.lexgraph.ingest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.lexgraph.SampleDocument;
import com.gentoro.lexgraph.exception.LoaderException;
import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.memory.InMemoryGraphStore;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.projection.EdgeKind;
import com.gentoro.lexgraph.projection.GraphEdge;
import com.gentoro.lexgraph.projection.GraphNode;
import com.gentoro.lexgraph.projection.GraphProjection;
import com.gentoro.lexgraph.projection.GraphProjector;
import com.gentoro.lexgraph.projection.LegalUnitNode;
import com.gentoro.lexgraph.reference.ReferenceExtractor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GraphIngestionServiceTest {

  @Mock private BatchLoader loader;

  private static LegalUnitNode node(String citation) {
    return new LegalUnitNode(
        citation, "/" + citation, "section", null, null, "", "active", null, false, true);
  }

  private static GraphProjection smallProjection() {
    List<GraphNode> nodes = List.of(node("26 USC 1"), node("26 USC 2"), node("26 USC 3"));
    List<GraphEdge> edges =
        List.of(
            GraphEdge.references("26 USC 1", "26 USC 3", "general", "section 3"),
            GraphEdge.parentOf("26 USC 1", "26 USC 2"),
            GraphEdge.parentOf("26 USC 1", "26 USC 3"));
    return new GraphProjection(nodes, edges, List.of());
  }

  private static GraphProjection sampleProjection() {
    UnitTree tree = SampleDocument.parse();
    return new GraphProjector().project(tree, new ReferenceExtractor().extractAll(tree));
  }

  @Test
  @DisplayName("clears first, then loads nodes, PARENT_OF and REFERENCES batches in that order")
  void batchOrder() {
    GraphProjection projection = smallProjection();
    when(loader.isInitialized()).thenReturn(false);

    IngestionStats stats = new GraphIngestionService(loader, 2).ingest(projection, true);

    InOrder order = inOrder(loader);
    order.verify(loader).initialize();
    order.verify(loader).clear();
    order.verify(loader).upsertNodes(projection.nodes().subList(0, 2));
    order.verify(loader).upsertNodes(projection.nodes().subList(2, 3));
    order.verify(loader).upsertEdges(projection.edges(EdgeKind.PARENT_OF));
    order.verify(loader).upsertEdges(projection.edges(EdgeKind.REFERENCES));

    assertEquals(3, stats.nodesSubmitted());
    assertEquals(2, stats.parentEdgesSubmitted());
    assertEquals(1, stats.referenceEdgesSubmitted());
    assertEquals(4, stats.batches());
    assertTrue(stats.cleared());
  }

  @Test
  @DisplayName("an initialized loader is used as is and not cleared unless asked")
  void noClear() {
    when(loader.isInitialized()).thenReturn(true);

    new GraphIngestionService(loader).ingest(smallProjection(), false);

    verify(loader, never()).initialize();
    verify(loader, never()).clear();
    verify(loader, times(1)).upsertNodes(anyList());
    verify(loader, times(2)).upsertEdges(anyList());
  }

  @Test
  @DisplayName("driver failures are wrapped with the failing batch")
  void wrapsDriverFailures() {
    when(loader.isInitialized()).thenReturn(true);
    IllegalStateException boom = new IllegalStateException("connection reset");
    doThrow(boom).when(loader).upsertEdges(anyList());

    LoaderException ex =
        assertThrows(
            LoaderException.class,
            () -> new GraphIngestionService(loader, 2).ingest(smallProjection(), false));
    assertSame(boom, ex.getCause());
    assertEquals(3, ex.getContext().get("batch"));
    assertTrue(ex.getMessage().contains("PARENT_OF"));
  }

  @Test
  @DisplayName("loader exceptions propagate unchanged")
  void loaderExceptionsPropagate() {
    when(loader.isInitialized()).thenReturn(true);
    LoaderException rejected = new LoaderException("rejected");
    doThrow(rejected).when(loader).upsertNodes(anyList());

    LoaderException ex =
        assertThrows(
            LoaderException.class,
            () -> new GraphIngestionService(loader).ingest(smallProjection(), false));
    assertSame(rejected, ex);
    verify(loader, never()).upsertEdges(anyList());
  }

  @Test
  @DisplayName("loading the same projection twice leaves the store unchanged")
  void idempotent() {
    GraphProjection projection = sampleProjection();
    InMemoryGraphStore store = new InMemoryGraphStore();
    GraphIngestionService service = new GraphIngestionService(store, 5);

    IngestionStats first = service.ingest(projection, false);
    IngestionStats second = service.ingest(projection, false);

    for (IngestionStats stats : List.of(first, second)) {
      assertEquals(18, stats.storedNodes());
      assertEquals(17, stats.storedParentEdges());
      assertEquals(11, stats.storedReferenceEdges());
    }
  }

  @Test
  @DisplayName("clearing first drops what an earlier run stored")
  void clearFirst() {
    InMemoryGraphStore store = new InMemoryGraphStore();
    GraphIngestionService service = new GraphIngestionService(store);
    service.ingest(sampleProjection(), false);

    IngestionStats stats = service.ingest(smallProjection(), true);

    assertEquals(3, stats.storedNodes());
    assertEquals(Map.of(EdgeKind.PARENT_OF, 2L, EdgeKind.REFERENCES, 1L), stats.storedEdges());
  }

  @Test
  @DisplayName("batch size must be positive")
  void invalidBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> new GraphIngestionService(loader, 0));
  }
}
