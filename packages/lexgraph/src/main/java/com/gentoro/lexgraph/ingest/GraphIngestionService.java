package com.gentoro.lexgraph.ingest;

import com.gentoro.lexgraph.exception.LoaderException;
import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.projection.EdgeKind;
import com.gentoro.lexgraph.projection.GraphEdge;
import com.gentoro.lexgraph.projection.GraphNode;
import com.gentoro.lexgraph.projection.GraphProjection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sends a {@link GraphProjection} to a {@link BatchLoader}.
 *
 * <p>Every node batch is submitted before the first edge batch, and PARENT_OF edges before
 * REFERENCES edges. A failing batch aborts the run with a {@link LoaderException}; batches already
 * applied stay in the store, and since all writes are upserts the whole run can simply be repeated.
 */
public class GraphIngestionService {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(GraphIngestionService.class);

  public static final int DEFAULT_BATCH_SIZE = 100;

  private final BatchLoader loader;
  private final int batchSize;

  public GraphIngestionService(BatchLoader loader) {
    this(loader, DEFAULT_BATCH_SIZE);
  }

  public GraphIngestionService(BatchLoader loader, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }
    this.loader = Objects.requireNonNull(loader, "loader");
    this.batchSize = batchSize;
  }

  public IngestionStats ingest(GraphProjection projection, boolean clearFirst) {
    long started = System.currentTimeMillis();
    if (!loader.isInitialized()) {
      loader.initialize();
    }
    if (clearFirst) {
      log.info("Clearing graph store '{}'", loader.getDriverName());
      loader.clear();
    }

    List<GraphNode> nodes = projection.nodes();
    List<GraphEdge> parentEdges = projection.edges(EdgeKind.PARENT_OF);
    List<GraphEdge> referenceEdges = projection.edges(EdgeKind.REFERENCES);

    int batches = 0;
    for (List<GraphNode> batch : GraphProjection.batches(nodes, batchSize)) {
      batches++;
      submit("node", batches, batch.size(), () -> loader.upsertNodes(batch));
    }
    log.info("Loaded {} nodes", nodes.size());
    for (List<GraphEdge> batch : GraphProjection.batches(parentEdges, batchSize)) {
      batches++;
      submit("PARENT_OF", batches, batch.size(), () -> loader.upsertEdges(batch));
    }
    log.info("Loaded {} PARENT_OF edges", parentEdges.size());
    for (List<GraphEdge> batch : GraphProjection.batches(referenceEdges, batchSize)) {
      batches++;
      submit("REFERENCES", batches, batch.size(), () -> loader.upsertEdges(batch));
    }
    log.info("Loaded {} REFERENCES edges", referenceEdges.size());

    IngestionStats stats =
        new IngestionStats(
            nodes.size(),
            parentEdges.size(),
            referenceEdges.size(),
            batches,
            clearFirst,
            loader.nodeCount(),
            loader.edgeCounts(),
            System.currentTimeMillis() - started);
    log.info(
        "Ingestion finished in {} ms: store holds {} nodes, {} PARENT_OF, {} REFERENCES",
        stats.elapsedMillis(),
        stats.storedNodes(),
        stats.storedParentEdges(),
        stats.storedReferenceEdges());
    return stats;
  }

  private void submit(String what, int batchNumber, int size, Runnable write) {
    log.debug("Submitting {} batch #{} ({} items)", what, batchNumber, size);
    try {
      write.run();
    } catch (LoaderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LoaderException(
          "Failed to load " + what + " batch #" + batchNumber,
          Map.of("batch", batchNumber, "size", size),
          e);
    }
  }
}
