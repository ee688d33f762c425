package com.gentoro.lexgraph.loader.arangodb;

import com.arangodb.ArangoDB;
import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.entity.CollectionType;
import com.arangodb.model.AqlQueryOptions;
import com.arangodb.model.CollectionCreateOptions;
import com.gentoro.lexgraph.exception.LoaderException;
import com.gentoro.lexgraph.exception.StateException;
import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.projection.EdgeKind;
import com.gentoro.lexgraph.projection.GraphEdge;
import com.gentoro.lexgraph.projection.GraphNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ArangoDB implementation of {@link BatchLoader}.
 *
 * <p>Units are stored in the document collection {@code units}; PARENT_OF and REFERENCES edges in
 * the edge collections {@code parentOf} and {@code references}. Writes are AQL {@code UPSERT}s on
 * {@code _key}: node keys are derived from the citation, edge keys from a digest of the edge
 * identity.
 */
public class ArangoBatchLoader implements BatchLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(ArangoBatchLoader.class);

  public static final String COLLECTION_UNITS = "units";
  public static final String COLLECTION_PARENT_OF = "parentOf";
  public static final String COLLECTION_REFERENCES = "references";

  private static final String UPSERT =
      "FOR doc IN @docs UPSERT { _key: doc._key } INSERT doc REPLACE doc IN ";

  private final ArangoSettings settings;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  private ArangoDB arango;
  private ArangoDatabase db;

  public ArangoBatchLoader(ArangoSettings settings) {
    this(settings, null);
  }

  /** Uses a pre-built client instead of connecting with {@code settings}. */
  ArangoBatchLoader(ArangoSettings settings, ArangoDB arango) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.arango = arango;
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;
    try {
      if (arango == null) {
        arango =
            new ArangoDB.Builder()
                .host(settings.host(), settings.port())
                .user(settings.user())
                .password(settings.password())
                .build();
      }
      if (!arango.getDatabases().contains(settings.database())) {
        arango.createDatabase(settings.database());
      }
      db = arango.db(settings.database());
      createCollectionIfNeeded(COLLECTION_UNITS, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_PARENT_OF, CollectionType.EDGES);
      createCollectionIfNeeded(COLLECTION_REFERENCES, CollectionType.EDGES);
    } catch (ArangoDBException e) {
      throw new LoaderException(
          "Failed to connect to ArangoDB at " + settings.host() + ":" + settings.port(),
          Map.of("database", settings.database()),
          e);
    }
    initialized.set(true);
    log.info("ArangoBatchLoader initialized database '{}' ({})", settings.database(), settings);
  }

  private void createCollectionIfNeeded(String name, CollectionType type) {
    if (!db.collection(name).exists()) {
      db.createCollection(name, new CollectionCreateOptions().type(type));
      log.debug("Created {} collection '{}'", type, name);
    }
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public void upsertNodes(List<GraphNode> nodes) {
    ensureInitialized();
    if (nodes == null || nodes.isEmpty()) return;
    List<Map<String, Object>> docs = new ArrayList<>(nodes.size());
    for (GraphNode n : nodes) {
      Map<String, Object> doc = new LinkedHashMap<>(n.toMap());
      doc.put("_key", documentKey(n.getId()));
      docs.add(doc);
    }
    runUpsert(COLLECTION_UNITS, docs);
  }

  @Override
  public void upsertEdges(List<GraphEdge> edges) {
    ensureInitialized();
    if (edges == null || edges.isEmpty()) return;
    Map<EdgeKind, List<Map<String, Object>>> byCollection = new EnumMap<>(EdgeKind.class);
    for (GraphEdge e : edges) {
      Map<String, Object> doc = new LinkedHashMap<>(e.toMap());
      doc.put("_key", edgeKey(e.identityKey()));
      doc.put("_from", COLLECTION_UNITS + "/" + documentKey(e.getSourceId()));
      doc.put("_to", COLLECTION_UNITS + "/" + documentKey(e.getTargetId()));
      byCollection.computeIfAbsent(e.getKind(), k -> new ArrayList<>()).add(doc);
    }
    for (Map.Entry<EdgeKind, List<Map<String, Object>>> entry : byCollection.entrySet()) {
      runUpsert(collectionFor(entry.getKey()), entry.getValue());
    }
  }

  private void runUpsert(String collection, List<Map<String, Object>> docs) {
    // arangodb-java-driver v7 uses signature: query(String, Class<T>, Map<String,?>,
    // AqlQueryOptions)
    try {
      db.query(UPSERT + collection, Map.class, Map.of("docs", docs), new AqlQueryOptions());
      log.debug("Upserted {} documents into '{}'", docs.size(), collection);
    } catch (ArangoDBException e) {
      throw new LoaderException(
          "ArangoDB rejected a batch of " + docs.size() + " documents for '" + collection + "'",
          Map.of("collection", collection, "size", docs.size()),
          e);
    }
  }

  @Override
  public void clear() {
    ensureInitialized();
    try {
      db.collection(COLLECTION_UNITS).truncate();
      db.collection(COLLECTION_PARENT_OF).truncate();
      db.collection(COLLECTION_REFERENCES).truncate();
    } catch (ArangoDBException e) {
      throw new LoaderException("Failed to clear ArangoDB collections", e);
    }
    log.info("Cleared collections in database '{}'", settings.database());
  }

  @Override
  public long nodeCount() {
    return count(COLLECTION_UNITS);
  }

  @Override
  public Map<EdgeKind, Long> edgeCounts() {
    Map<EdgeKind, Long> counts = new EnumMap<>(EdgeKind.class);
    for (EdgeKind kind : EdgeKind.values()) {
      counts.put(kind, count(collectionFor(kind)));
    }
    return counts;
  }

  private long count(String collection) {
    ensureInitialized();
    try {
      Long count = db.collection(collection).count().getCount();
      return count == null ? 0L : count;
    } catch (ArangoDBException e) {
      throw new LoaderException("Failed to count documents in '" + collection + "'", e);
    }
  }

  /** Database handle for read queries; only valid after {@link #initialize()}. */
  ArangoDatabase getDatabase() {
    ensureInitialized();
    return db;
  }

  static String collectionFor(EdgeKind kind) {
    return kind == EdgeKind.PARENT_OF ? COLLECTION_PARENT_OF : COLLECTION_REFERENCES;
  }

  @Override
  public String getDriverName() {
    return "arangodb";
  }

  @Override
  public void shutdown() {
    initialized.set(false);
    if (arango == null) return;
    try {
      arango.shutdown();
    } catch (ArangoDBException e) {
      log.warn("Error while shutting down ArangoDB client: {}", e.getMessage());
    }
    arango = null;
  }

  private void ensureInitialized() {
    if (!initialized.get()) {
      throw new StateException("ArangoBatchLoader is not initialized");
    }
  }

  /**
   * Map a citation to a valid ArangoDB {@code _key}: spaces and other disallowed characters become
   * underscores, e.g. {@code 26 USC 162(a)} becomes {@code 26_USC_162(a)}.
   *
   * @param id node id
   * @return sanitized key valid for ArangoDB _key field
   */
  public static String documentKey(String id) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("Document key cannot be null or empty");
    }
    String sanitized = id.replaceAll("[^a-zA-Z0-9_\\-:.@()+,=;$!*'%]", "_");
    // Truncate to 254 characters (ArangoDB limit)
    if (sanitized.length() > 254) {
      sanitized = sanitized.substring(0, 254);
    }
    return sanitized;
  }

  static String edgeKey(GraphEdge.Key key) {
    try {
      MessageDigest sha = MessageDigest.getInstance("SHA-256");
      byte[] digest = sha.digest(key.asString().getBytes(StandardCharsets.UTF_8));
      return "e" + HexFormat.of().formatHex(digest, 0, 20);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
