package com.gentoro.lexgraph.loader.arangodb;

import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.model.AqlQueryOptions;
import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.exception.LoaderException;
import com.gentoro.lexgraph.exception.StateException;
import com.gentoro.lexgraph.loader.GraphQueryDriver;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * ArangoDB implementation of {@link GraphQueryDriver}. The AQL for each query is a classpath
 * template whose location can be overridden under {@code loader.arangodb.queries.*}.
 */
public class ArangoQueryDriver implements GraphQueryDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(ArangoQueryDriver.class);

  private static final String CONFIG_PREFIX = ArangoSettings.PREFIX + "queries.";

  private final ArangoBatchLoader loader;
  private final String sectionContextQueryPath;
  private final String referencingUnitsQueryPath;
  private volatile String sectionContextQuery;
  private volatile String referencingUnitsQuery;

  public ArangoQueryDriver(Configuration configuration, ArangoBatchLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.sectionContextQueryPath =
        configuration.getString(
            CONFIG_PREFIX + "sectionWithContext", "/aql/section-with-context.aql");
    this.referencingUnitsQueryPath =
        configuration.getString(
            CONFIG_PREFIX + "referencingUnits", "/aql/referencing-units.aql");
  }

  @Override
  public void initialize() {
    loader.initialize();
    if (sectionContextQuery == null) {
      sectionContextQuery = loadTemplate(sectionContextQueryPath);
    }
    if (referencingUnitsQuery == null) {
      referencingUnitsQuery = loadTemplate(referencingUnitsQueryPath);
    }
  }

  @Override
  public boolean isInitialized() {
    return loader.isInitialized() && sectionContextQuery != null && referencingUnitsQuery != null;
  }

  @Override
  public Map<String, Object> sectionWithContext(String citation) {
    List<Map<String, Object>> rows = run(sectionContextQuery, citation);
    return rows.isEmpty() ? null : rows.get(0);
  }

  @Override
  public List<Map<String, Object>> referencingUnits(String citation) {
    return run(referencingUnitsQuery, citation);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<Map<String, Object>> run(String aql, String citation) {
    if (!isInitialized()) {
      throw new StateException("ArangoQueryDriver is not initialized");
    }
    ArangoDatabase db = loader.getDatabase();
    Map<String, Object> bindVars = Map.of("key", ArangoBatchLoader.documentKey(citation));
    log.debug("Executing AQL for {} with {}", citation, bindVars);
    log.trace("AQL query:\n{}", aql);
    try {
      List<Map> raw = db.query(aql, Map.class, bindVars, new AqlQueryOptions()).asListRemaining();
      List<Map<String, Object>> out = new ArrayList<>(raw.size());
      for (Map row : raw) out.add((Map<String, Object>) row);
      return out;
    } catch (ArangoDBException e) {
      throw new LoaderException("Graph query failed for " + citation, e);
    }
  }

  private String loadTemplate(String path) {
    try (InputStream is = getClass().getResourceAsStream(path)) {
      if (is == null) {
        throw new IoException("AQL query template not found: " + path);
      }
      String template = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      log.debug("Loaded AQL query template from: {}", path);
      return template;
    } catch (IOException e) {
      throw new IoException("Failed to load AQL query template: " + path, e);
    }
  }

  @Override
  public String getDriverName() {
    return "arangodb";
  }

  @Override
  public void shutdown() {
    loader.shutdown();
  }
}
