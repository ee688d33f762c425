package com.gentoro.lexgraph.loader.arangodb;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDatabase;
import com.arangodb.model.AqlQueryOptions;
import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.exception.StateException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArangoQueryDriverTest {

  @Mock private ArangoBatchLoader loader;
  @Mock private ArangoDatabase db;
  @Mock private ArangoCursor<Map> cursor;

  private BaseConfiguration configuration;

  @BeforeEach
  void setUp() {
    configuration = new BaseConfiguration();
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private void returns(Map<String, Object> row) {
    List<Map> rows = new ArrayList<>();
    if (row != null) rows.add(row);
    when(loader.isInitialized()).thenReturn(true);
    when(loader.getDatabase()).thenReturn(db);
    when(cursor.asListRemaining()).thenReturn(rows);
    when(db.query(anyString(), eq(Map.class), anyMap(), any(AqlQueryOptions.class)))
        .thenReturn(cursor);
  }

  @Test
  @DisplayName("queries bind the document key of the citation")
  void bindsDocumentKey() {
    returns(Map.of("unit", Map.of("id", "26 USC 162")));
    ArangoQueryDriver driver = new ArangoQueryDriver(configuration, loader);
    driver.initialize();

    Map<String, Object> result = driver.sectionWithContext("26 USC 162");

    assertEquals(Map.of("id", "26 USC 162"), result.get("unit"));
    verify(loader).initialize();
    verify(db)
        .query(
            contains("parentOf"),
            eq(Map.class),
            eq(Map.of("key", "26_USC_162")),
            any(AqlQueryOptions.class));
  }

  @Test
  @DisplayName("an unknown unit yields null context and no referencing rows")
  void emptyResults() {
    returns(null);
    ArangoQueryDriver driver = new ArangoQueryDriver(configuration, loader);
    driver.initialize();

    assertNull(driver.sectionWithContext("26 USC 9999"));
    assertTrue(driver.referencingUnits("26 USC 9999").isEmpty());
  }

  @Test
  @DisplayName("queries before initialize are rejected")
  void requiresInitialize() {
    ArangoQueryDriver driver = new ArangoQueryDriver(configuration, loader);
    assertThrows(StateException.class, () -> driver.referencingUnits("26 USC 1"));
  }

  @Test
  @DisplayName("a missing query template fails initialization")
  void missingTemplate() {
    configuration.addProperty("loader.arangodb.queries.sectionWithContext", "/aql/absent.aql");
    ArangoQueryDriver driver = new ArangoQueryDriver(configuration, loader);
    assertThrows(IoException.class, driver::initialize);
  }
}
