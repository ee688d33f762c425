package com.gentoro.lexgraph.loader.spi;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lexgraph.exception.ConfigException;
import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.arangodb.ArangoBatchLoader;
import com.gentoro.lexgraph.loader.memory.InMemoryGraphStore;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatchLoaderFactoryTest {

  @Test
  @DisplayName("in-memory is the default driver and doubles as its query driver")
  void defaultDriver() {
    BaseConfiguration cfg = new BaseConfiguration();
    BatchLoaderProvider provider = BatchLoaderFactory.resolve(cfg);
    assertEquals("in-memory", provider.id());

    BatchLoader loader = provider.create(cfg);
    assertInstanceOf(InMemoryGraphStore.class, loader);
    assertSame(loader, provider.createQueryDriver(cfg, loader));
  }

  @Test
  @DisplayName("the arangodb driver is discovered through the service registry")
  void arangoDriver() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty(BatchLoaderFactory.DRIVER_KEY, "ArangoDB");
    BatchLoaderProvider provider = BatchLoaderFactory.resolve(cfg);
    assertEquals("arangodb", provider.id());
    assertTrue(provider.isAvailable(cfg));
    assertInstanceOf(ArangoBatchLoader.class, provider.create(cfg));
  }

  @Test
  @DisplayName("an unknown driver is a configuration error")
  void unknownDriver() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty(BatchLoaderFactory.DRIVER_KEY, "neo4j");
    ConfigException ex = assertThrows(ConfigException.class, () -> BatchLoaderFactory.resolve(cfg));
    assertTrue(ex.getMessage().contains("in-memory"));
  }
}
