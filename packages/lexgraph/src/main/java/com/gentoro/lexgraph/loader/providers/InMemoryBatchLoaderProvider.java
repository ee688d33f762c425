package com.gentoro.lexgraph.loader.providers;

import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.GraphQueryDriver;
import com.gentoro.lexgraph.loader.memory.InMemoryGraphStore;
import com.gentoro.lexgraph.loader.spi.BatchLoaderProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the in-process graph store. */
public class InMemoryBatchLoaderProvider implements BatchLoaderProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    return true;
  }

  @Override
  public BatchLoader create(Configuration configuration) {
    return new InMemoryGraphStore();
  }

  @Override
  public GraphQueryDriver createQueryDriver(Configuration configuration, BatchLoader loader) {
    return (InMemoryGraphStore) loader;
  }
}
