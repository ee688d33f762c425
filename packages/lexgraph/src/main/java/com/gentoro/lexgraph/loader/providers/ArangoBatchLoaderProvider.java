package com.gentoro.lexgraph.loader.providers;

import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.GraphQueryDriver;
import com.gentoro.lexgraph.loader.arangodb.ArangoBatchLoader;
import com.gentoro.lexgraph.loader.arangodb.ArangoQueryDriver;
import com.gentoro.lexgraph.loader.arangodb.ArangoSettings;
import com.gentoro.lexgraph.loader.spi.BatchLoaderProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the ArangoDB-based BatchLoader. */
public class ArangoBatchLoaderProvider implements BatchLoaderProvider {
  @Override
  public String id() {
    return "arangodb";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    try {
      Class.forName("com.arangodb.ArangoDB", false, getClass().getClassLoader());
      return true;
    } catch (ClassNotFoundException e) {
      return false;
    }
  }

  @Override
  public BatchLoader create(Configuration configuration) {
    return new ArangoBatchLoader(ArangoSettings.from(configuration));
  }

  @Override
  public GraphQueryDriver createQueryDriver(Configuration configuration, BatchLoader loader) {
    return new ArangoQueryDriver(configuration, (ArangoBatchLoader) loader);
  }
}
