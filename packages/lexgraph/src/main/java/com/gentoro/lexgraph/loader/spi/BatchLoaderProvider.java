package com.gentoro.lexgraph.loader.spi;

import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.GraphQueryDriver;
import org.apache.commons.configuration2.Configuration;

/**
 * Service provider interface for graph store backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and selected by the {@code
 * loader.driver} configuration key.
 */
public interface BatchLoaderProvider {
  /** Unique backend id, matched against {@code loader.driver}. */
  String id();

  /** Whether the backend can be created with the given configuration. */
  boolean isAvailable(Configuration configuration);

  BatchLoader create(Configuration configuration);

  /** A query driver reading from the store {@code loader} writes to. */
  GraphQueryDriver createQueryDriver(Configuration configuration, BatchLoader loader);
}
