package com.gentoro.lexgraph.loader.spi;

import com.gentoro.lexgraph.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the configured {@link BatchLoaderProvider}. */
public final class BatchLoaderFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(BatchLoaderFactory.class);

  public static final String DRIVER_KEY = "loader.driver";
  public static final String DEFAULT_DRIVER = "in-memory";

  private BatchLoaderFactory() {}

  public static BatchLoaderProvider resolve(Configuration configuration) {
    String desired = configuration.getString(DRIVER_KEY, DEFAULT_DRIVER).trim();
    log.trace("Resolving batch loader (desired '{}')", desired);
    List<String> known = new ArrayList<>();
    for (BatchLoaderProvider p : ServiceLoader.load(BatchLoaderProvider.class)) {
      known.add(p.id());
      if (p.id().equalsIgnoreCase(desired)) {
        if (!p.isAvailable(configuration)) {
          throw new ConfigException(
              "Loader '%s' is not available with the current configuration".formatted(desired));
        }
        log.debug("Using batch loader '{}'", p.id());
        return p;
      }
    }
    throw new ConfigException("Unknown %s: %s (known: %s)".formatted(DRIVER_KEY, desired, known));
  }
}
