package com.gentoro.lexgraph;

import com.gentoro.lexgraph.exception.ConfigException;
import com.gentoro.lexgraph.exception.SerializationException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the YAML application configuration into a Commons Configuration instance.
 *
 * <p>A location is either {@code classpath:<resource>}, a {@code file:} URI, or a filesystem
 * path. {@code ${env:NAME}} placeholders resolve against the process environment first and then
 * against {@code .env.local} in the working directory. A placeholder that resolves nowhere stays in
 * the value verbatim; read such keys through {@link #resolvedString} or {@link #resolvedInt}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH = "classpath:";
  private static final Path DOT_ENV = Path.of(".env.local");

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    YAMLConfiguration yaml =
        loc.startsWith(CLASSPATH)
            ? fromClasspath(loc.substring(CLASSPATH.length()))
            : fromFile(toFile(loc));
    yaml.getInterpolator().registerLookup("env", new DotEnvLookup(DOT_ENV));
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  /** The value of {@code key}, or {@code fallback} when it is absent, blank or unresolved. */
  public static String resolvedString(Configuration cfg, String key, String fallback) {
    if (cfg == null) return fallback;
    String value = cfg.getString(key, null);
    if (value == null || value.isBlank() || value.startsWith("${")) {
      return fallback;
    }
    return value.trim();
  }

  /** Integer form of {@link #resolvedString}; a value that is present but not a number fails. */
  public static int resolvedInt(Configuration cfg, String key, int fallback) {
    String value = resolvedString(cfg, key, null);
    if (value == null) return fallback;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigException("Configuration key '" + key + "' is not an integer: " + value, e);
    }
  }

  private static File toFile(String loc) {
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return new File(URI.create(loc));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + loc, e);
      }
    }
    return new File(loc);
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    InputStream in = loader.getResourceAsStream(resource);
    if (in == null) {
      log.warn("Configuration resource '{}' not found on classpath; using defaults", resource);
      return new YAMLConfiguration();
    }
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (ConfigurationException | IOException e) {
      throw new SerializationException("Failed to read configuration resource " + resource, e);
    }
    log.debug("Loaded configuration from classpath:{}", resource);
    return yaml;
  }

  private static YAMLConfiguration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    FileBasedConfigurationBuilder<YAMLConfiguration> builder =
        new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
            .configure(new Parameters().fileBased().setFile(file));
    try {
      YAMLConfiguration yaml = builder.getConfiguration();
      log.debug("Loaded configuration from {}", file.getAbsolutePath());
      return yaml;
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load configuration file " + file, e);
    }
  }
}
