package com.gentoro.lexgraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * {@code env} lookup that prefers the process environment and falls back to a {@code KEY=value}
 * file. The file is read once, on the first miss. Blank lines and {@code #} comments are skipped;
 * matching single or double quotes around a value are removed.
 */
final class DotEnvLookup implements Lookup {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(DotEnvLookup.class);

  private final Path file;
  private volatile Map<String, String> values;

  DotEnvLookup(Path file) {
    this.file = file;
  }

  @Override
  public Object lookup(String key) {
    String fromEnvironment = System.getenv(key);
    if (fromEnvironment != null && !fromEnvironment.isEmpty()) {
      return fromEnvironment;
    }
    return fileValues().get(key);
  }

  private Map<String, String> fileValues() {
    Map<String, String> loaded = values;
    if (loaded == null) {
      synchronized (this) {
        if (values == null) {
          values = read(file);
        }
        loaded = values;
      }
    }
    return loaded;
  }

  static Map<String, String> read(Path file) {
    Map<String, String> out = new HashMap<>();
    if (!Files.isRegularFile(file)) {
      log.debug("No env file at {}", file.toAbsolutePath());
      return out;
    }
    try {
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        String trimmed = line.trim();
        int eq = trimmed.indexOf('=');
        if (trimmed.isEmpty() || trimmed.startsWith("#") || eq <= 0) continue;
        out.put(trimmed.substring(0, eq).trim(), unquote(trimmed.substring(eq + 1).trim()));
      }
    } catch (IOException e) {
      log.warn("Could not read env file {}: {}", file.toAbsolutePath(), e.getMessage());
      return Map.of();
    }
    log.info("Read {} variables from {}", out.size(), file.toAbsolutePath());
    return out;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
