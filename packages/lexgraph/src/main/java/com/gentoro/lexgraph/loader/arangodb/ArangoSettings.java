package com.gentoro.lexgraph.loader.arangodb;

import com.gentoro.lexgraph.ConfigurationProvider;
import org.apache.commons.configuration2.Configuration;

/**
 * Connection settings for the ArangoDB store, read from {@code loader.arangodb.*}. The bundled
 * configuration points these keys at {@code LEXGRAPH_ARANGO_*} environment variables; a variable
 * that is not set falls back to the default below.
 */
public record ArangoSettings(
    String host, int port, String user, String password, String database) {

  public static final String PREFIX = "loader.arangodb.";

  public static ArangoSettings from(Configuration cfg) {
    return new ArangoSettings(
        ConfigurationProvider.resolvedString(cfg, PREFIX + "host", "localhost"),
        ConfigurationProvider.resolvedInt(cfg, PREFIX + "port", 8529),
        ConfigurationProvider.resolvedString(cfg, PREFIX + "user", "root"),
        ConfigurationProvider.resolvedString(cfg, PREFIX + "password", ""),
        ConfigurationProvider.resolvedString(cfg, PREFIX + "database", "lexgraph"));
  }

  @Override
  public String toString() {
    return "ArangoSettings{" + user + "@" + host + ":" + port + "/" + database + "}";
  }
}
