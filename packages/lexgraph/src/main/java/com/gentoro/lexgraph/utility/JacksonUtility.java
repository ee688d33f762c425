package com.gentoro.lexgraph.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gentoro.lexgraph.exception.SerializationException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Shared Jackson mappers. YAML is only ever read (markup dialects); JSON is only ever written (tree
 * exports) and read back by tests.
 */
public final class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          // Absent headings and citations are omitted rather than written as null.
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /**
   * Binds a YAML document to {@code type}.
   *
   * @param origin where the document came from, used in the error message
   */
  public static <T> T readYaml(InputStream in, Class<T> type, String origin) {
    try {
      return YAML_MAPPER.readValue(in, type);
    } catch (IOException e) {
      throw new SerializationException(
          "Invalid YAML document " + origin + ": " + e.getMessage(), e);
    }
  }

  /** Pretty-printed JSON for {@code value}; {@code what} names it in the error message. */
  public static String writeJson(Object value, String what) {
    try {
      return JSON_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize " + what, e);
    }
  }
}
