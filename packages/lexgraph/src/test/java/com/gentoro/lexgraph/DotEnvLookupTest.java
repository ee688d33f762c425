package com.gentoro.lexgraph;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DotEnvLookupTest {

  @Test
  @DisplayName("Reads KEY=value pairs, skipping comments and stripping matching quotes")
  void readsEnvFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve(".env.local");
    Files.writeString(
        file,
        "# arango\n"
            + "LEXGRAPH_ARANGO_HOST=graph.local\n"
            + "\n"
            + "LEXGRAPH_ARANGO_PASSWORD=\"s3cret=1\"\n"
            + "LEXGRAPH_ARANGO_USER='root'\n"
            + "=orphan\n"
            + "not a pair\n",
        StandardCharsets.UTF_8);

    Map<String, String> values = DotEnvLookup.read(file);
    assertEquals(
        Map.of(
            "LEXGRAPH_ARANGO_HOST", "graph.local",
            "LEXGRAPH_ARANGO_PASSWORD", "s3cret=1",
            "LEXGRAPH_ARANGO_USER", "root"),
        values);

    DotEnvLookup lookup = new DotEnvLookup(file);
    assertEquals("graph.local", lookup.lookup("LEXGRAPH_ARANGO_HOST"));
    assertNull(lookup.lookup("LEXGRAPH_TEST_UNSET_VARIABLE"));
  }

  @Test
  @DisplayName("A missing env file yields no values")
  void missingFile(@TempDir Path dir) {
    assertTrue(DotEnvLookup.read(dir.resolve("absent")).isEmpty());
    assertNull(new DotEnvLookup(dir.resolve("absent")).lookup("LEXGRAPH_TEST_UNSET_VARIABLE"));
  }
}
