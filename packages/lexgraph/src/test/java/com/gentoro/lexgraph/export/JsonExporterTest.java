package com.gentoro.lexgraph.export;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.lexgraph.SampleDocument;
import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.reference.ExtractionResult;
import com.gentoro.lexgraph.reference.ReferenceExtractor;
import com.gentoro.lexgraph.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonExporterTest {

  private static UnitTree tree;
  private static ExtractionResult extraction;

  private final JsonExporter exporter = new JsonExporter();

  @BeforeAll
  static void parseSample() {
    tree = SampleDocument.parse();
    extraction = new ReferenceExtractor().extractAll(tree);
  }

  @Test
  @DisplayName("export nests units under their parents with totals at the top")
  void nestedDocument() throws Exception {
    JsonNode doc = JacksonUtility.getJsonMapper().readTree(exporter.toJson(tree, extraction));

    assertEquals("26", doc.get("title").asText());
    assertEquals(6, doc.get("totalSections").asInt());
    assertEquals(18, doc.get("totalUnits").asInt());
    assertEquals(1, doc.get("repealedSections").asInt());

    JsonNode title = doc.get("roots").get(0);
    assertEquals("26 USC", title.get("citation").asText());
    assertFalse(title.has("parent"));

    JsonNode chapter = title.get("children").get(0).get("children").get(0);
    JsonNode section = chapter.get("children").get(3);
    assertEquals("26 USC 162", section.get("citation").asText());
    assertEquals("/title26/subtitleA/chapter1", section.get("parent").asText());
    assertEquals("section", section.get("kind").asText());
    assertEquals("active", section.get("status").asText());
    assertTrue(section.get("hierarchical_path").asText().endsWith("Trade or business expenses"));
    assertEquals("/us/usc/t26/s162", section.get("source_identifier").asText());
    assertEquals("26 USC 274", section.get("references").get(0).get("target").asText());
    assertEquals("exception", section.get("references").get(0).get("type").asText());
    assertEquals("26 USC 162(a)", section.get("children").get(0).get("citation").asText());
  }

  @Test
  @DisplayName("references are left out when no extraction is given")
  void withoutReferences() throws Exception {
    JsonNode doc = JacksonUtility.getJsonMapper().readTree(exporter.toJson(tree, null));
    assertFalse(doc.get("roots").get(0).has("references"));
  }

  @Test
  @DisplayName("export writes the file, creating parent directories")
  void writesFile(@TempDir Path dir) throws Exception {
    Path out = dir.resolve("nested/usc26.json");
    exporter.export(tree, extraction, out);
    JsonNode doc = JacksonUtility.getJsonMapper().readTree(Files.readString(out));
    assertEquals(18, doc.get("totalUnits").asInt());
  }

  @Test
  @DisplayName("an unwritable target is an I/O error")
  void unwritableTarget(@TempDir Path dir) throws Exception {
    Path blocker = dir.resolve("file");
    Files.writeString(blocker, "x");
    Path target = blocker.resolve("o.json");
    assertThrows(IoException.class, () -> exporter.export(tree, extraction, target));
  }
}
