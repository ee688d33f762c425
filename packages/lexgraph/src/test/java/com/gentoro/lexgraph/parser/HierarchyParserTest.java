package com.gentoro.lexgraph.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lexgraph.SampleDocument;
import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.exception.StructureException;
import com.gentoro.lexgraph.markup.MarkupDialect;
import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitKind;
import com.gentoro.lexgraph.model.UnitStatus;
import com.gentoro.lexgraph.model.UnitTree;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HierarchyParserTest {

  private static UnitTree tree;

  @BeforeAll
  static void parseSample() {
    tree = SampleDocument.parse();
  }

  private static StructuralUnit unit(String citation) {
    return tree.byCitation(citation).orElseThrow(() -> new AssertionError("missing " + citation));
  }

  @Test
  @DisplayName("sample document yields the expected unit counts")
  void counts() {
    assertEquals("26", tree.getDocumentTitle());
    assertEquals("26 USC", tree.getCitationPrefix());
    assertEquals(18, tree.totalUnits());
    assertEquals(6, tree.totalSections());
    assertEquals(1, tree.repealedSections());

    Map<UnitKind, Integer> byKind = tree.countsByKind();
    assertEquals(1, byKind.get(UnitKind.TITLE));
    assertEquals(1, byKind.get(UnitKind.SUBTITLE));
    assertEquals(2, byKind.get(UnitKind.CHAPTER));
    assertEquals(1, byKind.get(UnitKind.PART));
    assertEquals(6, byKind.get(UnitKind.SECTION));
    assertEquals(5, byKind.get(UnitKind.SUBSECTION));
    assertEquals(2, byKind.get(UnitKind.PARAGRAPH));
  }

  @Test
  @DisplayName("identifiers, citations and paths are derived from the ancestors")
  void derivedNames() {
    StructuralUnit title = unit("26 USC");
    assertEquals("/title26", title.getIdentifier());
    assertEquals("Title 26: INTERNAL REVENUE CODE", title.getHierarchicalPath());
    assertTrue(title.isRoot());

    StructuralUnit chapter = unit("26 USC Subtitle A Chapter 1");
    assertEquals("/title26/subtitleA/chapter1", chapter.getIdentifier());
    assertEquals(UnitKind.CHAPTER, chapter.getKind());

    StructuralUnit section = unit("26 USC 162");
    assertEquals("/title26/subtitleA/chapter1/section162", section.getIdentifier());
    assertEquals("162", section.getDesignator());
    assertEquals("Trade or business expenses", section.getHeading());
    assertEquals("/us/usc/t26/s162", section.getSourceIdentifier());
    assertEquals(
        "Subtitle A: Income Taxes > Chapter 1: NORMAL TAXES AND SURTAXES"
            + " > Section 162: Trade or business expenses",
        section.getHierarchicalPath());

    StructuralUnit paragraph = unit("26 USC 1(b)(1)");
    assertEquals(
        "/title26/subtitleA/chapter1/section1/subsection(b)/paragraph(1)",
        paragraph.getIdentifier());
    assertEquals("(1)", paragraph.getDesignator());
    assertEquals("26 USC 1(b)", tree.parent(paragraph).orElseThrow().getCitation());

    StructuralUnit part = unit("26 USC Subtitle A Chapter 2 Part II");
    assertEquals("/title26/subtitleA/chapter2/partII", part.getIdentifier());
  }

  @Test
  @DisplayName("every child identifier extends its parent's and is strictly deeper")
  void prefixInvariant() {
    for (StructuralUnit unit : tree.units()) {
      for (StructuralUnit child : tree.children(unit)) {
        assertTrue(
            child.getIdentifier().startsWith(unit.getIdentifier() + "/"),
            child.getIdentifier() + " should extend " + unit.getIdentifier());
        assertEquals(unit.getIdentifier(), child.getParentIdentifier());
        assertTrue(child.getKind().depth() > unit.getKind().depth());
      }
    }
    assertEquals(1, tree.roots().size());
  }

  @Test
  @DisplayName("children keep document order")
  void childOrder() {
    List<String> sections =
        tree.children(unit("26 USC Subtitle A Chapter 1")).stream()
            .map(StructuralUnit::getCitation)
            .toList();
    assertEquals(
        List.of("26 USC 1", "26 USC 2", "26 USC 3", "26 USC 162", "26 USC 274"), sections);
    assertEquals(
        List.of("26 USC", "26 USC Subtitle A", "26 USC Subtitle A Chapter 1"),
        tree.ancestors(unit("26 USC 162")).stream().map(StructuralUnit::getCitation).toList());
  }

  @Test
  @DisplayName("status comes from heading markers; repealed sections have no text")
  void statuses() {
    StructuralUnit repealed = unit("26 USC 3");
    assertEquals(UnitStatus.REPEALED, repealed.getStatus());
    assertEquals("", repealed.getText());
    assertEquals(
        UnitStatus.RESERVED, unit("26 USC Subtitle A Chapter 2 Part II").getStatus());
    assertEquals(UnitStatus.ACTIVE, unit("26 USC 162").getStatus());
    assertEquals(16, tree.countsByStatus().get(UnitStatus.ACTIVE));
  }

  @Test
  @DisplayName("tables are spliced into the text as normalized lines")
  void tableSplice() {
    String expected =
        "There is hereby imposed on the taxable income (as defined in section 63) of every"
            + " married individual a tax determined under the following table:\n"
            + "| Taxable income | Rate | Notes |\n"
            + "| Over $36,900 | 28% \\| 31% |  |";
    assertEquals(expected, unit("26 USC 1(a)").getText());
  }

  @Test
  @DisplayName("a unit's text excludes its children, notes and source credits")
  void directTextOnly() {
    StructuralUnit section = unit("26 USC 162");
    assertTrue(section.getText().startsWith("Except as provided in section 274, a deduction"));
    assertFalse(section.getText().contains("reasonable salaries"));
    assertFalse(section.getText().contains("7805"));
    assertFalse(section.getText().contains("68A Stat."));
    assertEquals(
        "There is hereby imposed on the taxable income of every head of a household—",
        unit("26 USC 1(b)").getText());
    assertEquals("", unit("26 USC Subtitle A Chapter 1").getText());
  }

  @Test
  @DisplayName("findSection looks sections up by number")
  void findSection() {
    assertEquals("26 USC 274", tree.findSection("274").orElseThrow().getCitation());
    assertTrue(tree.findSection("9999").isEmpty());
    assertTrue(tree.findSection(" ").isEmpty());
  }

  @Test
  @DisplayName("section cap keeps the first N sections and their subunits")
  void sectionCap() {
    UnitTree capped =
        new HierarchyParser(MarkupDialect.uslm(), new TableNormalizer(), 2)
            .parse(SampleDocument.path());
    assertEquals(2, capped.totalSections());
    assertEquals(11, capped.totalUnits());
    assertTrue(capped.byCitation("26 USC 162").isEmpty());
    assertTrue(capped.byCitation("26 USC 1(b)(2)").isPresent());
    StructuralUnit chapter = capped.byCitation("26 USC Subtitle A Chapter 1").orElseThrow();
    assertEquals(2, chapter.getChildIdentifiers().size());
  }

  @Test
  @DisplayName("malformed markup reports the deepest resolved unit")
  void malformedMarkup() {
    String body =
        "<title><num value=\"26\"/><heading>IRC</heading>"
            + "<chapter><num value=\"1\"/>"
            + "<section><num value=\"1\"/><heading>Tax</heading><content>text</content></section>"
            + "<section><num value=\"2\"/><content>broken</chapter></title>";
    StructureException ex =
        assertThrows(StructureException.class, () -> SampleDocument.parseInline(body));
    assertEquals("/title26/chapter1/section1", ex.getDeepestIdentifier());
    assertTrue(ex.getMessage().contains("/title26/chapter1/section1"));
  }

  @Test
  @DisplayName("a hierarchy that does not start with a title is rejected")
  void nonTitleRoot() {
    StructureException ex =
        assertThrows(
            StructureException.class,
            () -> SampleDocument.parseInline("<section><num value=\"1\"/></section>"));
    assertNull(ex.getDeepestIdentifier());
  }

  @Test
  @DisplayName("a coarser unit nested inside a finer one is rejected")
  void illegalNesting() {
    String body =
        "<title><num value=\"26\"/><section><num value=\"1\"/>"
            + "<chapter><num value=\"2\"/></chapter></section></title>";
    StructureException ex =
        assertThrows(StructureException.class, () -> SampleDocument.parseInline(body));
    assertEquals("/title26/section1", ex.getDeepestIdentifier());
  }

  @Test
  @DisplayName("duplicate section citations are rejected")
  void duplicateCitation() {
    String body =
        "<title><num value=\"26\"/><section><num value=\"1\"/></section>"
            + "<section><num value=\"1\"/></section></title>";
    assertThrows(StructureException.class, () -> SampleDocument.parseInline(body));
  }

  @Test
  @DisplayName("a document without a title fails")
  void noTitle() {
    assertThrows(StructureException.class, () -> SampleDocument.parseInline("<meta/>"));
  }

  @Test
  @DisplayName("a missing input file is an I/O error")
  void missingFile(@TempDir Path dir) {
    HierarchyParser parser = new HierarchyParser(MarkupDialect.uslm());
    assertThrows(IoException.class, () -> parser.parse(dir.resolve("absent.xml")));
  }

  @Test
  @DisplayName("containers without a number get a positional identifier and no citation")
  void containerWithoutDesignator() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/><subtitle><heading>Misc</heading>"
                + "<section><num value=\"7\"/></section></subtitle></title>");
    StructuralUnit subtitle = t.byIdentifier("/title26/subtitle@1").orElseThrow();
    assertNull(subtitle.getCitation());
    assertEquals("26 USC 7", t.units().get(2).getCitation());
  }

  @Test
  @DisplayName("status attributes win over markers; foreign elements are plain text")
  void statusAttributeAndNamespaces() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/>"
                + "<section status=\"repealed\"><num value=\"1\"/><heading>Old</heading>"
                + "<content>See <x:section xmlns:x=\"urn:other\">elsewhere</x:section>.</content>"
                + "</section></title>");
    StructuralUnit section = t.byCitation("26 USC 1").orElseThrow();
    assertEquals(UnitStatus.REPEALED, section.getStatus());
    assertEquals("See elsewhere.", section.getText());
    assertEquals(2, t.totalUnits());
  }

  @Test
  @DisplayName("column spans expand into empty cells")
  void colspan() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/><section><num value=\"1\"/><content>"
                + "<table><caption>ignored</caption>"
                + "<tr><th colspan=\"2\">Head</th></tr>"
                + "<tr><td>x</td><td>y</td></tr>"
                + "</table></content></section></title>");
    assertEquals("| Head |  |\n| x | y |", t.byCitation("26 USC 1").orElseThrow().getText());
  }

  @Test
  @DisplayName("an empty table row stays between its neighbours")
  void emptyTableRow() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/><section><num value=\"1\"/><content><table>"
                + "<tr><td>a</td><td>b</td></tr>"
                + "<tr><td></td><td></td></tr>"
                + "<tr><td>c</td><td>d</td></tr>"
                + "</table></content></section></title>");
    assertEquals(
        "| a | b |\n|  |  |\n| c | d |", t.byCitation("26 USC 1").orElseThrow().getText());
  }

  @Test
  @DisplayName("a repeated paragraph number is kept under a positional identifier")
  void repeatedSubunitDesignator() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/><section><num value=\"1\"/>"
                + "<subsection><num value=\"a\"/>"
                + "<paragraph><num value=\"1\"/><content>first</content></paragraph>"
                + "<paragraph><num value=\"1\"/><content>second</content>"
                + "<subparagraph><num value=\"A\"/><content>nested</content></subparagraph>"
                + "</paragraph>"
                + "</subsection></section></title>");
    assertEquals("first", t.byCitation("26 USC 1(a)(1)").orElseThrow().getText());
    StructuralUnit repeated =
        t.byIdentifier("/title26/section1/subsection(a)/paragraph(1)@2").orElseThrow();
    assertEquals("second", repeated.getText());
    assertNull(repeated.getCitation());
    StructuralUnit nested =
        t.byIdentifier("/title26/section1/subsection(a)/paragraph(1)@2/subparagraph(A)")
            .orElseThrow();
    assertNull(nested.getCitation());
    assertEquals(2, t.byCitation("26 USC 1(a)").orElseThrow().getChildIdentifiers().size());
  }

  @Test
  @DisplayName("sections are looked up within every title of a multi-title document")
  void multipleTitles() {
    UnitTree t =
        SampleDocument.parseInline(
            "<title><num value=\"26\"/><section><num value=\"5\"/></section></title>"
                + "<title><num value=\"27\"/><section><num value=\"1\"/></section>"
                + "<section><num value=\"5\"/></section></title>");
    assertEquals("26", t.getDocumentTitle());
    assertEquals(2, t.roots().size());
    assertEquals("27 USC 1", t.findSection("1").orElseThrow().getCitation());
    StructuralUnit section = t.byCitation("27 USC 5").orElseThrow();
    assertEquals("27 USC", t.titleOf(section).getCitation());
    assertEquals("26 USC", t.titleOf(t.byCitation("26 USC 5").orElseThrow()).getCitation());
  }
}
