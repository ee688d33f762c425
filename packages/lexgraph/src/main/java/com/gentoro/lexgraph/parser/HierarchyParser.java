package com.gentoro.lexgraph.parser;

import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.exception.StructureException;
import com.gentoro.lexgraph.markup.MarkupDialect;
import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitKind;
import com.gentoro.lexgraph.model.UnitStatus;
import com.gentoro.lexgraph.model.UnitTree;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Builds a {@link UnitTree} from structural markup with a single recursive-descent pass over a StAX
 * reader.
 *
 * <p>Each structural element becomes one {@link StructuralUnit}. The unit's identifier and citation
 * are derived from its ancestors as soon as its designator and heading have been read, which is
 * also the point where it counts as "resolved" for error reporting. Any malformed markup or
 * unexpected nesting aborts the whole parse with a {@link StructureException}; no partial tree is
 * ever returned. The one tolerated duplicate is a subunit designator repeated under the same
 * parent, which is kept under a positional identifier without a citation.
 */
public class HierarchyParser {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(HierarchyParser.class);

  private final MarkupDialect dialect;
  private final TableNormalizer tableNormalizer;
  private final int maxSections;

  public HierarchyParser(MarkupDialect dialect) {
    this(dialect, new TableNormalizer(), 0);
  }

  /**
   * @param maxSections sections beyond this count are read but not kept; zero or less means no cap
   */
  public HierarchyParser(MarkupDialect dialect, TableNormalizer tableNormalizer, int maxSections) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableNormalizer = Objects.requireNonNull(tableNormalizer, "tableNormalizer");
    this.maxSections = maxSections;
  }

  public UnitTree parse(Path path) {
    log.info("Parsing {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in, path.toString());
    } catch (NoSuchFileException e) {
      throw new IoException("Input file not found: " + path, e);
    } catch (IOException e) {
      throw new IoException("Failed to read input file: " + path, e);
    }
  }

  public UnitTree parse(InputStream in, String sourceName) {
    ParseState state = new ParseState();
    XMLStreamReader reader = null;
    try {
      reader = newInputFactory().createXMLStreamReader(in);
      walkDocument(reader, state);
    } catch (XMLStreamException e) {
      throw new StructureException(
          state.deepestIdentifier, "Malformed markup in " + sourceName + ": " + e.getMessage(), e);
    } finally {
      closeQuietly(reader);
    }

    if (state.units.isEmpty()) {
      throw new StructureException(null, "No title element found in " + sourceName);
    }
    state.units.sort(Comparator.comparingInt(StructuralUnit::getOrdinal));
    UnitTree tree = new UnitTree(state.documentTitle, state.documentPrefix, state.units);
    log.info(
        "Parsed {} units ({} sections, {} repealed) from {}",
        tree.totalUnits(),
        tree.totalSections(),
        tree.repealedSections(),
        sourceName);
    if (state.repeatedDesignators > 0) {
      log.warn("{} units with repeated designators were kept without a citation",
          state.repeatedDesignators);
    }
    if (state.sectionsDropped > 0) {
      log.info(
          "Section cap of {} reached; {} sections skipped", maxSections, state.sectionsDropped);
    }
    return tree;
  }

  private static XMLInputFactory newInputFactory() {
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
    return factory;
  }

  private static void closeQuietly(XMLStreamReader reader) {
    if (reader == null) return;
    try {
      reader.close();
    } catch (XMLStreamException e) {
      log.debug("Failed to close XML reader", e);
    }
  }

  /** Outside of any unit: wrappers such as {@code uscDoc} and {@code main} are transparent. */
  private void walkDocument(XMLStreamReader reader, ParseState state) throws XMLStreamException {
    while (reader.hasNext()) {
      if (reader.next() != XMLStreamConstants.START_ELEMENT) continue;
      String local = reader.getLocalName();
      if (dialect.isSkipped(local)) {
        skipElement(reader);
        continue;
      }
      Optional<UnitKind> kind = dialect.kindOf(reader.getNamespaceURI(), local);
      if (kind.isEmpty()) continue;
      if (kind.get() != UnitKind.TITLE) {
        throw new StructureException(
            state.deepestIdentifier,
            "Expected a title at the top of the hierarchy but found <" + local + ">");
      }
      parseUnit(reader, kind.get(), null, state);
    }
  }

  /**
   * Parses one unit; the reader is positioned on its start tag and is left on its end tag. Returns
   * {@code null} when the unit falls beyond the section cap.
   */
  private Frame parseUnit(XMLStreamReader reader, UnitKind kind, Frame parent, ParseState state)
      throws XMLStreamException {
    String element = reader.getLocalName();
    Frame frame = new Frame(kind, parent, state.nextOrdinal++);
    frame.sourceIdentifier = attribute(reader, dialect.getSourceIdentifierAttribute());
    frame.statusAttribute = attribute(reader, dialect.getStatusAttribute());
    frame.siblingIndex =
        (parent == null ? state.rootCounts : parent.childCounts).merge(kind, 1, Integer::sum);

    boolean capped = parent != null && parent.capped;
    if (!capped && kind == UnitKind.SECTION && maxSections > 0) {
      capped = state.sectionsKept >= maxSections;
      if (capped) state.sectionsDropped++;
      else state.sectionsKept++;
    }
    frame.capped = capped;

    int depth = 0;
    while (true) {
      if (!reader.hasNext()) {
        throw new StructureException(
            state.deepestIdentifier, "Unterminated <" + element + "> element");
      }
      int event = reader.next();
      switch (event) {
        case XMLStreamConstants.START_ELEMENT:
          {
            String local = reader.getLocalName();
            if (dialect.isSkipped(local)) {
              skipElement(reader);
              break;
            }
            Optional<UnitKind> childKind = dialect.kindOf(reader.getNamespaceURI(), local);
            if (childKind.isPresent()) {
              resolve(frame, state);
              if (!kind.canContain(childKind.get())) {
                throw new StructureException(
                    state.deepestIdentifier,
                    "A "
                        + childKind.get().key()
                        + " cannot be nested inside a "
                        + kind.key()
                        + " ("
                        + frame.identifier
                        + ")");
              }
              Frame child = parseUnit(reader, childKind.get(), frame, state);
              if (child != null) frame.children.add(child.identifier);
              break;
            }
            if (depth == 0
                && frame.identifier == null
                && frame.designator == null
                && local.equals(dialect.getDesignatorElement())) {
              frame.designator = readDesignator(reader, kind);
              break;
            }
            if (depth == 0
                && frame.identifier == null
                && frame.heading == null
                && local.equals(dialect.getHeadingElement())) {
              String heading = readText(reader).replaceAll("\\s+", " ").trim();
              frame.heading = heading.isEmpty() ? null : heading;
              break;
            }
            if (dialect.isTable(local)) {
              frame.text.appendBlock(tableNormalizer.normalize(readTable(reader)));
              break;
            }
            if (dialect.isBlock(local)) frame.text.breakParagraph();
            depth++;
            break;
          }
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          frame.text.append(reader.getText());
          break;
        case XMLStreamConstants.END_ELEMENT:
          if (depth == 0) {
            return complete(frame, state);
          }
          depth--;
          if (dialect.isBlock(reader.getLocalName())) frame.text.breakParagraph();
          break;
        default:
          break;
      }
    }
  }

  private Frame complete(Frame frame, ParseState state) {
    resolve(frame, state);
    if (frame.capped) {
      return null;
    }
    String text = frame.text.result();
    UnitStatus status =
        dialect
            .statusFromAttribute(frame.statusAttribute)
            .or(() -> dialect.statusFromMarker(frame.heading))
            .or(() -> dialect.statusFromMarker(text))
            .orElse(UnitStatus.ACTIVE);

    StructuralUnit unit =
        new StructuralUnit(
            frame.identifier,
            frame.citation,
            frame.kind,
            frame.designator,
            frame.heading,
            text,
            status,
            frame.parent == null ? null : frame.parent.identifier,
            frame.children,
            frame.path,
            frame.sourceIdentifier,
            frame.ordinal);
    state.units.add(unit);
    if (log.isTraceEnabled()) {
      log.trace("Unit {} [{}] status={}", unit.getIdentifier(), unit.getCitation(), status);
    }
    return frame;
  }

  /** Derives identifier, citation and path once; later calls are no-ops. */
  private void resolve(Frame frame, ParseState state) {
    if (frame.identifier != null) return;
    Frame parent = frame.parent;
    UnitKind kind = frame.kind;
    String designator = frame.designator;

    String segment =
        designator != null
            ? kind.key() + designator.replaceAll("\\s+", "")
            : kind.key() + "@" + frame.siblingIndex;
    frame.identifier = (parent == null ? "" : parent.identifier) + "/" + segment;

    String label = StructuralUnit.labelOf(kind, designator, frame.heading);
    if (kind == UnitKind.TITLE) {
      if (designator == null) {
        throw new StructureException(state.deepestIdentifier, "Title without a number");
      }
      frame.titlePrefix = designator + " " + dialect.getCodeSuffix();
      frame.containerChain = frame.titlePrefix;
      frame.citation = frame.titlePrefix;
      frame.path = label;
      if (state.documentTitle == null) {
        state.documentTitle = designator;
        state.documentPrefix = frame.titlePrefix;
      }
    } else {
      frame.titlePrefix = parent.titlePrefix;
      frame.path = parent.kind == UnitKind.TITLE ? label : parent.path + " > " + label;
      if (kind.isContainer()) {
        String link = designator != null ? designator : "@" + frame.siblingIndex;
        frame.containerChain = parent.containerChain + " " + kind.label() + " " + link;
        frame.citation =
            designator != null && parent.citation != null ? frame.containerChain : null;
      } else if (kind == UnitKind.SECTION) {
        frame.citation = designator != null ? frame.titlePrefix + " " + designator : null;
      } else {
        frame.citation =
            designator != null && parent.citation != null ? parent.citation + designator : null;
      }
    }

    if (!frame.capped && kind.isSubunit() && isTaken(frame, state)) {
      // A designator repeated among subunits of one parent ("so in original") keeps its text
      // under a positional identifier and gets no citation.
      String original = frame.identifier;
      frame.identifier = original + "@" + frame.siblingIndex;
      frame.citation = null;
      state.repeatedDesignators++;
      log.warn(
          "Repeated designator at {}; kept as {} without a citation", original, frame.identifier);
    }

    if (!frame.capped) {
      if (!state.identifiers.add(frame.identifier)) {
        throw new StructureException(
            state.deepestIdentifier, "Duplicate unit identifier " + frame.identifier);
      }
      if (frame.citation != null && !state.citations.add(frame.citation)) {
        throw new StructureException(
            state.deepestIdentifier, "Duplicate citation " + frame.citation);
      }
      state.deepestIdentifier = frame.identifier;
    }
  }

  private static boolean isTaken(Frame frame, ParseState state) {
    return state.identifiers.contains(frame.identifier)
        || (frame.citation != null && state.citations.contains(frame.citation));
  }

  private String readDesignator(XMLStreamReader reader, UnitKind kind) throws XMLStreamException {
    String value = attribute(reader, dialect.getDesignatorAttribute());
    String printed = readText(reader);
    String designator = dialect.cleanDesignator(value != null ? value : printed);
    if (designator == null) return null;
    if (kind.isSubunit()) {
      String bare = designator;
      while (bare.startsWith("(")) bare = bare.substring(1);
      while (bare.endsWith(")")) bare = bare.substring(0, bare.length() - 1);
      bare = bare.trim();
      return bare.isEmpty() ? null : "(" + bare + ")";
    }
    return designator;
  }

  /** Rows of cell text; colspans are expanded into trailing empty cells. */
  private List<List<String>> readTable(XMLStreamReader reader) throws XMLStreamException {
    List<List<String>> rows = new ArrayList<>();
    List<String> row = null;
    int depth = 0;
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        String local = reader.getLocalName();
        if (local.equals(dialect.getRowElement())) {
          row = new ArrayList<>();
          rows.add(row);
          depth++;
        } else if (dialect.isCell(local)) {
          int span = colspan(attribute(reader, dialect.getColspanAttribute()));
          String cell = readText(reader);
          if (row == null) {
            row = new ArrayList<>();
            rows.add(row);
          }
          row.add(cell);
          for (int i = 1; i < span; i++) row.add("");
        } else if (dialect.isIgnoredInTable(local)) {
          skipElement(reader);
        } else {
          depth++;
        }
      } else if (event == XMLStreamConstants.END_ELEMENT) {
        if (depth == 0) return rows;
        if (reader.getLocalName().equals(dialect.getRowElement())) row = null;
        depth--;
      }
    }
    throw new XMLStreamException("Unterminated table");
  }

  private static int colspan(String raw) {
    if (raw == null) return 1;
    try {
      return Math.max(1, Integer.parseInt(raw.trim()));
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  /** All character data below the current element; leaves the reader on its end tag. */
  private String readText(XMLStreamReader reader) throws XMLStreamException {
    StringBuilder sb = new StringBuilder();
    int depth = 0;
    while (reader.hasNext()) {
      int event = reader.next();
      switch (event) {
        case XMLStreamConstants.START_ELEMENT:
          depth++;
          break;
        case XMLStreamConstants.END_ELEMENT:
          if (depth == 0) return sb.toString();
          depth--;
          break;
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          sb.append(reader.getText());
          break;
        default:
          break;
      }
    }
    throw new XMLStreamException("Unterminated element while reading text");
  }

  private static void skipElement(XMLStreamReader reader) throws XMLStreamException {
    int depth = 0;
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        depth++;
      } else if (event == XMLStreamConstants.END_ELEMENT) {
        if (depth == 0) return;
        depth--;
      }
    }
    throw new XMLStreamException("Unterminated element while skipping");
  }

  private static String attribute(XMLStreamReader reader, String name) {
    if (name == null) return null;
    String value = reader.getAttributeValue(null, name);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static final class ParseState {
    final List<StructuralUnit> units = new ArrayList<>();
    final Set<String> identifiers = new HashSet<>();
    final Set<String> citations = new HashSet<>();
    final Map<UnitKind, Integer> rootCounts = new EnumMap<>(UnitKind.class);
    String deepestIdentifier;
    String documentTitle;
    String documentPrefix;
    int nextOrdinal;
    int sectionsKept;
    int sectionsDropped;
    int repeatedDesignators;
  }

  private static final class Frame {
    final UnitKind kind;
    final Frame parent;
    final int ordinal;
    final List<String> children = new ArrayList<>();
    final Map<UnitKind, Integer> childCounts = new EnumMap<>(UnitKind.class);
    final TextAccumulator text = new TextAccumulator();
    int siblingIndex;
    boolean capped;
    String designator;
    String heading;
    String sourceIdentifier;
    String statusAttribute;
    String identifier;
    String citation;
    String path;
    String titlePrefix;
    String containerChain;

    Frame(UnitKind kind, Frame parent, int ordinal) {
      this.kind = kind;
      this.parent = parent;
      this.ordinal = ordinal;
    }
  }
}
