package com.gentoro.lexgraph.markup;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.lexgraph.exception.ConfigException;
import com.gentoro.lexgraph.exception.IoException;
import com.gentoro.lexgraph.model.UnitKind;
import com.gentoro.lexgraph.model.UnitStatus;
import com.gentoro.lexgraph.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Element vocabulary of a structural markup standard: which elements are units of which kind, where
 * designators and headings live, how tables are laid out and how repeal/expiration is signalled.
 *
 * <p>Dialects are YAML documents; the bundled USLM dialect lives at {@code dialects/uslm.yaml}.
 */
public final class MarkupDialect {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(MarkupDialect.class);

  public static final String USLM_LOCATION = "classpath:dialects/uslm.yaml";

  @JsonProperty private String name;
  @JsonProperty private String namespace;
  @JsonProperty private String codeSuffix = "USC";
  @JsonProperty private Map<String, String> units = new LinkedHashMap<>();
  @JsonProperty private String designatorElement = "num";
  @JsonProperty private String designatorAttribute = "value";
  @JsonProperty private String headingElement = "heading";
  @JsonProperty private String sourceIdentifierAttribute = "identifier";
  @JsonProperty private List<String> blockElements = new ArrayList<>();
  @JsonProperty private List<String> skipElements = new ArrayList<>();
  @JsonProperty private TableLayout table = new TableLayout();
  @JsonProperty private String statusAttribute = "status";
  @JsonProperty private Map<String, List<String>> statusValues = new LinkedHashMap<>();
  @JsonProperty private Map<String, List<String>> statusMarkers = new LinkedHashMap<>();
  @JsonProperty private List<String> designatorPrefixes = new ArrayList<>();
  @JsonProperty private List<String> designatorTrailers = new ArrayList<>();

  private final Map<String, UnitKind> kindByElement = new HashMap<>();
  private final Map<UnitStatus, List<String>> valuesByStatus = new EnumMap<>(UnitStatus.class);
  private final Map<UnitStatus, List<String>> markersByStatus = new EnumMap<>(UnitStatus.class);

  private MarkupDialect() {}

  /** Table element names. */
  public static final class TableLayout {
    @JsonProperty private List<String> elements = List.of("table");
    @JsonProperty private String rowElement = "tr";
    @JsonProperty private List<String> cellElements = List.of("td", "th");
    @JsonProperty private String colspanAttribute = "colspan";
    @JsonProperty private List<String> ignoredElements = new ArrayList<>();
  }

  public static MarkupDialect uslm() {
    return load(USLM_LOCATION);
  }

  /** Loads a dialect from {@code classpath:...} or a filesystem path. */
  public static MarkupDialect load(String location) {
    if (location == null || location.isBlank()) {
      throw new ConfigException("Dialect location cannot be empty");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      String resource = loc.substring("classpath:".length());
      try (InputStream in =
          Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
        if (in == null) {
          throw new ConfigException("Dialect resource not found on classpath: " + resource);
        }
        return read(in, loc);
      } catch (IOException e) {
        throw new IoException("Failed to read dialect resource: " + resource, e);
      }
    }
    Path path = Path.of(loc);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Dialect file not found: " + path.toAbsolutePath());
    }
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, loc);
    } catch (IOException e) {
      throw new IoException("Failed to read dialect file: " + path, e);
    }
  }

  private static MarkupDialect read(InputStream in, String origin) {
    MarkupDialect dialect = JacksonUtility.readYaml(in, MarkupDialect.class, origin);
    dialect.index(origin);
    log.debug(
        "Loaded markup dialect '{}' from {} ({} unit elements)",
        dialect.name,
        origin,
        dialect.kindByElement.size());
    return dialect;
  }

  private void index(String origin) {
    if (units == null || units.isEmpty()) {
      throw new ConfigException("Dialect " + origin + " maps no elements to unit kinds");
    }
    for (Map.Entry<String, String> entry : units.entrySet()) {
      UnitKind kind;
      try {
        kind = UnitKind.fromKey(entry.getKey());
      } catch (IllegalArgumentException e) {
        throw new ConfigException(
            "Dialect " + origin + " names an unknown unit kind: " + entry.getKey(), e);
      }
      kindByElement.put(entry.getValue(), kind);
    }
    if (!kindByElement.containsValue(UnitKind.TITLE)) {
      throw new ConfigException("Dialect " + origin + " has no element for the title kind");
    }
    statusTable(statusValues, valuesByStatus, origin);
    statusTable(statusMarkers, markersByStatus, origin);
  }

  private static void statusTable(
      Map<String, List<String>> raw, Map<UnitStatus, List<String>> target, String origin) {
    if (raw == null) return;
    for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
      UnitStatus status;
      try {
        status = UnitStatus.valueOf(entry.getKey().trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigException(
            "Dialect " + origin + " names an unknown status: " + entry.getKey(), e);
      }
      List<String> lowered = new ArrayList<>();
      for (String value : entry.getValue()) {
        lowered.add(value.toLowerCase(Locale.ROOT));
      }
      target.put(status, Collections.unmodifiableList(lowered));
    }
  }

  public String getName() {
    return name;
  }

  public String getCodeSuffix() {
    return codeSuffix;
  }

  public String getDesignatorElement() {
    return designatorElement;
  }

  public String getDesignatorAttribute() {
    return designatorAttribute;
  }

  public String getHeadingElement() {
    return headingElement;
  }

  public String getSourceIdentifierAttribute() {
    return sourceIdentifierAttribute;
  }

  public String getStatusAttribute() {
    return statusAttribute;
  }

  public String getRowElement() {
    return table.rowElement;
  }

  public String getColspanAttribute() {
    return table.colspanAttribute;
  }

  /**
   * Elements from the dialect namespace, or without a namespace, may be units. Elements of other
   * vocabularies (Dublin Core metadata, XHTML tables) never are.
   */
  public boolean isStructuralNamespace(String namespaceUri) {
    return namespaceUri == null
        || namespaceUri.isEmpty()
        || namespace == null
        || namespace.equals(namespaceUri);
  }

  public Optional<UnitKind> kindOf(String namespaceUri, String localName) {
    if (!isStructuralNamespace(namespaceUri)) return Optional.empty();
    return Optional.ofNullable(kindByElement.get(localName));
  }

  public boolean isSkipped(String localName) {
    return skipElements.contains(localName);
  }

  public boolean isBlock(String localName) {
    return blockElements.contains(localName);
  }

  public boolean isTable(String localName) {
    return table.elements.contains(localName);
  }

  public boolean isCell(String localName) {
    return table.cellElements.contains(localName);
  }

  public boolean isIgnoredInTable(String localName) {
    return table.ignoredElements.contains(localName);
  }

  /** Status named by a markup attribute value, if it is one this dialect recognizes. */
  public Optional<UnitStatus> statusFromAttribute(String value) {
    if (value == null || value.isBlank()) return Optional.empty();
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (Map.Entry<UnitStatus, List<String>> entry : valuesByStatus.entrySet()) {
      for (String keyword : entry.getValue()) {
        if (v.contains(keyword)) return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  /** Status signalled by a heading or text beginning with a marker phrase such as "[Repealed". */
  public Optional<UnitStatus> statusFromMarker(String text) {
    if (text == null) return Optional.empty();
    String v = text.trim().toLowerCase(Locale.ROOT);
    if (v.isEmpty()) return Optional.empty();
    for (Map.Entry<UnitStatus, List<String>> entry : markersByStatus.entrySet()) {
      for (String marker : entry.getValue()) {
        if (v.startsWith(marker)) return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  /**
   * Reduces a printed number such as {@code "§ 162."} or {@code "CHAPTER 1—"} to its designator
   * ({@code 162}, {@code 1}). Returns {@code null} when nothing remains.
   */
  public String cleanDesignator(String raw) {
    if (raw == null) return null;
    String v = raw.replace('\u00a0', ' ').trim();
    boolean changed = true;
    while (changed && !v.isEmpty()) {
      changed = false;
      for (String prefix : designatorPrefixes) {
        if (v.regionMatches(true, 0, prefix, 0, prefix.length())) {
          v = v.substring(prefix.length()).trim();
          changed = true;
        }
      }
      for (String trailer : designatorTrailers) {
        if (v.endsWith(trailer)) {
          v = v.substring(0, v.length() - trailer.length()).trim();
          changed = true;
        }
      }
    }
    return v.isEmpty() ? null : v;
  }
}
