package com.gentoro.lexgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed forest of structural units. All units are held in a single list in document order and
 * addressed through identifier and citation indexes; parent/child links are lookups into those
 * indexes. The tree is read-only once constructed and safe to share across threads.
 */
public final class UnitTree {
  private final String documentTitle;
  private final String citationPrefix;
  private final List<StructuralUnit> units;
  private final Map<String, StructuralUnit> byIdentifier;
  private final Map<String, StructuralUnit> byCitation;

  /**
   * @param documentTitle number of the first title the document carries, e.g. {@code 26}
   * @param citationPrefix citation of that title, e.g. {@code 26 USC}
   * @param units every unit in document order; identifiers and citations must be unique
   */
  public UnitTree(String documentTitle, String citationPrefix, List<StructuralUnit> units) {
    this.documentTitle = documentTitle;
    this.citationPrefix = citationPrefix;
    this.units = List.copyOf(units);
    Map<String, StructuralUnit> ids = new LinkedHashMap<>();
    Map<String, StructuralUnit> cites = new LinkedHashMap<>();
    for (StructuralUnit unit : this.units) {
      if (ids.put(unit.getIdentifier(), unit) != null) {
        throw new IllegalArgumentException("Duplicate identifier: " + unit.getIdentifier());
      }
      if (unit.getCitation() != null && cites.put(unit.getCitation(), unit) != null) {
        throw new IllegalArgumentException("Duplicate citation: " + unit.getCitation());
      }
    }
    this.byIdentifier = Collections.unmodifiableMap(ids);
    this.byCitation = Collections.unmodifiableMap(cites);
  }

  public String getDocumentTitle() {
    return documentTitle;
  }

  public String getCitationPrefix() {
    return citationPrefix;
  }

  /** All units, document order. */
  public List<StructuralUnit> units() {
    return units;
  }

  public List<StructuralUnit> roots() {
    List<StructuralUnit> roots = new ArrayList<>();
    for (StructuralUnit unit : units) {
      if (unit.isRoot()) roots.add(unit);
    }
    return roots;
  }

  public Optional<StructuralUnit> byIdentifier(String identifier) {
    return Optional.ofNullable(byIdentifier.get(identifier));
  }

  public Optional<StructuralUnit> byCitation(String citation) {
    return Optional.ofNullable(byCitation.get(citation));
  }

  /** Read-only citation index used for reference resolution. */
  public Map<String, StructuralUnit> citationIndex() {
    return byCitation;
  }

  public List<StructuralUnit> children(StructuralUnit unit) {
    List<StructuralUnit> out = new ArrayList<>(unit.getChildIdentifiers().size());
    for (String id : unit.getChildIdentifiers()) {
      out.add(byIdentifier.get(id));
    }
    return out;
  }

  public Optional<StructuralUnit> parent(StructuralUnit unit) {
    if (unit.getParentIdentifier() == null) return Optional.empty();
    return Optional.ofNullable(byIdentifier.get(unit.getParentIdentifier()));
  }

  /** Ancestors from the root down to the direct parent. */
  public List<StructuralUnit> ancestors(StructuralUnit unit) {
    List<StructuralUnit> chain = new ArrayList<>();
    Optional<StructuralUnit> current = parent(unit);
    while (current.isPresent()) {
      chain.add(current.get());
      current = parent(current.get());
    }
    Collections.reverse(chain);
    return chain;
  }

  public List<StructuralUnit> sections() {
    List<StructuralUnit> out = new ArrayList<>();
    for (StructuralUnit unit : units) {
      if (unit.getKind() == UnitKind.SECTION) out.add(unit);
    }
    return out;
  }

  /** The title enclosing {@code unit}, or the unit itself when it is a title. */
  public StructuralUnit titleOf(StructuralUnit unit) {
    StructuralUnit current = unit;
    Optional<StructuralUnit> up = parent(current);
    while (up.isPresent()) {
      current = up.get();
      up = parent(current);
    }
    return current;
  }

  /**
   * Looks a section up by its number, e.g. {@code "162"}. In a document holding several titles the
   * first title in document order that has such a section wins.
   */
  public Optional<StructuralUnit> findSection(String number) {
    if (number == null || number.isBlank()) return Optional.empty();
    for (StructuralUnit title : roots()) {
      Optional<StructuralUnit> section =
          byCitation(title.getCitation() + " " + number.trim())
              .filter(u -> u.getKind() == UnitKind.SECTION);
      if (section.isPresent()) return section;
    }
    return Optional.empty();
  }

  public int totalUnits() {
    return units.size();
  }

  public int totalSections() {
    return sections().size();
  }

  public int repealedSections() {
    int count = 0;
    for (StructuralUnit unit : units) {
      if (unit.getKind() == UnitKind.SECTION && unit.getStatus() == UnitStatus.REPEALED) count++;
    }
    return count;
  }

  public Map<UnitKind, Integer> countsByKind() {
    Map<UnitKind, Integer> counts = new EnumMap<>(UnitKind.class);
    for (StructuralUnit unit : units) {
      counts.merge(unit.getKind(), 1, Integer::sum);
    }
    return counts;
  }

  public Map<UnitStatus, Integer> countsByStatus() {
    Map<UnitStatus, Integer> counts = new EnumMap<>(UnitStatus.class);
    for (StructuralUnit unit : units) {
      counts.merge(unit.getStatus(), 1, Integer::sum);
    }
    return counts;
  }
}
