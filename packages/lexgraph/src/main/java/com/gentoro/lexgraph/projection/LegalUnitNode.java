package com.gentoro.lexgraph.projection;

import com.gentoro.lexgraph.model.StructuralUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Graph node for one structural unit, keyed by its citation. The hierarchical identifier travels as
 * a property for path-based queries.
 */
public final class LegalUnitNode implements GraphNode {
  public static final String NODE_TYPE = "legal_unit";

  private final String id;
  private final String identifier;
  private final String kind;
  private final String designator;
  private final String heading;
  private final String text;
  private final String status;
  private final String hierarchicalPath;
  private final boolean container;
  private final boolean content;

  public LegalUnitNode(
      String id,
      String identifier,
      String kind,
      String designator,
      String heading,
      String text,
      String status,
      String hierarchicalPath,
      boolean container,
      boolean content) {
    this.id = Objects.requireNonNull(id, "id");
    this.identifier = identifier;
    this.kind = kind;
    this.designator = designator;
    this.heading = heading;
    this.text = text;
    this.status = status;
    this.hierarchicalPath = hierarchicalPath;
    this.container = container;
    this.content = content;
  }

  public static LegalUnitNode of(StructuralUnit unit) {
    return new LegalUnitNode(
        unit.getCitation(),
        unit.getIdentifier(),
        unit.getKind().key(),
        unit.getDesignator(),
        unit.getHeading(),
        unit.getText(),
        unit.getStatus().key(),
        unit.getHierarchicalPath(),
        unit.isContainer(),
        unit.isContent());
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public String getNodeType() {
    return NODE_TYPE;
  }

  public String getIdentifier() {
    return identifier;
  }

  public String getKind() {
    return kind;
  }

  public String getDesignator() {
    return designator;
  }

  public String getHeading() {
    return heading;
  }

  public String getText() {
    return text;
  }

  public String getStatus() {
    return status;
  }

  public String getHierarchicalPath() {
    return hierarchicalPath;
  }

  public boolean isContainer() {
    return container;
  }

  public boolean isContent() {
    return content;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", id);
    map.put("nodeType", getNodeType());
    map.put("identifier", identifier);
    map.put("kind", kind);
    map.put("designator", designator);
    map.put("heading", heading);
    map.put("text", text);
    map.put("status", status);
    map.put("hierarchical_path", hierarchicalPath);
    map.put("is_container", container);
    map.put("is_content", content);
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LegalUnitNode)) return false;
    return toMap().equals(((LegalUnitNode) o).toMap());
  }

  @Override
  public int hashCode() {
    return toMap().hashCode();
  }

  @Override
  public String toString() {
    return "LegalUnitNode{" + id + ", " + kind + ", " + status + "}";
  }
}
