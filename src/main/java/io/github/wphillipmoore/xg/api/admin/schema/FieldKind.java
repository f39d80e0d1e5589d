package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.Locale;

/** Shape of one entity field, as named in the entity catalog resource. */
public enum FieldKind {

  /** A single element with text content. */
  SCALAR("scalar"),

  /** A wrapper element holding one item element per list entry. */
  REPEATED_LIST("repeatedList"),

  /** A wrapper element holding one entry element, with a key and a value child, per map pair. */
  NESTED_GROUP("nestedGroup"),

  /** A fixed wrapper element around an ordered block of fields. */
  GROUP("group"),

  /** A set of alternative field blocks, of which at most one is emitted. */
  CONDITIONAL_GROUP("conditionalGroup");

  private final String catalogName;

  FieldKind(String catalogName) {
    this.catalogName = catalogName;
  }

  /** Returns the name used for this kind in the entity catalog. */
  public String catalogName() {
    return catalogName;
  }

  /**
   * Looks up a kind by its catalog name, ignoring case.
   *
   * @param name the catalog name (e.g. "repeatedList")
   * @return the matching kind
   * @throws IllegalArgumentException if no kind has that name
   */
  public static FieldKind fromCatalogName(String name) {
    for (FieldKind kind : values()) {
      if (kind.catalogName.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown field kind: " + name);
  }
}
