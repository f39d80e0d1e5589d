package io.github.wphillipmoore.xg.api.admin.command;

/** The kind of request sent to the appliance, with its wire element name. */
public enum Operation {

  /** Read entities ({@code <Get>}). */
  QUERY("Get"),

  /** Create or update an entity ({@code <Set>}). */
  MUTATE("Set"),

  /** Remove an entity ({@code <Remove>}). */
  DELETE("Remove");

  private final String wireName;

  Operation(String wireName) {
    this.wireName = wireName;
  }

  /** Returns the element name used for this operation in request documents. */
  public String wireName() {
    return wireName;
  }

  /** Returns whether the appliance reports a per-entity status code for this operation. */
  public boolean reportsStatus() {
    return this != QUERY;
  }
}
