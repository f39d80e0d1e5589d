package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.List;
import java.util.Objects;

/**
 * Field layout of one appliance entity type.
 *
 * @param entityType the entity element name (e.g. "IPHost")
 * @param deleteKey the element that identifies an object in a Remove request ("Name" or
 *     "Hardware")
 * @param fields the entity's fields, in wire order
 */
public record EntitySchema(String entityType, String deleteKey, List<FieldSpec> fields) {

  /** Validates names and copies the field list. */
  public EntitySchema {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(deleteKey, "deleteKey");
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
  }
}
