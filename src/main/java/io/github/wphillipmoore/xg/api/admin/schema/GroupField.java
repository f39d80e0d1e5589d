package io.github.wphillipmoore.xg.api.admin.schema;

import java.util.List;
import java.util.Objects;

/**
 * A fixed wrapper element around an ordered block of fields.
 *
 * @param tag the wrapper element name
 * @param fields the fields of the block, in wire order
 */
public record GroupField(String tag, List<FieldSpec> fields) implements FieldSpec {

  /** Validates the tag and copies the field list. */
  public GroupField {
    Objects.requireNonNull(tag, "tag");
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
  }

  @Override
  public FieldKind kind() {
    return FieldKind.GROUP;
  }
}
