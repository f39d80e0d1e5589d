package io.github.wphillipmoore.xg.api.admin.schema;

/**
 * Declarative description of one entity field.
 *
 * <p>Field specifications are immutable and shared by every request for their entity type. The
 * {@link FieldSerializer} dispatches on the concrete type.
 */
public sealed interface FieldSpec
    permits ScalarField, RepeatedListField, NestedGroupField, GroupField, ConditionalGroupField {

  /** Returns the shape of this field. */
  FieldKind kind();
}
