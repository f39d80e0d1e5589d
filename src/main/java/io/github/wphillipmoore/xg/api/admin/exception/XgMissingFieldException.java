package io.github.wphillipmoore.xg.api.admin.exception;

import java.util.Objects;

/**
 * Thrown when a required entity field has neither a caller-supplied value nor a default.
 *
 * <p>Raised while the request document is being built, so nothing is sent to the appliance.
 */
public final class XgMissingFieldException extends XgException {

  private static final long serialVersionUID = 1L;

  private final String entityType;
  private final String fieldName;

  /**
   * Creates a missing field exception.
   *
   * @param entityType the entity type tag being serialized (e.g. "IPHost")
   * @param fieldName the caller-facing name of the missing field
   */
  public XgMissingFieldException(String entityType, String fieldName) {
    super(
        "Missing required field '"
            + Objects.requireNonNull(fieldName, "fieldName")
            + "' for entity type "
            + Objects.requireNonNull(entityType, "entityType"));
    this.entityType = entityType;
    this.fieldName = fieldName;
  }

  /** Returns the entity type tag being serialized. */
  public String getEntityType() {
    return entityType;
  }

  /** Returns the caller-facing name of the missing field. */
  public String getFieldName() {
    return fieldName;
  }
}
