package io.github.wphillipmoore.xg.api.admin.exception;

import java.util.Objects;

/**
 * Thrown when the appliance authenticated the request but rejected the Set or Remove operation.
 *
 * <p>The {@code code} and {@code statusMessage} are the appliance's own {@code Status} values,
 * unaltered. Callers key off the code (e.g. {@code "502"} for a duplicate name) to decide on
 * remediation.
 */
public final class XgOperationException extends XgException {

  private static final long serialVersionUID = 1L;

  private final String operation;
  private final String entityType;
  private final String code;
  private final String statusMessage;

  /**
   * Creates an operation exception.
   *
   * @param operation the wire name of the operation (e.g. "Set")
   * @param entityType the entity type tag (e.g. "IPHost")
   * @param code the status code reported by the appliance
   * @param statusMessage the status message reported by the appliance
   */
  public XgOperationException(
      String operation, String entityType, String code, String statusMessage) {
    super(
        Objects.requireNonNull(code, "code")
            + " "
            + Objects.requireNonNull(statusMessage, "statusMessage"));
    this.operation = Objects.requireNonNull(operation, "operation");
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.code = code;
    this.statusMessage = statusMessage;
  }

  /** Returns the wire name of the operation that failed. */
  public String getOperation() {
    return operation;
  }

  /** Returns the entity type tag of the failed operation. */
  public String getEntityType() {
    return entityType;
  }

  /** Returns the status code reported by the appliance. */
  public String getCode() {
    return code;
  }

  /** Returns the status message reported by the appliance. */
  public String getStatusMessage() {
    return statusMessage;
  }
}
