package io.github.wphillipmoore.xg.api.admin.exception;

import java.util.Objects;

/**
 * Thrown when the appliance rejects the credentials embedded in a request.
 *
 * <p>The {@code status} is the appliance's literal {@code Login/status} text, for example {@code
 * "Authentication Failure"}.
 */
public final class XgAuthException extends XgException {

  private static final long serialVersionUID = 1L;

  private final String status;

  /**
   * Creates an auth exception.
   *
   * @param status the login status text reported by the appliance
   */
  public XgAuthException(String status) {
    super(Objects.requireNonNull(status, "status"));
    this.status = status;
  }

  /** Returns the login status text reported by the appliance. */
  public String getStatus() {
    return status;
  }
}
