package io.github.wphillipmoore.xg.api.admin.exception;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the appliance returns a malformed or unexpected response.
 *
 * <p>The {@code responseText} may be {@code null} if the response body was not available.
 */
public final class XgResponseException extends XgException {

  private static final long serialVersionUID = 1L;

  private final @Nullable String responseText;

  /**
   * Creates a response exception.
   *
   * @param message description of the failure
   * @param responseText the raw response text, or {@code null} if unavailable
   */
  public XgResponseException(String message, @Nullable String responseText) {
    super(message);
    this.responseText = responseText;
  }

  /**
   * Creates a response exception with a cause.
   *
   * @param message description of the failure
   * @param responseText the raw response text, or {@code null} if unavailable
   * @param cause the underlying cause
   */
  public XgResponseException(String message, @Nullable String responseText, Throwable cause) {
    super(message, cause);
    this.responseText = responseText;
  }

  /**
   * Returns the raw response text, or {@code null} if the response body was not available.
   *
   * @return the response text, or {@code null}
   */
  public @Nullable String getResponseText() {
    return responseText;
  }
}
