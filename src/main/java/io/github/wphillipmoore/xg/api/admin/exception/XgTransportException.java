package io.github.wphillipmoore.xg.api.admin.exception;

import java.util.Objects;

/**
 * Thrown when a network, connection or TLS failure occurs communicating with the appliance.
 *
 * <p>The {@code url} is the API endpoint without the request document, which would otherwise
 * expose the credentials it embeds.
 */
public final class XgTransportException extends XgException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param url the endpoint that was being accessed
   */
  public XgTransportException(String message, String url) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param url the endpoint that was being accessed
   * @param cause the underlying cause
   */
  public XgTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the endpoint that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}
