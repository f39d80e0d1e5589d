package io.github.wphillipmoore.xg.api.admin.exception;

/**
 * Base exception for all XG management API errors.
 *
 * <p>This is an unchecked exception hierarchy. All XG API errors extend this sealed class.
 */
public sealed class XgException extends RuntimeException
    permits XgMissingFieldException,
        XgAuthException,
        XgOperationException,
        XgTransportException,
        XgResponseException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public XgException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public XgException(String message, Throwable cause) {
    super(message, cause);
  }
}
