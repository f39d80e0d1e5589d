package io.github.wphillipmoore.xg.api.admin.response;

import java.util.Objects;

/**
 * Outcome of a successful Set or Remove request, as reported by the appliance.
 *
 * @param code the status code (e.g. "200"), never null
 * @param message the status message, never null
 */
public record OperationResult(String code, String message) {

  /** Validates that code and message are non-null. */
  public OperationResult {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
  }

  /** Returns {@code "<code> <message>"}, e.g. {@code "200 Configuration applied successfully."}. */
  @Override
  public String toString() {
    return code + " " + message;
  }
}
