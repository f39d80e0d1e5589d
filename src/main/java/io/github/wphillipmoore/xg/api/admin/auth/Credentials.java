package io.github.wphillipmoore.xg.api.admin.auth;

import java.util.Objects;

/**
 * API administrator credentials for the XG management API.
 *
 * <p>Embedded verbatim into the {@code Login} block of every request. The record's {@code
 * toString()} masks the password so credentials can be passed to diagnostics safely.
 *
 * @param username the username of an administrator with an API profile, never null
 * @param password the password, never null
 */
public record Credentials(String username, String password) {

  /** Validates that username and password are non-null. */
  public Credentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  @Override
  public String toString() {
    return "Credentials[username=" + username + ", password=****]";
  }
}
