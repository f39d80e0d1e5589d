package io.github.wphillipmoore.xg.api.admin;

import java.util.Objects;

/**
 * What the appliance sent back for one API call.
 *
 * <p>The appliance answers with HTTP 200 for rejected operations too; the outcome is carried in the
 * XML body, which {@link XgSession} interprets. The status code is kept for diagnosing replies
 * that are not API documents at all, such as a proxy error page.
 *
 * @param statusCode the HTTP status code
 * @param body the XML response text, empty when the appliance sent no body
 */
public record TransportResponse(int statusCode, String body) {

  /** Rejects a null body. */
  public TransportResponse {
    Objects.requireNonNull(body, "body");
  }
}
