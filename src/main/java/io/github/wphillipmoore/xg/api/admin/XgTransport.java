package io.github.wphillipmoore.xg.api.admin;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for the XG management API.
 *
 * <p>The appliance takes the whole request document as one query parameter of an HTTP GET, so a
 * transport only has to fetch a URL. Implementations should throw {@link
 * io.github.wphillipmoore.xg.api.admin.exception.XgTransportException} for network, connection or
 * TLS failures.
 */
public interface XgTransport {

  /**
   * Sends an HTTP GET to the appliance.
   *
   * @param url fully-formed URL, including the encoded request document
   * @param timeout request timeout, or {@code null} for no timeout
   * @param verifyTls whether to verify TLS certificates
   * @return the transport response
   */
  TransportResponse get(String url, @Nullable Duration timeout, boolean verifyTls);
}
