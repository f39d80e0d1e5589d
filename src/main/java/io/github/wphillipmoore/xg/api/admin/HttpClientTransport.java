package io.github.wphillipmoore.xg.api.admin;

import io.github.wphillipmoore.xg.api.admin.exception.XgTransportException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based implementation of {@link XgTransport}.
 *
 * <p>Appliances usually present a self-signed certificate, so a second client that trusts every
 * certificate is created on first use with {@code verifyTls=false}.
 */
public final class HttpClientTransport implements XgTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientTransport.class);

  private final HttpClient client;
  private @Nullable HttpClient nonVerifyingClient;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newHttpClient();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. one that trusts the appliance CA.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.client = HttpClient.newBuilder().sslContext(sslContext).build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public TransportResponse get(String url, @Nullable Duration timeout, boolean verifyTls) {
    HttpClient activeClient = verifyTls ? client : getNonVerifyingClient();

    HttpResponse<String> response;
    try {
      HttpRequest.Builder requestBuilder =
          HttpRequest.newBuilder().uri(URI.create(url)).header("Accept", "application/xml").GET();
      if (timeout != null) {
        requestBuilder.timeout(timeout);
      }
      response =
          activeClient.send(
              requestBuilder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      // The JDK message quotes the whole URL, request document included.
      throw new XgTransportException("Invalid request URL", redact(url));
    } catch (IOException e) {
      throw new XgTransportException("HTTP request failed", redact(url), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new XgTransportException("HTTP request interrupted", redact(url), e);
    }

    String body = response.body() != null ? response.body() : "";
    return new TransportResponse(response.statusCode(), body);
  }

  private synchronized HttpClient getNonVerifyingClient() {
    if (nonVerifyingClient == null) {
      LOGGER.warn("TLS certificate verification is disabled for appliance requests");
      SSLContext sslContext = createSslContext("TLS");
      nonVerifyingClient = HttpClient.newBuilder().sslContext(sslContext).build();
    }
    return nonVerifyingClient;
  }

  /**
   * Strips the query from a URL. The query holds the request document and its credentials.
   *
   * @param url the request URL
   * @return the URL up to, not including, the {@code '?'}
   */
  static String redact(String url) {
    int queryStart = url.indexOf('?');
    return queryStart < 0 ? url : url.substring(0, queryStart);
  }

  /**
   * Creates an {@link SSLContext} with a trust-all manager.
   *
   * @param protocol the SSL protocol name (e.g. "TLS")
   * @return an initialized SSLContext that trusts all certificates
   * @throws IllegalStateException if the protocol is not available
   */
  static SSLContext createSslContext(String protocol) {
    try {
      SSLContext sslContext = SSLContext.getInstance(protocol);
      sslContext.init(null, new TrustManager[] {new TrustAllManager()}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to create SSLContext", e);
    }
  }

  /**
   * An {@link X509TrustManager} that accepts all certificates. Used when TLS verification is
   * disabled.
   */
  static final class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // Accept all client certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // Accept all server certificates
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
