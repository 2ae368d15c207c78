package ca.gc.cra.tide.infrastructure.discovery;

import ca.gc.cra.tide.application.port.BearerTokenSource;
import ca.gc.cra.tide.application.port.HttpTransport;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.domain.error.CredentialException;
import ca.gc.cra.tide.domain.error.ResolutionException;
import ca.gc.cra.tide.infrastructure.json.JsonSupport;
import ca.gc.cra.tide.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Discovers the per-account data-plane host from the control plane.
 * <p><strong>Why:</strong> Channel and row endpoints live on a regional ingest host that differs from the
 * account URL and must be looked up once per process.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the first successful lookup is cached for the lifetime of
 * the instance.</p>
 *
 * @since 0.1.0
 */
public final class EndpointResolver {
  private static final Logger log = LoggerFactory.getLogger(EndpointResolver.class);

  static final String HOSTNAME_PATH = "/v2/streaming/hostname";
  private static final Pattern HOST_PATTERN = Pattern.compile(
      "^[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?)*(?::\\d{1,5})?$");

  private final URI controlPlane;
  private final BearerTokenSource identity;
  private final HttpTransport transport;
  private final MetricsPort metrics;
  private final JsonSupport json = new JsonSupport();

  private volatile String cachedHost;

  /**
   * Creates a resolver.
   *
   * @param controlPlane control-plane base URL, e.g. {@code https://acct.snowflakecomputing.com}
   * @param identity source of the control-plane bearer token
   * @param transport HTTP transport
   * @param metrics metrics sink; records {@code stream.host.resolved}
   */
  public EndpointResolver(
      URI controlPlane, BearerTokenSource identity, HttpTransport transport, MetricsPort metrics) {
    this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the ingest host, querying the control plane only on the first call.
   *
   * @return DNS-safe host name without scheme
   * @throws ResolutionException when the lookup fails or the response carries no valid host name; nothing
   *     is cached in that case
   * @throws InterruptedException when interrupted while waiting on the network
   */
  public String resolveIngestHost() throws ResolutionException, InterruptedException {
    String host = cachedHost;
    if (host != null) {
      return host;
    }
    synchronized (this) {
      if (cachedHost == null) {
        cachedHost = lookup();
      }
      return cachedHost;
    }
  }

  private String lookup() throws ResolutionException, InterruptedException {
    String token;
    try {
      token = identity.bearerToken();
    } catch (CredentialException ex) {
      throw new ResolutionException("Unable to authenticate host discovery", ex);
    }
    URI uri = HttpTransport.endpoint(controlPlane, HOSTNAME_PATH);
    HttpTransport.Request request = HttpTransport.Request.builder("GET", uri)
        .header("Authorization", "Bearer " + token)
        .header(BearerTokenSource.TOKEN_TYPE_HEADER, identity.tokenType())
        .header("Accept", "application/json")
        .build();

    HttpTransport.Response response;
    try {
      response = transport.send(request);
    } catch (IOException ex) {
      throw new ResolutionException("Host discovery request to " + uri + " failed", ex);
    }
    if (!response.isSuccess()) {
      throw new ResolutionException("Host discovery failed (HTTP " + response.status() + "): "
          + Logs.body(response.body()));
    }

    String raw = extractHost(response).orElseThrow(() -> new ResolutionException(
        "Host discovery returned no hostname: " + Logs.body(response.body())));
    String host = normalize(raw);
    if (!HOST_PATTERN.matcher(host).matches()) {
      throw new ResolutionException("Host discovery returned an invalid hostname: " + Logs.body(host));
    }
    metrics.increment("stream.host.resolved");
    log.info("Ingest host resolved: {}", host);
    return host;
  }

  private Optional<String> extractHost(HttpTransport.Response response) throws ResolutionException {
    String body = response.body().trim();
    boolean jsonType = response.header("Content-Type")
        .map(type -> type.toLowerCase(Locale.ROOT).contains("json"))
        .orElse(false);
    if (jsonType || body.startsWith("{")) {
      Map<String, Object> object;
      try {
        object = json.parseObject(body);
      } catch (IllegalArgumentException ex) {
        throw new ResolutionException("Host discovery returned malformed JSON: " + Logs.body(body), ex);
      }
      Optional<String> host = JsonSupport.string(object, "hostname");
      return host.isPresent() ? host : JsonSupport.string(object, "ingest_host");
    }
    String text = stripQuotes(body);
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /**
   * Makes a host name DNS-safe by replacing underscores with hyphens.
   *
   * @param host raw host name
   * @return normalized host name
   */
  public static String normalize(String host) {
    return host.trim().replace('_', '-');
  }

  private static String stripQuotes(String text) {
    if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
      return text.substring(1, text.length() - 1).trim();
    }
    return text;
  }
}
