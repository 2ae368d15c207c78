package ca.gc.cra.tide.infrastructure.auth;

import ca.gc.cra.tide.application.port.BearerTokenSource;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.HttpTransport;
import ca.gc.cra.tide.application.port.IngestCredentials;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.config.AuthMode;
import ca.gc.cra.tide.config.StreamingConfig;
import ca.gc.cra.tide.domain.auth.AccessToken;
import ca.gc.cra.tide.domain.error.CredentialException;
import ca.gc.cra.tide.domain.error.ResolutionException;
import ca.gc.cra.tide.infrastructure.discovery.EndpointResolver;
import ca.gc.cra.tide.infrastructure.json.JsonSupport;
import ca.gc.cra.tide.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Supplies control-plane bearer tokens and data-plane scoped tokens.
 * <p><strong>Why:</strong> Row and channel calls require a short-lived token bound to the ingest host; it is
 * exchanged from the identity assertion and refreshed transparently before it expires.</p>
 * <p><strong>Role:</strong> Implements {@link IngestCredentials} for the channel session and
 * {@link BearerTokenSource} for callers that talk to the control plane directly.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; at most one exchange runs at a time.</p>
 *
 * @since 0.1.0
 */
public final class CredentialProvider implements IngestCredentials, BearerTokenSource {
  private static final Logger log = LoggerFactory.getLogger(CredentialProvider.class);

  static final String TOKEN_PATH = "/oauth/token";
  static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";
  /** Lifetime assumed when the exchange response omits {@code expires_in}. */
  public static final Duration DEFAULT_SCOPED_LIFETIME = Duration.ofSeconds(3600);
  /** Longest {@code expires_in} accepted from the exchange. */
  public static final Duration MAX_SCOPED_LIFETIME = Duration.ofHours(24);

  private final URI controlPlane;
  private final BearerTokenSource identity;
  private final EndpointResolver resolver;
  private final HttpTransport transport;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final JsonSupport json = new JsonSupport();

  private AccessToken scoped;

  /**
   * Creates a provider.
   *
   * @param controlPlane control-plane base URL
   * @param identity identity token source (JWT or static token)
   * @param resolver ingest host resolver
   * @param transport HTTP transport
   * @param clock time source for expiry tracking
   * @param metrics metrics sink; records {@code stream.token.exchange}
   */
  public CredentialProvider(
      URI controlPlane,
      BearerTokenSource identity,
      EndpointResolver resolver,
      HttpTransport transport,
      ClockPort clock,
      MetricsPort metrics) {
    this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the identity token source for the configured authentication mode.
   *
   * @param config connection configuration
   * @param clock time source
   * @param metrics metrics sink
   * @return key-pair JWT source or static token source
   * @throws CredentialException when the signing key cannot be loaded
   */
  public static BearerTokenSource identityFor(StreamingConfig config, ClockPort clock, MetricsPort metrics)
      throws CredentialException {
    if (config.authMode() == AuthMode.KEY_PAIR) {
      return KeyPairJwtSource.fromKeyFile(
          config.account(),
          config.user(),
          config.privateKeyFile().orElseThrow(),
          config.privateKeyPassphrase().orElse(null),
          clock,
          metrics);
    }
    log.info("Using programmatic access token authentication");
    return new StaticTokenSource(config.patToken().orElseThrow());
  }

  @Override
  public String bearerToken() throws CredentialException {
    return identity.bearerToken();
  }

  @Override
  public String tokenType() {
    return identity.tokenType();
  }

  @Override
  public String ingestHost() throws ResolutionException, InterruptedException {
    return resolver.resolveIngestHost();
  }

  @Override
  public synchronized String scopedToken()
      throws CredentialException, ResolutionException, InterruptedException {
    if (scoped != null && scoped.isUsableAt(clock.nowMillis())) {
      return scoped.value();
    }
    String host = resolver.resolveIngestHost();
    scoped = exchange(host);
    return scoped.value();
  }

  private AccessToken exchange(String host) throws CredentialException, InterruptedException {
    URI uri = HttpTransport.endpoint(controlPlane, TOKEN_PATH);
    String form = "grant_type=" + URLEncoder.encode(GRANT_TYPE, StandardCharsets.UTF_8)
        + "&scope=" + URLEncoder.encode(host, StandardCharsets.UTF_8);
    HttpTransport.Request request = HttpTransport.Request.builder("POST", uri)
        .header("Authorization", "Bearer " + identity.bearerToken())
        .header(TOKEN_TYPE_HEADER, identity.tokenType())
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .body(form)
        .build();

    long requestedAt = clock.nowMillis();
    HttpTransport.Response response;
    try {
      response = transport.send(request);
    } catch (IOException ex) {
      throw new CredentialException("Token exchange request to " + uri + " failed", ex);
    }
    if (!response.isSuccess()) {
      throw new CredentialException("Token exchange failed (HTTP " + response.status() + "): "
          + Logs.body(response.body()));
    }

    String value;
    long lifetimeSeconds;
    try {
      Map<String, Object> body = json.parseObject(response.body());
      value = JsonSupport.string(body, "access_token").orElseThrow(() -> new CredentialException(
          "Token exchange response has no access_token"));
      lifetimeSeconds = JsonSupport.longValue(body, "expires_in")
          .orElse(DEFAULT_SCOPED_LIFETIME.toSeconds());
    } catch (IllegalArgumentException ex) {
      throw new CredentialException("Token exchange returned malformed JSON: " + Logs.body(response.body()), ex);
    }
    if (lifetimeSeconds <= AccessToken.SAFETY_MARGIN.toSeconds()
        || lifetimeSeconds > MAX_SCOPED_LIFETIME.toSeconds()) {
      throw new CredentialException("Token exchange returned unusable expires_in " + lifetimeSeconds
          + "; expected (" + AccessToken.SAFETY_MARGIN.toSeconds() + ", "
          + MAX_SCOPED_LIFETIME.toSeconds() + "] seconds");
    }

    metrics.increment("stream.token.exchange");
    AccessToken token = AccessToken.issued(value, requestedAt, Duration.ofSeconds(lifetimeSeconds));
    log.info("Scoped token obtained for {} (expires in {}s)", host, lifetimeSeconds);
    log.debug("Scoped token {} cached until {}", Logs.redact(value), token.expiresAtMillis());
    return token;
  }
}
