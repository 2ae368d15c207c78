package ca.gc.cra.tide.api;

import ca.gc.cra.tide.application.port.BearerTokenSource;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.HttpTransport;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.application.stream.ChannelSession;
import ca.gc.cra.tide.config.StreamingConfig;
import ca.gc.cra.tide.domain.error.CredentialException;
import ca.gc.cra.tide.infrastructure.auth.CredentialProvider;
import ca.gc.cra.tide.infrastructure.discovery.EndpointResolver;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Wires credentials, host discovery and channel sessions for one connection configuration.
 */
final class StreamingComponents {
  private final StreamingConfig config;
  private final CredentialProvider credentials;
  private final HttpTransport transport;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private StreamingComponents(
      StreamingConfig config,
      CredentialProvider credentials,
      HttpTransport transport,
      ClockPort clock,
      MetricsPort metrics) {
    this.config = config;
    this.credentials = credentials;
    this.transport = transport;
    this.clock = clock;
    this.metrics = metrics;
  }

  /**
   * Builds the credential chain for {@code config}.
   *
   * @throws CredentialException when the signing key cannot be loaded
   */
  static StreamingComponents wire(
      StreamingConfig config, HttpTransport transport, ClockPort clock, MetricsPort metrics)
      throws CredentialException {
    BearerTokenSource identity = CredentialProvider.identityFor(config, clock, metrics);
    EndpointResolver resolver = new EndpointResolver(config.controlPlaneUri(), identity, transport, metrics);
    CredentialProvider credentials = new CredentialProvider(
        config.controlPlaneUri(), identity, resolver, transport, clock, metrics);
    return new StreamingComponents(config, credentials, transport, clock, metrics);
  }

  CredentialProvider credentials() {
    return credentials;
  }

  /** Creates an unopened session on a channel named after the current local time. */
  ChannelSession newSession() {
    LocalDateTime now = LocalDateTime.ofInstant(Instant.ofEpochMilli(clock.nowMillis()), ZoneId.systemDefault());
    String channel = ChannelSession.channelName(config.channelBaseName(), now);
    return new ChannelSession(config.target(), channel, credentials, transport, clock, metrics);
  }
}
