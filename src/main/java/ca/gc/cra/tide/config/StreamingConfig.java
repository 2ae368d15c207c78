package ca.gc.cra.tide.config;

import ca.gc.cra.tide.domain.stream.PipeTarget;
import ca.gc.cra.tide.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable connection settings for one streaming client.
 * <p><strong>Why:</strong> Centralizes account, target pipe, and credential choices so that every component
 * sees the same validated view.</p>
 * <p><strong>Invariant:</strong> exactly one authentication mode is configured, either a private key file or a
 * programmatic access token.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 * @see StreamingConfigLoader
 */
public final class StreamingConfig {
  /** Base channel name used when the configuration does not name one. */
  public static final String DEFAULT_CHANNEL_NAME = "SENSEHAT_CHNL";

  private final String account;
  private final String user;
  private final PipeTarget target;
  private final URI controlPlaneUri;
  private final String channelBaseName;
  private final AuthMode authMode;
  private final Path privateKeyFile;
  private final String privateKeyPassphrase;
  private final String patToken;

  private StreamingConfig(
      String account,
      String user,
      PipeTarget target,
      URI controlPlaneUri,
      String channelBaseName,
      AuthMode authMode,
      Path privateKeyFile,
      String privateKeyPassphrase,
      String patToken) {
    this.account = account;
    this.user = user;
    this.target = target;
    this.controlPlaneUri = controlPlaneUri;
    this.channelBaseName = channelBaseName;
    this.authMode = authMode;
    this.privateKeyFile = privateKeyFile;
    this.privateKeyPassphrase = privateKeyPassphrase;
    this.patToken = patToken;
  }

  /**
   * Builds a configuration from the flat key/value view of the JSON file.
   *
   * @param values configuration members; values are converted with {@link Object#toString()}
   * @return validated configuration
   * @throws ConfigurationException if a required member is missing, authentication is absent or
   *     ambiguous, or the key file does not exist
   */
  public static StreamingConfig fromMap(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    try {
      String account = required(values, "account");
      String user = required(values, "user");
      PipeTarget target = new PipeTarget(
          required(values, "database"), required(values, "schema"), required(values, "pipe"));
      URI control = optional(values, "url")
          .map(StreamingConfig::parseControlUri)
          .orElseGet(() -> defaultControlUri(account));
      String channel = optional(values, "channel_name")
          .map(name -> Strings.requireIdentifier("channel_name", name))
          .orElse(DEFAULT_CHANNEL_NAME);

      Optional<String> keyFile = optional(values, "private_key_file");
      Optional<String> pat = optional(values, "pat_token");
      if (keyFile.isEmpty() && pat.isEmpty()) {
        throw new ConfigurationException("Either private_key_file or pat_token must be provided");
      }
      if (keyFile.isPresent() && pat.isPresent()) {
        throw new ConfigurationException("Configure only one of private_key_file or pat_token");
      }
      if (pat.isPresent()) {
        return new StreamingConfig(account, user, target, control, channel,
            AuthMode.PROGRAMMATIC_ACCESS_TOKEN, null, null, pat.get());
      }
      Path key = resolveKeyFile(keyFile.get());
      String passphrase = optional(values, "private_key_passphrase").orElse(null);
      return new StreamingConfig(account, user, target, control, channel,
          AuthMode.KEY_PAIR, key, passphrase, null);
    } catch (ConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new ConfigurationException("Invalid streaming configuration: " + ex.getMessage(), ex);
    }
  }

  public String account() {
    return account;
  }

  public String user() {
    return user;
  }

  public PipeTarget target() {
    return target;
  }

  /**
   * Control-plane base URI, {@code https://{account}.snowflakecomputing.com} unless {@code url} is set.
   *
   * @return base URI without trailing slash
   */
  public URI controlPlaneUri() {
    return controlPlaneUri;
  }

  public String channelBaseName() {
    return channelBaseName;
  }

  public AuthMode authMode() {
    return authMode;
  }

  public Optional<Path> privateKeyFile() {
    return Optional.ofNullable(privateKeyFile);
  }

  public Optional<String> privateKeyPassphrase() {
    return Optional.ofNullable(privateKeyPassphrase);
  }

  public Optional<String> patToken() {
    return Optional.ofNullable(patToken);
  }

  @Override
  public String toString() {
    return "StreamingConfig{account=" + account
        + ", user=" + user
        + ", target=" + target.qualifiedName()
        + ", controlPlane=" + controlPlaneUri
        + ", channel=" + channelBaseName
        + ", auth=" + authMode + '}';
  }

  private static String required(Map<String, ?> values, String key) {
    return optional(values, key)
        .orElseThrow(() -> new ConfigurationException("Missing required configuration field: " + key));
  }

  private static Optional<String> optional(Map<String, ?> values, String key) {
    Object raw = values.get(key);
    return Optional.ofNullable(raw == null ? null : Strings.trimToNull(raw.toString()));
  }

  private static URI defaultControlUri(String account) {
    return parseControlUri("https://" + account.toLowerCase(Locale.ROOT) + ".snowflakecomputing.com");
  }

  private static URI parseControlUri(String raw) {
    String trimmed = raw.endsWith("/") ? raw.substring(0, raw.length() - 1) : raw;
    try {
      URI uri = new URI(trimmed);
      String scheme = uri.getScheme();
      if (scheme == null
          || (!scheme.equalsIgnoreCase("https") && !scheme.equalsIgnoreCase("http"))) {
        throw new ConfigurationException("url must use http or https scheme: " + raw);
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new ConfigurationException("url must include a host: " + raw);
      }
      if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
        throw new ConfigurationException("url must not carry a query or fragment: " + raw);
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new ConfigurationException("url must be a valid URI: " + raw, ex);
    }
  }

  private static Path resolveKeyFile(String raw) {
    Path path;
    try {
      path = Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new ConfigurationException("private_key_file is not a valid path: " + raw, ex);
    }
    if (!Files.isRegularFile(path)) {
      throw new ConfigurationException("Private key file not found: " + raw);
    }
    return path.toAbsolutePath().normalize();
  }
}
