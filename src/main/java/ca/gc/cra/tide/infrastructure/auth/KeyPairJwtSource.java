package ca.gc.cra.tide.infrastructure.auth;

import ca.gc.cra.tide.application.port.BearerTokenSource;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.config.AuthMode;
import ca.gc.cra.tide.domain.auth.AccessToken;
import ca.gc.cra.tide.domain.error.CredentialException;
import ca.gc.cra.tide.infrastructure.json.JsonSupport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues RS256 identity assertions signed with the configured RSA key.
 *
 * <p>The assertion names {@code {ACCOUNT}.{USER}} as subject and appends the public key fingerprint to the
 * issuer, which is how the warehouse picks the registered key. A cached assertion is reused until it comes
 * within {@link AccessToken#SAFETY_MARGIN} of expiry.</p>
 *
 * @since 0.1.0
 */
public final class KeyPairJwtSource implements BearerTokenSource {
  private static final Logger log = LoggerFactory.getLogger(KeyPairJwtSource.class);

  /** Lifetime declared in each assertion. */
  public static final Duration LIFETIME = Duration.ofSeconds(3600);

  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final String HEADER_JSON = "{\"alg\":\"RS256\",\"typ\":\"JWT\"}";

  private final KeyPair keyPair;
  private final String qualifiedUser;
  private final String fingerprint;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final JsonSupport json = new JsonSupport();

  private AccessToken cached;

  /**
   * Loads the key and prepares the claims.
   *
   * @param account account identifier
   * @param user principal name
   * @param keyFile PEM key file
   * @param passphrase passphrase for encrypted keys; may be {@code null}
   * @param clock time source for issued-at and expiry claims
   * @param metrics metrics sink
   * @return ready source
   * @throws CredentialException if the key cannot be loaded
   */
  public static KeyPairJwtSource fromKeyFile(
      String account, String user, Path keyFile, String passphrase, ClockPort clock, MetricsPort metrics)
      throws CredentialException {
    KeyPair keyPair = PrivateKeyLoader.load(keyFile, passphrase);
    log.info("Private key loaded from {}", keyFile);
    return new KeyPairJwtSource(account, user, keyPair, clock, metrics);
  }

  KeyPairJwtSource(String account, String user, KeyPair keyPair, ClockPort clock, MetricsPort metrics)
      throws CredentialException {
    this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
    this.qualifiedUser = account.toUpperCase(Locale.ROOT) + "." + user.toUpperCase(Locale.ROOT);
    this.fingerprint = fingerprint(keyPair.getPublic());
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Computes {@code SHA256:} + base64(SHA-256(DER public key)).
   *
   * @param publicKey RSA public key
   * @return fingerprint as registered with the warehouse user
   * @throws CredentialException if SHA-256 is unavailable
   */
  public static String fingerprint(PublicKey publicKey) throws CredentialException {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded());
      return "SHA256:" + Base64.getEncoder().encodeToString(digest);
    } catch (GeneralSecurityException ex) {
      throw new CredentialException("SHA-256 digest unavailable", ex);
    }
  }

  @Override
  public synchronized String bearerToken() throws CredentialException {
    long now = clock.nowMillis();
    if (cached == null || !cached.isUsableAt(now)) {
      cached = generate(now);
      metrics.increment("stream.jwt.generated");
      log.debug("JWT token generated for {}", qualifiedUser);
    }
    return cached.value();
  }

  @Override
  public String tokenType() {
    return AuthMode.KEY_PAIR.tokenType();
  }

  String issuer() {
    return qualifiedUser + "." + fingerprint;
  }

  String subject() {
    return qualifiedUser;
  }

  private AccessToken generate(long nowMillis) throws CredentialException {
    long issuedAt = nowMillis / 1000L;
    long expiry = issuedAt + LIFETIME.toSeconds();
    Map<String, Object> claims = new LinkedHashMap<>();
    claims.put("iss", issuer());
    claims.put("sub", subject());
    claims.put("iat", issuedAt);
    claims.put("exp", expiry);

    String signingInput = encode(HEADER_JSON) + "." + encode(json.write(claims));
    try {
      Signature signer = Signature.getInstance("SHA256withRSA");
      signer.initSign(keyPair.getPrivate());
      signer.update(signingInput.getBytes(StandardCharsets.US_ASCII));
      String token = signingInput + "." + URL_ENCODER.encodeToString(signer.sign());
      return new AccessToken(token, expiry * 1000L);
    } catch (GeneralSecurityException ex) {
      throw new CredentialException("Unable to sign JWT for " + qualifiedUser, ex);
    }
  }

  private static String encode(String json) {
    return URL_ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
