package ca.gc.cra.tide.domain.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * Short-lived credential together with the instant the issuer declared it expires.
 *
 * <p>A token is considered usable only until {@link #SAFETY_MARGIN} before its declared expiry, so a
 * request started with it cannot race the issuer's cut-off.</p>
 *
 * @param value opaque token text; never blank
 * @param expiresAtMillis declared expiry in epoch milliseconds
 * @since 0.1.0
 */
public record AccessToken(String value, long expiresAtMillis) {
  /** Margin subtracted from the declared expiry before a token is refreshed. */
  public static final Duration SAFETY_MARGIN = Duration.ofSeconds(60);

  public AccessToken {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("token value must not be blank");
    }
  }

  /**
   * Builds a token expiring {@code lifetime} after {@code issuedAtMillis}.
   *
   * @param value token text
   * @param issuedAtMillis issue instant in epoch milliseconds
   * @param lifetime declared lifetime
   * @return new token
   */
  public static AccessToken issued(String value, long issuedAtMillis, Duration lifetime) {
    return new AccessToken(value, issuedAtMillis + lifetime.toMillis());
  }

  /**
   * Reports whether the token may still be handed to a caller.
   *
   * @param nowMillis current epoch milliseconds
   * @return {@code true} while {@code now < expiry - SAFETY_MARGIN}
   */
  public boolean isUsableAt(long nowMillis) {
    return nowMillis < expiresAtMillis - SAFETY_MARGIN.toMillis();
  }

  @Override
  public String toString() {
    return "AccessToken[expiresAtMillis=" + expiresAtMillis + "]";
  }
}
