package ca.gc.cra.tide.infrastructure.auth;

import ca.gc.cra.tide.application.port.BearerTokenSource;
import ca.gc.cra.tide.config.AuthMode;
import ca.gc.cra.tide.validation.Strings;

/**
 * Returns an externally managed programmatic access token unchanged.
 *
 * @since 0.1.0
 */
public final class StaticTokenSource implements BearerTokenSource {
  private final String token;

  public StaticTokenSource(String token) {
    this.token = Strings.requireNonBlank("pat_token", token);
  }

  @Override
  public String bearerToken() {
    return token;
  }

  @Override
  public String tokenType() {
    return AuthMode.PROGRAMMATIC_ACCESS_TOKEN.tokenType();
  }
}
