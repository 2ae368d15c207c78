package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.error.CredentialException;

/**
 * Supplies the token presented to the control plane together with the type header value that
 * tells the service how to validate it.
 *
 * @since 0.1.0
 */
public interface BearerTokenSource {
  /** Header naming the kind of bearer token on control-plane calls. */
  String TOKEN_TYPE_HEADER = "X-Snowflake-Authorization-Token-Type";

  /**
   * Returns a token valid for direct use against the control-plane host.
   *
   * @return bearer token
   * @throws CredentialException when the token cannot be produced
   */
  String bearerToken() throws CredentialException;

  /**
   * Value sent in {@link #TOKEN_TYPE_HEADER}.
   *
   * @return {@code KEYPAIR_JWT} or {@code PROGRAMMATIC_ACCESS_TOKEN}
   */
  String tokenType();
}
