package ca.gc.cra.tide.config;

/**
 * How the client proves its identity to the control plane.
 *
 * @since 0.1.0
 */
public enum AuthMode {
  /** RS256 JWT signed with a configured private key. */
  KEY_PAIR("KEYPAIR_JWT"),
  /** Externally managed programmatic access token. */
  PROGRAMMATIC_ACCESS_TOKEN("PROGRAMMATIC_ACCESS_TOKEN");

  private final String tokenType;

  AuthMode(String tokenType) {
    this.tokenType = tokenType;
  }

  /**
   * Value of the token-type header for this mode.
   *
   * @return header value
   */
  public String tokenType() {
    return tokenType;
  }
}
