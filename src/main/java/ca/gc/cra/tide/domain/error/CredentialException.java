package ca.gc.cra.tide.domain.error;

/**
 * Raised when an identity assertion cannot be produced or the scoped-token exchange fails.
 *
 * @since 0.1.0
 */
public final class CredentialException extends IngestException {
  private static final long serialVersionUID = 1L;

  public CredentialException(String message) {
    super(message);
  }

  public CredentialException(String message, Throwable cause) {
    super(message, cause);
  }
}
