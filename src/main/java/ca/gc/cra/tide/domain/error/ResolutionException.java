package ca.gc.cra.tide.domain.error;

/**
 * Raised when the per-account ingest host cannot be discovered.
 *
 * @since 0.1.0
 */
public final class ResolutionException extends IngestException {
  private static final long serialVersionUID = 1L;

  public ResolutionException(String message) {
    super(message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
