package ca.gc.cra.tide.domain.error;

/**
 * Base type for failures raised while talking to the streaming ingest service.
 *
 * <p>Subtypes distinguish the phase that failed so the CLI can decide between aborting startup and
 * counting a batch error.</p>
 *
 * @since 0.1.0
 */
public abstract class IngestException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message human readable description
   */
  protected IngestException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message human readable description
   * @param cause underlying failure
   */
  protected IngestException(String message, Throwable cause) {
    super(message, cause);
  }
}
