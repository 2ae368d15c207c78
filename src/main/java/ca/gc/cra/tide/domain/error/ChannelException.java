package ca.gc.cra.tide.domain.error;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Raised when a channel open, append, or status call is rejected or cannot complete.
 *
 * <p>Carries the HTTP status and response body when the failure came from the service, so callers can
 * log enough context to diagnose remotely.</p>
 *
 * @since 0.1.0
 */
public final class ChannelException extends IngestException {
  private static final long serialVersionUID = 1L;
  private static final int NO_STATUS = -1;

  private final int status;
  private final String responseBody;

  /**
   * Creates an exception for a non-2xx response.
   *
   * @param message description of the failed operation
   * @param status HTTP status returned by the service
   * @param responseBody response body, possibly truncated
   */
  public ChannelException(String message, int status, String responseBody) {
    super(message + " (HTTP " + status + "): " + responseBody);
    this.status = status;
    this.responseBody = responseBody;
  }

  /**
   * Creates an exception for a failure that produced no HTTP response.
   *
   * @param message description of the failed operation
   * @param cause transport or credential failure
   */
  public ChannelException(String message, Throwable cause) {
    super(message, cause);
    this.status = NO_STATUS;
    this.responseBody = null;
  }

  /**
   * Returns the HTTP status when the service answered.
   *
   * @return status code, or empty for transport-level failures
   */
  public OptionalInt status() {
    return status == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(status);
  }

  /**
   * Returns the response body when the service answered.
   *
   * @return body text, possibly truncated
   */
  public Optional<String> responseBody() {
    return Optional.ofNullable(responseBody);
  }
}
