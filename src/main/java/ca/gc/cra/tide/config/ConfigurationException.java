package ca.gc.cra.tide.config;

/**
 * Raised when the connection configuration is missing, contradictory, or points at files that do not exist.
 * Always fatal at startup.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
