package ca.gc.cra.tide.domain.stream;

/**
 * Lifecycle of a streaming channel session. {@link #CLOSED} is terminal.
 *
 * @since 0.1.0
 */
public enum ChannelPhase {
  /** Session created; the service has not acknowledged the channel yet. */
  UNOPENED,
  /** Channel acknowledged; appends are accepted. */
  OPEN,
  /** Local bookkeeping closed; the service closes the channel after inactivity. */
  CLOSED
}
