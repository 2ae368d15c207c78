/**
 * Checked failure taxonomy for credentials, host discovery and channel calls.
 * <p>{@link ca.gc.cra.tide.domain.error.ChannelException} carries the HTTP status and a truncated body
 * when the service answered.</p>
 */
package ca.gc.cra.tide.domain.error;
