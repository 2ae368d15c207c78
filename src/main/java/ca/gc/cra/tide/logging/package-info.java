/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound or mask values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Security:</strong> {@link ca.gc.cra.tide.logging.Logs#redact(String)} keeps tokens out of logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.logging;
