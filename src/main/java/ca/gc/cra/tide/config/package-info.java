/**
 * <strong>Purpose:</strong> Connection and run configuration.
 * <p><strong>Inputs:</strong> JSON connection file plus {@code key=value} CLI settings.</p>
 * <p><strong>Security:</strong> Secrets (PAT, key passphrase) are excluded from {@code toString()}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.config;
