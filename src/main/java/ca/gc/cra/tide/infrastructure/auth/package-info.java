/**
 * <strong>Purpose:</strong> Identity assertions (key-pair JWT or programmatic access token) and the
 * scoped-token exchange.
 * <p><strong>Concurrency:</strong> Token caches are guarded by the owning instance monitor.</p>
 * <p><strong>Security:</strong> Tokens are logged only in redacted form.</p>
 */
package ca.gc.cra.tide.infrastructure.auth;
