/**
 * Metrics adapters that bridge TIDE ports to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached per key and safe for concurrent updates.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code stream.*} and {@code ingest.*} namespaces.</p>
 * <p><strong>Security:</strong> Only metric keys are exported as attributes; no row content.</p>
 */
package ca.gc.cra.tide.infrastructure.metrics;
