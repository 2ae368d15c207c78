/**
 * <strong>Purpose:</strong> Ports between the streaming use cases and their adapters (HTTP, clock,
 * credentials, sensors, metrics).
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure implements these interfaces.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Token-bearing ports never expose secrets through {@code toString()}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.port;
