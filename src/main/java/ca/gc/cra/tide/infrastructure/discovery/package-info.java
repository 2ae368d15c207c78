/** Ingest host discovery against the control plane. */
package ca.gc.cra.tide.infrastructure.discovery;
