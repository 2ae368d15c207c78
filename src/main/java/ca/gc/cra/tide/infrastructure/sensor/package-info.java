/**
 * Sensor sources and host metric sampling.
 */
package ca.gc.cra.tide.infrastructure.sensor;
