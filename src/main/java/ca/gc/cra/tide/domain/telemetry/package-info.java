/**
 * Sensor reading model and the flat record shape sent to the pipe.
 */
package ca.gc.cra.tide.domain.telemetry;
