/**
 * {@link ca.gc.cra.tide.application.port.HttpTransport} backed by {@code java.net.http.HttpClient}.
 */
package ca.gc.cra.tide.infrastructure.http;
