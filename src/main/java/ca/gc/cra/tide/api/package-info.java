/**
 * Command-line entry points ({@code stream}, {@code verify}) and their argument handling.
 * <p><strong>Role:</strong> Outermost adapter; wires configuration, transport, credentials and sessions.</p>
 * <p><strong>Exit codes:</strong> See {@link ca.gc.cra.tide.api.ExitCode}.</p>
 */
package ca.gc.cra.tide.api;
