package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.error.IngestException;

/**
 * Supplies what a channel session needs to reach the data plane: the ingest host and a token scoped to it.
 *
 * <p>Implementations cache both values and refresh the token transparently before it expires.</p>
 *
 * @since 0.1.0
 */
public interface IngestCredentials {
  /**
   * Returns the data-plane host name, discovering it on first use.
   *
   * @return DNS-safe host name
   * @throws IngestException when discovery fails
   * @throws InterruptedException when interrupted while waiting on the network
   */
  String ingestHost() throws IngestException, InterruptedException;

  /**
   * Returns a token valid for the ingest host.
   *
   * @return bearer token
   * @throws IngestException when discovery or the token exchange fails
   * @throws InterruptedException when interrupted while waiting on the network
   */
  String scopedToken() throws IngestException, InterruptedException;
}
