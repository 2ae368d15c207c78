/** Token values with expiry bookkeeping. */
package ca.gc.cra.tide.domain.auth;
