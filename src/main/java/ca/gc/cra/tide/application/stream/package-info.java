/**
 * Channel lifecycle and the ordered offset/continuation-token append protocol.
 */
package ca.gc.cra.tide.application.stream;
