/** Value types describing a pipe target and channel state. */
package ca.gc.cra.tide.domain.stream;
