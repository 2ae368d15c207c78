/**
 * Argument validation helpers shared by configuration and CLI parsing.
 */
package ca.gc.cra.tide.validation;
