/**
 * Input validation helpers shared by configuration and CLI layers.
 */
package ca.gc.cra.hap.validation;
