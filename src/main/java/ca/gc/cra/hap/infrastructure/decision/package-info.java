/**
 * Readers for author-supplied decision files.
 */
package ca.gc.cra.hap.infrastructure.decision;
