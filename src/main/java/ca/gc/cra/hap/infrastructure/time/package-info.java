/**
 * Clock adapters for issuance and expiry checks.
 */
package ca.gc.cra.hap.infrastructure.time;
