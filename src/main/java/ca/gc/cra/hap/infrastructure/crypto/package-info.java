/**
 * Ed25519 key material adapters.
 * <p><strong>Security:</strong> Private keys are never logged or rendered; only public keys appear
 * in hex.</p>
 */
package ca.gc.cra.hap.infrastructure.crypto;
