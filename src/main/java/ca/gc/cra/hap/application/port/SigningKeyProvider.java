package ca.gc.cra.hap.application.port;

/**
 * <strong>What:</strong> Port supplying the service provider's signing key.
 * <p><strong>Why:</strong> Keeps key sourcing (configuration, environment, ephemeral generation) out of
 * the signer.</p>
 * <p><strong>Thread-safety:</strong> Implementations must initialize at most once and be safe for
 * concurrent callers; the returned key must not change afterwards.</p>
 *
 * @since 0.3.0
 */
public interface SigningKeyProvider {
  /**
   * Returns the active signing key, initializing it on first use.
   *
   * @return signing key pair
   * @throws IllegalStateException when configured key material is unusable
   */
  SigningKey signingKey();
}
