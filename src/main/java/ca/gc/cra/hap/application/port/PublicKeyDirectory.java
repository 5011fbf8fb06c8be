package ca.gc.cra.hap.application.port;

import java.security.PublicKey;
import java.util.Optional;

/**
 * Port resolving verification keys by the {@code kid} carried in a blob header.
 *
 * @since 0.3.0
 */
public interface PublicKeyDirectory {
  /**
   * Looks up a public key.
   *
   * @param kid key identifier from the blob header
   * @return key, or empty when the identifier is unknown
   */
  Optional<PublicKey> find(String kid);
}
