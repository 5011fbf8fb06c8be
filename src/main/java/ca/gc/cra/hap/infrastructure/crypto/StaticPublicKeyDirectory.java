package ca.gc.cra.hap.infrastructure.crypto;

import ca.gc.cra.hap.application.port.PublicKeyDirectory;
import java.security.PublicKey;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed kid-to-key mapping, used by verifiers and executors that hold no private key.
 *
 * @since 0.3.0
 */
public final class StaticPublicKeyDirectory implements PublicKeyDirectory {
  private final Map<String, PublicKey> keys;

  public StaticPublicKeyDirectory(Map<String, PublicKey> keys) {
    this.keys = Map.copyOf(keys);
  }

  /**
   * Builds a single-key directory from raw hex.
   *
   * @param kid key identifier
   * @param publicKeyHex raw Ed25519 public key
   * @return directory holding one key
   */
  public static StaticPublicKeyDirectory ofHex(String kid, String publicKeyHex) {
    return new StaticPublicKeyDirectory(Map.of(kid, Ed25519Keys.publicKeyFromHex(publicKeyHex)));
  }

  @Override
  public Optional<PublicKey> find(String kid) {
    return kid == null ? Optional.empty() : Optional.ofNullable(keys.get(kid));
  }
}
