package ca.gc.cra.hap.infrastructure.crypto;

import ca.gc.cra.hap.application.attestation.Ed25519Signatures;
import ca.gc.cra.hap.application.port.PublicKeyDirectory;
import ca.gc.cra.hap.application.port.SigningKey;
import ca.gc.cra.hap.application.port.SigningKeyProvider;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Service-provider signing key, loaded once.
 * <p><strong>Sources:</strong> a configured raw hex key pair, checked with a test signature, or, when
 * no private key is configured, an ephemeral pair generated on first use. Ephemeral keys do not
 * survive a restart, so attestations they sign become unverifiable afterwards.</p>
 * <p><strong>Thread-safety:</strong> Initialization is guarded; the key is immutable once loaded.</p>
 *
 * @since 0.3.0
 */
public final class Ed25519SigningKeyProvider implements SigningKeyProvider, PublicKeyDirectory {
  private static final Logger log = LoggerFactory.getLogger(Ed25519SigningKeyProvider.class);
  private static final String CHECK_MESSAGE = "hap-key-check";

  private final String kid;
  private final String privateKeyHex;
  private final String publicKeyHex;
  private volatile SigningKey key;

  /**
   * Creates a provider.
   *
   * @param kid key identifier written to blob headers
   * @param privateKeyHex raw private key seed, or {@code null} for an ephemeral key
   * @param publicKeyHex raw public key; required when {@code privateKeyHex} is set
   */
  public Ed25519SigningKeyProvider(String kid, String privateKeyHex, String publicKeyHex) {
    this.kid = Objects.requireNonNull(kid, "kid");
    this.privateKeyHex = privateKeyHex;
    this.publicKeyHex = publicKeyHex;
  }

  @Override
  public SigningKey signingKey() {
    SigningKey current = key;
    if (current == null) {
      synchronized (this) {
        current = key;
        if (current == null) {
          current = load();
          key = current;
        }
      }
    }
    return current;
  }

  @Override
  public Optional<PublicKey> find(String requestedKid) {
    if (!kid.equals(requestedKid)) {
      return Optional.empty();
    }
    return Optional.of(signingKey().publicKey());
  }

  private SigningKey load() {
    if (privateKeyHex == null || privateKeyHex.isBlank()) {
      KeyPair pair = Ed25519Keys.generate();
      log.warn("No signing key configured; generated ephemeral key kid={} public={}",
          kid, Ed25519Keys.toHex(pair.getPublic()));
      return new SigningKey(kid, pair.getPrivate(), pair.getPublic());
    }
    if (publicKeyHex == null || publicKeyHex.isBlank()) {
      throw new IllegalStateException("signer.publicKeyHex is required when a private key is configured");
    }
    PrivateKey privateKey;
    PublicKey publicKey;
    try {
      privateKey = Ed25519Keys.privateKeyFromHex(privateKeyHex);
      publicKey = Ed25519Keys.publicKeyFromHex(publicKeyHex);
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("Configured signing key for kid=" + kid + " is unusable", ex);
    }
    checkPair(privateKey, publicKey);
    log.info("Loaded signing key kid={} public={}", kid, Ed25519Keys.toHex(publicKey));
    return new SigningKey(kid, privateKey, publicKey);
  }

  private void checkPair(PrivateKey privateKey, PublicKey publicKey) {
    String signature = Ed25519Signatures.sign(privateKey, CHECK_MESSAGE);
    boolean valid;
    try {
      valid = Ed25519Signatures.verify(publicKey, CHECK_MESSAGE, signature);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Configured public key for kid=" + kid + " is unusable", ex);
    }
    if (!valid) {
      throw new IllegalStateException("Configured private and public keys for kid=" + kid + " do not match");
    }
  }
}
