package ca.gc.cra.hap.application.port;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Service-provider signing key pair with its identifier.
 *
 * @param kid key identifier written into blob headers
 * @param privateKey Ed25519 private key
 * @param publicKey matching Ed25519 public key
 * @since 0.3.0
 */
public record SigningKey(String kid, PrivateKey privateKey, PublicKey publicKey) {

  public SigningKey {
    Objects.requireNonNull(kid, "kid");
    Objects.requireNonNull(privateKey, "privateKey");
    Objects.requireNonNull(publicKey, "publicKey");
  }

  @Override
  public String toString() {
    return "SigningKey[kid=" + kid + ", privateKey=<redacted>]";
  }
}
