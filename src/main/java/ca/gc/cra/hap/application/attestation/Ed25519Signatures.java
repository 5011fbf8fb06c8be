package ca.gc.cra.hap.application.attestation;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Base64;

/**
 * Ed25519 signing over UTF-8 payload text, with standard base64 signatures.
 *
 * @since 0.3.0
 */
public final class Ed25519Signatures {
  public static final String ALGORITHM = "Ed25519";

  private Ed25519Signatures() {
    // Utility
  }

  /**
   * Signs payload text.
   *
   * @param privateKey Ed25519 private key
   * @param payloadJson exact text to sign
   * @return standard base64 signature
   * @throws IllegalStateException when the JDK rejects the key
   */
  public static String sign(PrivateKey privateKey, String payloadJson) {
    try {
      Signature signer = Signature.getInstance(ALGORITHM);
      signer.initSign(privateKey);
      signer.update(payloadJson.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signer.sign());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Ed25519 signing failed", ex);
    }
  }

  /**
   * Verifies a signature over payload text.
   *
   * @param publicKey Ed25519 public key
   * @param payloadJson exact text that was signed
   * @param signatureBase64 standard base64 signature
   * @return {@code true} when the signature verifies
   * @throws GeneralSecurityException when the key is unusable
   * @throws IllegalArgumentException when the signature is not valid base64
   */
  public static boolean verify(PublicKey publicKey, String payloadJson, String signatureBase64)
      throws GeneralSecurityException {
    byte[] signature = Base64.getDecoder().decode(signatureBase64);
    Signature verifier = Signature.getInstance(ALGORITHM);
    verifier.initVerify(publicKey);
    verifier.update(payloadJson.getBytes(StandardCharsets.UTF_8));
    return verifier.verify(signature);
  }
}
