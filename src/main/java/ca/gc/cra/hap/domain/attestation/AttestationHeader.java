package ca.gc.cra.hap.domain.attestation;

import java.util.Objects;

/**
 * Blob header identifying the token type, signature algorithm, and signing key.
 *
 * @param typ token type, always {@value #TYPE}
 * @param alg signature algorithm, always {@value #ALGORITHM}
 * @param kid signing key identifier
 * @since 0.3.0
 */
public record AttestationHeader(String typ, String alg, String kid) {
  public static final String TYPE = "HAP-attestation";
  public static final String ALGORITHM = "EdDSA";

  public AttestationHeader {
    Objects.requireNonNull(typ, "typ");
    Objects.requireNonNull(alg, "alg");
    Objects.requireNonNull(kid, "kid");
  }

  public static AttestationHeader forKey(String kid) {
    return new AttestationHeader(TYPE, ALGORITHM, kid);
  }
}
