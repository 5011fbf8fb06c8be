package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.attestation.AttestationVerifier;
import ca.gc.cra.hap.application.attestation.VerifiedAttestation;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;
import ca.gc.cra.hap.domain.attestation.AttestedScope;

/**
 * {@code hap verify}: checks a blob's signature, expiry and, optionally, its frame hash.
 *
 * @since 0.3.0
 */
final class VerifyCli {
  private static final String USAGE = "usage: hap verify (blob=BLOB | blobFile=PATH) [frameHash=HASH]";
  private static final String HELP = """
      HAP verify

      Usage:
        hap verify blob=BLOB [frameHash=HASH]
        hap verify blobFile=PATH [frameHash=HASH]

      Options:
        frameHash=HASH        Also require the attested frame hash to match
        config=PATH           YAML configuration (default hap.yaml)

      Exit codes: 0 valid, 6 rejected (error=<code> printed).
      """;

  private VerifyCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("verify", USAGE, HELP).execute(args, (options, root) -> {
      String blob = options.blob("blob");
      String frameHash = options.get("frameHash");
      AttestationVerifier verifier = root.verifier();
      VerifiedAttestation verified = frameHash == null
          ? verifier.verifySignatureAndExpiry(blob)
          : verifier.verify(blob, frameHash);
      AttestationPayload payload = verified.payload();
      CliPrinter.field("valid", true);
      CliPrinter.field("attestation_id", verified.attestationId());
      CliPrinter.field("kid", verified.attestation().header().kid());
      CliPrinter.field("profile", payload.profileId());
      CliPrinter.field("version", payload.version().wire());
      CliPrinter.field("frame_hash", payload.frameHash());
      CliPrinter.field("issued_at", payload.issuedAt());
      CliPrinter.field("expires_at", payload.expiresAt());
      for (AttestedScope scope : payload.scopes()) {
        CliPrinter.field("scope", scope.domain() + "/" + scope.env()
            + (scope.did() == null ? "" : " " + scope.did()));
      }
      return ExitCode.SUCCESS;
    });
  }
}
