package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.attestation.Ed25519Signatures;
import ca.gc.cra.hap.application.port.SigningKey;
import ca.gc.cra.hap.infrastructure.crypto.Ed25519Keys;

/**
 * {@code hap pubkey}: prints the signing authority's public key so executors can pin it.
 *
 * @since 0.3.0
 */
final class PubkeyCli {
  private static final String USAGE = "usage: hap pubkey [config=PATH]";
  private static final String HELP = """
      HAP public key

      Usage:
        hap pubkey [config=PATH]

      Prints kid, alg, and the raw 32-byte Ed25519 public key as hex. Without a configured private key
      the key is ephemeral and only valid for this process.
      """;

  private PubkeyCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("pubkey", USAGE, HELP).execute(args, (options, root) -> {
      SigningKey key = root.signingKeys().signingKey();
      CliPrinter.field("kid", key.kid());
      CliPrinter.field("alg", Ed25519Signatures.ALGORITHM);
      CliPrinter.field("public_key", Ed25519Keys.toHex(key.publicKey()));
      return ExitCode.SUCCESS;
    });
  }
}
