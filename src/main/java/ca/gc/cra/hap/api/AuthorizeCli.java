package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.attestation.AttestationTextCodec;
import ca.gc.cra.hap.application.executor.AuthorizationDecision;
import ca.gc.cra.hap.application.executor.AuthorizationOutcome;
import ca.gc.cra.hap.application.executor.ExecutionRequest;
import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.attestation.AttestedScope;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code hap authorize}: the executor-side gate. Prints {@code authorized=true} with the decision,
 * or {@code authorized=false} with the error code.
 *
 * @since 0.3.0
 */
final class AuthorizeCli {
  private static final String USAGE =
      "usage: hap authorize (blob=BLOB | blobFile=PATH) repo=OWNER/NAME sha=SHA env=ENV path=PATH "
          + "[profile=ID] [disclosureHash=HASH] [attestations=PATH]";
  private static final String HELP = """
      HAP authorize

      Usage:
        hap authorize blob=BLOB repo=OWNER/NAME sha=SHA env=ENV path=PATH [options]

      Options:
        profile=ID            Profile the executor accepts (default: configured profile, else the blob's)
        disclosureHash=HASH   Disclosure hash bound into v0.2 frames
        attestations=PATH     File of additional attestation blocks or blobs, one per line
        config=PATH           YAML configuration (default hap.yaml)

      Exit codes: 0 authorized, 6 denied.
      """;

  private AuthorizeCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("authorize", USAGE, HELP).execute(args, (options, root) -> {
      String profileId = options.get("profile");
      ExecutionRequest request = new ExecutionRequest(
          options.blob("blob"),
          options.require("repo"),
          options.require("sha"),
          options.require("env"),
          profileId,
          options.require("path"),
          options.get("disclosureHash"),
          additionalBlobs(options.get("attestations"), root.textCodec()));
      AuthorizationOutcome outcome = root.authorizer(profileId).evaluate(request);
      CliPrinter.field("authorized", outcome.authorized());
      if (!outcome.authorized()) {
        CliPrinter.field("error", outcome.error().wireName());
        CliPrinter.field("reason", outcome.reason());
        return ExitCode.REJECTED;
      }
      AuthorizationDecision decision = outcome.decision();
      CliPrinter.field("attestation_id", decision.attestationId());
      CliPrinter.field("profile", decision.profileId());
      CliPrinter.field("path", decision.executionPath());
      CliPrinter.field("frame_hash", decision.frameHash());
      CliPrinter.field("expires_at", decision.expiresAt());
      for (AttestedScope scope : decision.scopes()) {
        CliPrinter.field("scope", scope.domain() + "/" + scope.env());
      }
      return ExitCode.SUCCESS;
    });
  }

  /**
   * Reads extra blobs. Comment blocks are unwrapped; any other non-blank line is taken as a bare blob.
   */
  static List<String> additionalBlobs(String location, AttestationTextCodec textCodec) throws IOException {
    if (location == null) {
      return List.of();
    }
    String text = Files.readString(Path.of(location), StandardCharsets.UTF_8);
    List<String> blobs = new ArrayList<>();
    if (text.contains(AttestationTextCodec.BEGIN)) {
      for (AttestationBlock block : textCodec.decodeAll(CoverageCli.splitComments(text))) {
        blobs.add(block.blob());
      }
      return blobs;
    }
    for (String line : text.split("\\R")) {
      if (!line.isBlank()) {
        blobs.add(line.trim());
      }
    }
    return blobs;
  }
}
