package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.attestation.AttestationRequest;
import ca.gc.cra.hap.application.attestation.SignedAttestation;
import ca.gc.cra.hap.application.canonical.DisclosureCanonicalizer;
import ca.gc.cra.hap.application.canonical.DisclosureValidator;
import ca.gc.cra.hap.application.canonical.FrameCanonicalizer;
import ca.gc.cra.hap.config.CompositionRoot;
import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.attestation.DecisionOwnerScope;
import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import ca.gc.cra.hap.infrastructure.decision.DecisionFileReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code hap attest}: signs an attestation and prints the comment block.
 *
 * @since 0.3.0
 */
final class AttestCli {
  private static final Logger log = LoggerFactory.getLogger(AttestCli.class);
  private static final String USAGE =
      "usage: hap attest repo=OWNER/NAME sha=SHA env=ENV path=PATH domain=DOMAIN did=DID "
          + "[profile=ID] [decision=PATH|disclosureHash=HASH] [gates=G1,G2] [ttl=SECONDS]";
  private static final String HELP = """
      HAP attest

      Usage:
        hap attest repo=OWNER/NAME sha=SHA env=ENV path=PATH domain=DOMAIN did=DID [options]

      v0.3 profiles:
        decision=PATH         Decision file to hash the domain disclosure from (default .hap/decision.json);
                              its execution_path must equal path
        disclosureHash=HASH   Use a precomputed domain disclosure hash instead

      v0.2 profiles:
        disclosureHash=HASH   Disclosure hash bound into the frame (required)
        gates=G1,G2           Gates resolved during review
        owners=DID1,DID2      Decision owners (default: did)

      Options:
        profile=ID            Profile id (default: configured profile, else latest)
        ttl=SECONDS           Attestation lifetime (default: profile default)
        config=PATH           YAML configuration (default hap.yaml)
      """;

  private AttestCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("attest", USAGE, HELP).execute(args, AttestCli::attest);
  }

  private static ExitCode attest(CommandOptions options, CompositionRoot root) throws IOException {
    Profile profile = root.profile(options.get("profile"));
    String repo = options.require("repo");
    String sha = options.require("sha");
    String env = options.require("env");
    String path = options.require("path");
    String domain = options.require("domain");
    String did = options.require("did");
    Long ttl = options.optionalLong("ttl");

    String disclosureHash;
    AttestationRequest request;
    String frameHash;
    if (profile.version() == ProtocolVersion.V0_2) {
      disclosureHash = options.require("disclosureHash");
      frameHash = FrameCanonicalizer.frameHash(
          Frame.v02(repo, sha, env, profile.id(), path, disclosureHash), profile);
      List<String> owners = options.list("owners");
      request = new AttestationRequest.V02(
          profile.id(),
          path,
          frameHash,
          options.list("gates"),
          owners.isEmpty() ? List.of(did) : owners,
          List.of(new DecisionOwnerScope(did, domain, env)),
          ttl);
    } else {
      disclosureHash = options.get("disclosureHash");
      if (disclosureHash == null) {
        disclosureHash = domainDisclosureHash(options, root, profile, path, domain);
      }
      frameHash = FrameCanonicalizer.frameHash(Frame.v03(repo, sha, env, profile.id(), path), profile);
      request = new AttestationRequest.V03(profile.id(), path, frameHash, domain, did, env, disclosureHash, ttl);
    }

    SignedAttestation signed = root.signer().sign(request);
    AttestationBlock block = new AttestationBlock(
        profile.version(), profile.id(), domain, env, path, sha, frameHash, disclosureHash, signed.blob());
    log.info("Signed attestation {} for domain={} path={}", signed.attestationId(), domain, path);
    CliPrinter.println(root.textCodec().encode(block));
    return ExitCode.SUCCESS;
  }

  private static String domainDisclosureHash(
      CommandOptions options, CompositionRoot root, Profile profile, String path, String domain)
      throws IOException {
    Path location = Path.of(options.getOrDefault("decision", DecisionFileReader.DEFAULT_LOCATION));
    DecisionFile decision = root.decisionFiles().read(location);
    // The disclosure hash is not part of the v0.3 frame, so the path binding is checked here.
    if (!path.equals(decision.executionPath())) {
      throw new ProtocolException(ErrorCode.PATH_MISMATCH, "decision file execution_path "
          + decision.executionPath() + " does not match path " + path);
    }
    DisclosureValidator.requireValid(decision, profile);
    return decision.domain(domain)
        .map(DisclosureCanonicalizer::domainDisclosureHash)
        .orElseThrow(() -> new ValidationException(
            "decision_file", List.of("no disclosure for domain " + domain)));
  }
}
