package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.canonical.DisclosureCanonicalizer;
import ca.gc.cra.hap.application.canonical.DisclosureValidator;
import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.disclosure.Disclosure;
import ca.gc.cra.hap.domain.error.ValidationException;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.infrastructure.decision.DecisionFileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * {@code hap disclosure-hash}: validates a decision file (v0.3) or disclosure document (v0.2) and
 * prints its hashes.
 *
 * @since 0.3.0
 */
final class DisclosureHashCli {
  private static final String USAGE =
      "usage: hap disclosure-hash [decision=PATH | disclosure=PATH] [profile=ID] [--canonical]";
  private static final String HELP = """
      HAP disclosure hash

      Usage:
        hap disclosure-hash [decision=PATH]       v0.3: one hash per domain (default .hap/decision.json)
        hap disclosure-hash disclosure=PATH       v0.2: one hash for the whole disclosure

      Options:
        profile=ID            Profile id (default: the decision file's profile)
        --canonical           Also print the canonical JSON that is hashed
        config=PATH           YAML configuration (default hap.yaml)
      """;

  private DisclosureHashCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("disclosure-hash", USAGE, HELP).execute(args, (options, root) -> {
      boolean canonical = options.hasFlag("--canonical");
      DecisionFileReader reader = root.decisionFiles();
      String legacy = options.get("disclosure");
      if (legacy != null) {
        Disclosure disclosure = reader.parseDisclosure(Files.readString(Path.of(legacy), StandardCharsets.UTF_8));
        Profile profile = root.profile(options.get("profile"));
        List<String> violations = DisclosureValidator.validate(disclosure, profile);
        if (!violations.isEmpty()) {
          throw new ValidationException("disclosure", violations);
        }
        if (canonical) {
          CliPrinter.println(DisclosureCanonicalizer.canonicalize(disclosure));
        }
        CliPrinter.field("disclosure_hash", DisclosureCanonicalizer.disclosureHash(disclosure));
        return ExitCode.SUCCESS;
      }

      Path location = Path.of(options.getOrDefault("decision", DecisionFileReader.DEFAULT_LOCATION));
      DecisionFile decision = reader.read(location);
      Profile profile = root.profile(options.getOrDefault("profile", decision.profile()));
      DisclosureValidator.requireValid(decision, profile);
      for (Map.Entry<String, String> entry : DisclosureCanonicalizer.domainDisclosureHashes(decision).entrySet()) {
        if (canonical) {
          decision.domain(entry.getKey())
              .ifPresent(domain -> CliPrinter.println(DisclosureCanonicalizer.canonicalize(domain)));
        }
        CliPrinter.field(entry.getKey(), entry.getValue());
      }
      return ExitCode.SUCCESS;
    });
  }
}
