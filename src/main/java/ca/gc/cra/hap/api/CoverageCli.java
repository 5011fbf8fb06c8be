package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.scope.AggregatedCoverage;
import ca.gc.cra.hap.application.scope.CoverageResult;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import ca.gc.cra.hap.domain.profile.ScopeSubstitution;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code hap coverage}: aggregates attestation comments on a commit and reports which required
 * domains are covered. Blocks count only when their signed frame equals the frame rebuilt from the
 * arguments.
 *
 * @since 0.3.0
 */
final class CoverageCli {
  /** Separator between exported comment bodies. */
  static final String COMMENT_SEPARATOR = "---8<---";
  private static final Pattern SEPARATOR_LINE = Pattern.compile("(?m)^" + Pattern.quote(COMMENT_SEPARATOR) + "\\s*$");

  private static final String USAGE =
      "usage: hap coverage comments=PATH repo=OWNER/NAME sha=SHA env=ENV path=PATH [profile=ID] "
          + "[disclosureHash=HASH] [--no-verify]";
  private static final String HELP = """
      HAP coverage

      Usage:
        hap coverage comments=PATH repo=OWNER/NAME sha=SHA env=ENV path=PATH [options]

      The comments file holds exported PR comment bodies separated by lines of ---8<---.

      Options:
        profile=ID            Profile id (default: configured profile, else latest)
        disclosureHash=HASH   Disclosure hash bound into v0.2 frames (required for v0.2)
        --no-verify           Trust plaintext block keys without verifying blobs
        config=PATH           YAML configuration (default hap.yaml)

      Exit codes: 0 satisfied, 6 domains missing.
      """;

  private CoverageCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("coverage", USAGE, HELP).execute(args, (options, root) -> {
      Profile profile = root.profile(options.get("profile"));
      String pathId = options.require("path");
      String disclosureHash = profile.version() == ProtocolVersion.V0_2 ? options.require("disclosureHash") : null;
      Frame frame = Frame.forVersion(profile.version(), options.require("repo"), options.require("sha"),
          options.require("env"), profile.id(), pathId, disclosureHash);
      String text = Files.readString(Path.of(options.require("comments")), StandardCharsets.UTF_8);
      AggregatedCoverage aggregated = root.aggregator(!options.hasFlag("--no-verify"))
          .aggregate(frame, profile, splitComments(text));
      CoverageResult coverage = aggregated.coverage();
      CliPrinter.field("satisfied", coverage.satisfied());
      CliPrinter.field("path", pathId);
      CliPrinter.field("frame_hash", aggregated.frameHash());
      CliPrinter.field("domains", String.join(",", aggregated.domains()));
      CliPrinter.field("missing", String.join(",", coverage.missingDomains()));
      CliPrinter.field("frame_hashes", String.join(",", aggregated.frameHashes()));
      for (ScopeSubstitution substitution : coverage.substitutions()) {
        CliPrinter.field("substitution", substitution.substitute() + "->" + substitution.standsInFor());
      }
      if (aggregated.rejected() > 0) {
        CliPrinter.field("ignored", aggregated.rejected());
      }
      return coverage.satisfied() ? ExitCode.SUCCESS : ExitCode.REJECTED;
    });
  }

  static List<String> splitComments(String text) {
    List<String> comments = new ArrayList<>();
    for (String part : SEPARATOR_LINE.split(text)) {
      if (!part.isBlank()) {
        comments.add(part.strip());
      }
    }
    return comments;
  }
}
