package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.canonical.ContentHasher;
import ca.gc.cra.hap.application.canonical.FrameCanonicalizer;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.Profile;

/**
 * {@code hap frame-hash}: prints the canonical frame and its hash.
 *
 * @since 0.3.0
 */
final class FrameHashCli {
  private static final String USAGE =
      "usage: hap frame-hash repo=OWNER/NAME sha=SHA env=ENV path=PATH [profile=ID] [disclosureHash=HASH]";
  private static final String HELP = """
      HAP frame hash

      Usage:
        hap frame-hash repo=OWNER/NAME sha=SHA env=ENV path=PATH [options]

      Options:
        profile=ID            Profile id (default: configured profile, else latest)
        disclosureHash=HASH   Required for v0.2 profiles, which bind the disclosure
        config=PATH           YAML configuration (default hap.yaml)
        --verbose | --quiet   Logging level
      """;

  private FrameHashCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("frame-hash", USAGE, HELP).execute(args, (options, root) -> {
      Profile profile = root.profile(options.get("profile"));
      Frame frame = Frame.forVersion(
          profile.version(),
          options.require("repo"),
          options.require("sha"),
          options.require("env"),
          profile.id(),
          options.require("path"),
          options.get("disclosureHash"));
      String canonical = FrameCanonicalizer.canonicalize(frame, profile);
      CliPrinter.println(canonical);
      CliPrinter.field("frame_hash", ContentHasher.hash(canonical));
      return ExitCode.SUCCESS;
    });
  }
}
