package ca.gc.cra.hap.api;

import ca.gc.cra.hap.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HAP CLI dispatcher that routes to subcommands.
 *
 * @since 0.3.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: hap <frame-hash|disclosure-hash|attest|verify|authorize|coverage|sdg|pubkey> [options]";
  private static final String HELP_TEXT = """
      HAP command dispatcher

      Usage:
        hap <command> [options]

      Commands:
        frame-hash       Canonicalize a frame and print its hash
        disclosure-hash  Validate and hash a decision file or disclosure
        attest           Sign an attestation and print the PR comment block
        verify           Verify an attestation blob
        authorize        Executor gate: verify, recompute the frame, check scope coverage
        coverage         Aggregate attestation comments on a commit
        sdg              Evaluate semantic drift guards for a review context
        pubkey           Print the signing authority public key

      Global flags:
        --help      Show this message (or <command> --help)
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = safeArgs[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);
    if (command.equals("--help") || command.equals("-h") || command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (command.equals("--verbose")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
      return run(delegateArgs);
    }

    return switch (command) {
      case "frame-hash" -> FrameHashCli.run(delegateArgs);
      case "disclosure-hash" -> DisclosureHashCli.run(delegateArgs);
      case "attest" -> AttestCli.run(delegateArgs);
      case "verify" -> VerifyCli.run(delegateArgs);
      case "authorize" -> AuthorizeCli.run(delegateArgs);
      case "coverage" -> CoverageCli.run(delegateArgs);
      case "sdg" -> SdgCli.run(delegateArgs);
      case "pubkey" -> PubkeyCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
