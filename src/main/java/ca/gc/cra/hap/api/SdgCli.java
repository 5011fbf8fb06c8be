package ca.gc.cra.hap.api;

import ca.gc.cra.hap.application.canonical.DisclosureValidator;
import ca.gc.cra.hap.application.sdg.SdgContext;
import ca.gc.cra.hap.application.sdg.SdgContextLoader;
import ca.gc.cra.hap.application.sdg.SdgEvaluation;
import ca.gc.cra.hap.application.sdg.SdgResult;
import ca.gc.cra.hap.config.CompositionRoot;
import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.profile.Profile;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code hap sdg}: evaluates the profile's semantic drift guards against a review context.
 *
 * <p>When {@code decision=PATH} is given, decision-file presence and missing disclosure fields are
 * derived from that file for the domains the context's execution path requires.</p>
 *
 * @since 0.3.0
 */
final class SdgCli {
  private static final Logger log = LoggerFactory.getLogger(SdgCli.class);
  private static final String USAGE = "usage: hap sdg context=PATH [profile=ID] [decision=PATH]";
  private static final String HELP = """
      HAP semantic drift guards

      Usage:
        hap sdg context=PATH [options]

      Options:
        profile=ID            Profile whose guards run (default: configured profile, else latest)
        decision=PATH         Derive decision_file_present and missing_disclosure_fields from this file
        config=PATH           YAML configuration (default hap.yaml)

      Output: one HARD_STOP or WARNING line per triggered guard.
      Exit codes: 0 no hard stop, 6 at least one hard stop.
      """;

  private SdgCli() {}

  static ExitCode run(String[] args) {
    return new CommandRunner("sdg", USAGE, HELP).execute(args, SdgCli::evaluate);
  }

  private static ExitCode evaluate(CommandOptions options, CompositionRoot root) throws IOException {
    Profile profile = root.profile(options.get("profile"));
    SdgContext.Builder builder = new SdgContextLoader().load(Path.of(options.require("context")));
    SdgContext context = builder.build();
    String decision = options.get("decision");
    if (decision != null) {
      Optional<DecisionFile> file = root.decisionFiles().readIfPresent(Path.of(decision));
      builder.decisionFilePresent(file.isPresent());
      builder.missingDisclosureFields(missingFields(file.orElse(null), profile, context.executionPath()));
      context = builder.build();
    }

    SdgEvaluation evaluation = root.sdgCatalog().forProfile(profile).evaluate(context);
    for (SdgResult result : evaluation.hardStops()) {
      root.metrics().increment("hap.sdg.hardstop");
      CliPrinter.println("HARD_STOP " + result.id() + ": " + result.userPrompt());
    }
    for (SdgResult result : evaluation.warnings()) {
      root.metrics().increment("hap.sdg.warning");
      CliPrinter.println("WARNING " + result.id() + ": " + result.userPrompt());
    }
    CliPrinter.field("evaluated", evaluation.results().size());
    CliPrinter.field("hard_stops", evaluation.hardStops().size());
    CliPrinter.field("warnings", evaluation.warnings().size());
    log.debug("SDG evaluation for profile={} path={}: {}", profile.id(), context.executionPath(), evaluation);
    return evaluation.hasHardStop() ? ExitCode.REJECTED : ExitCode.SUCCESS;
  }

  private static List<String> missingFields(DecisionFile file, Profile profile, String executionPath) {
    if (file == null || executionPath == null || !profile.executionPaths().containsKey(executionPath)) {
      return List.of();
    }
    List<String> missing = new ArrayList<>();
    for (String domain : profile.executionPath(executionPath).requiredDomains()) {
      missing.addAll(DisclosureValidator.missingFields(file.domain(domain).orElse(null), domain, profile));
    }
    return missing;
  }
}
