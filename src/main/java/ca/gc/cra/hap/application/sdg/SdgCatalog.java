package ca.gc.cra.hap.application.sdg;

import ca.gc.cra.hap.domain.profile.Profile;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalogue of guard definitions available to profiles.
 *
 * <p>{@link #builtIn()} carries the deploy guards every shipped profile references. A YAML catalogue
 * loaded through {@link SdgCatalogLoader} can replace it.</p>
 *
 * @since 0.3.0
 */
public final class SdgCatalog {
  public static final String MISSING_DECISION_OWNER = "deploy/missing_decision_owner@1.0";
  public static final String COMMITMENT_MISMATCH = "deploy/commitment_mismatch@1.0";
  public static final String TRADEOFF_EXECUTION_MISMATCH = "deploy/tradeoff_execution_mismatch@1.0";
  public static final String OBJECTIVE_DIFF_MISMATCH = "deploy/objective_diff_mismatch@1.0";
  public static final String DECISION_FILE_MISSING = "deploy/decision_file_missing@1.0";
  public static final String DISCLOSURE_INCOMPLETE = "deploy/disclosure_incomplete@1.0";

  private final SdgRuleSet ruleSet;

  public SdgCatalog(SdgRuleSet ruleSet) {
    this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
  }

  public static SdgCatalog builtIn() {
    return new SdgCatalog(SdgRuleSet.compile(builtInDefinitions()));
  }

  public Optional<SdgDefinition> get(String id) {
    return ruleSet.get(id);
  }

  public List<SdgDefinition> definitions() {
    return ruleSet.definitions();
  }

  /**
   * Narrows the catalogue to the guards a profile declares.
   *
   * @param profile profile whose {@code sdgSet} is used
   * @return engine over the profile's guards, in profile order
   * @throws IllegalArgumentException when the profile names a guard the catalogue lacks
   */
  public SdgRuleEngine forProfile(Profile profile) {
    return new SdgRuleEngine(ruleSet.select(profile.sdgSet()));
  }

  static List<SdgDefinition> builtInDefinitions() {
    return List.of(
        new SdgDefinition(
            MISSING_DECISION_OWNER,
            "missing_decision_owner",
            "Detects when changes affect domains without a declared decision owner",
            List.of("affected_domains", "declared_decision_owner_scopes"),
            List.of(DetectionPredicate.AFFECTED_DOMAINS_NOT_DECLARED.expression()),
            true,
            "Changes affect domains without a declared decision owner. Add the required scope before proceeding."),
        new SdgDefinition(
            COMMITMENT_MISMATCH,
            "commitment_mismatch",
            "Detects when reviewers are not committing to the same frame",
            List.of("frame_hashes"),
            List.of(DetectionPredicate.MULTIPLE_FRAME_HASHES.expression()),
            true,
            "Reviewers have different frame hashes. All reviewers must commit to the same action."),
        new SdgDefinition(
            TRADEOFF_EXECUTION_MISMATCH,
            "tradeoff_execution_mismatch",
            "Detects when UI selection does not match the execution path in the frame",
            List.of("tradeoff_mode", "execution_path"),
            List.of(
                DetectionPredicate.CANARY_PATH_MISMATCH.expression(),
                DetectionPredicate.FULL_PATH_MISMATCH.expression()),
            true,
            "Your selected tradeoff mode does not match the execution path. This indicates a UI/Frame mismatch."),
        new SdgDefinition(
            OBJECTIVE_DIFF_MISMATCH,
            "objective_diff_mismatch",
            "Warns when stated objective appears misaligned with the changes",
            List.of("objective_text", "diff_summary"),
            List.of(DetectionPredicate.OBJECTIVE_DIFF_DISTANCE.expression()),
            false,
            "Your stated objective appears misaligned with the changes in this commit. Review carefully before proceeding."),
        new SdgDefinition(
            DECISION_FILE_MISSING,
            "decision_file_missing",
            "Detects when the commit carries no .hap/decision.json",
            List.of("decision_file_present"),
            List.of(DetectionPredicate.DECISION_FILE_ABSENT.expression()),
            true,
            "No decision file was found for this commit. Add .hap/decision.json before requesting attestations."),
        new SdgDefinition(
            DISCLOSURE_INCOMPLETE,
            "disclosure_incomplete",
            "Detects when the decision file omits disclosure fields the profile requires",
            List.of("missing_disclosure_fields"),
            List.of(DetectionPredicate.DISCLOSURE_FIELDS_MISSING.expression()),
            true,
            "The decision file is missing required disclosure fields. Complete them before proceeding."));
  }
}
