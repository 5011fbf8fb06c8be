package ca.gc.cra.hap.application.sdg;

import ca.gc.cra.hap.domain.profile.DeployGateProfiles;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed catalogue of detection rules an SDG may reference, keyed by their expression text.
 *
 * <p>Structural predicates read only sets, hashes, flags, and identifiers. The single semantic
 * predicate compares free text and is therefore never allowed to back a hard stop.</p>
 *
 * @since 0.3.0
 */
public enum DetectionPredicate {
  AFFECTED_DOMAINS_NOT_DECLARED("affected_domains ⊄ declared_decision_owner_scopes", true) {
    @Override
    public boolean test(SdgContext context) {
      return !context.declaredDecisionOwnerScopes().containsAll(context.affectedDomains());
    }
  },
  MULTIPLE_FRAME_HASHES("count(unique(frame_hashes)) > 1", true) {
    @Override
    public boolean test(SdgContext context) {
      return new HashSet<>(context.frameHashes()).size() > 1;
    }
  },
  CANARY_PATH_MISMATCH("tradeoff_mode=canary AND execution_path!=deploy-prod-canary", true) {
    @Override
    public boolean test(SdgContext context) {
      return context.tradeoffMode() == TradeoffMode.CANARY
          && !DeployGateProfiles.CANARY.equals(context.executionPath());
    }
  },
  FULL_PATH_MISMATCH("tradeoff_mode=full AND execution_path!=deploy-prod-full", true) {
    @Override
    public boolean test(SdgContext context) {
      return context.tradeoffMode() == TradeoffMode.FULL
          && !DeployGateProfiles.FULL.equals(context.executionPath());
    }
  },
  DECISION_FILE_ABSENT("decision_file_present=false", true) {
    @Override
    public boolean test(SdgContext context) {
      return !context.decisionFilePresent();
    }
  },
  DISCLOSURE_FIELDS_MISSING("count(missing_disclosure_fields) > 0", true) {
    @Override
    public boolean test(SdgContext context) {
      return !context.missingDisclosureFields().isEmpty();
    }
  },
  OBJECTIVE_DIFF_DISTANCE("semantic_distance(objective_text, diff_summary) > threshold", false) {
    @Override
    public boolean test(SdgContext context) {
      return termOverlapBelowThreshold(context.objectiveText(), context.diffSummary());
    }
  };

  static final double OVERLAP_THRESHOLD = 0.2;

  private final String expression;
  private final boolean structural;

  DetectionPredicate(String expression, boolean structural) {
    this.expression = expression;
    this.structural = structural;
  }

  public String expression() {
    return expression;
  }

  public boolean structural() {
    return structural;
  }

  /**
   * Evaluates the predicate. Must not mutate the context.
   *
   * @param context review context
   * @return {@code true} when the concern is present
   */
  public abstract boolean test(SdgContext context);

  /**
   * Resolves a predicate from its expression text.
   *
   * @param expression rule expression, compared after trimming
   * @return matching predicate, or empty when not in the catalogue
   */
  public static Optional<DetectionPredicate> fromExpression(String expression) {
    if (expression == null) {
      return Optional.empty();
    }
    String trimmed = expression.trim();
    for (DetectionPredicate predicate : values()) {
      if (predicate.expression.equals(trimmed)) {
        return Optional.of(predicate);
      }
    }
    return Optional.empty();
  }

  /**
   * Term-overlap heuristic: the share of objective terms longer than three characters that also
   * appear in the diff summary. Fires when the share is below {@link #OVERLAP_THRESHOLD}. Either
   * text being empty never fires.
   */
  static boolean termOverlapBelowThreshold(String objective, String diff) {
    if (objective == null || objective.isEmpty() || diff == null || diff.isEmpty()) {
      return false;
    }
    String diffLower = diff.toLowerCase(Locale.ROOT);
    int terms = 0;
    int matches = 0;
    for (String term : objective.toLowerCase(Locale.ROOT).split("\\W+")) {
      if (term.length() <= 3) {
        continue;
      }
      terms++;
      if (diffLower.contains(term)) {
        matches++;
      }
    }
    double ratio = terms == 0 ? 1.0 : (double) matches / terms;
    return ratio < OVERLAP_THRESHOLD;
  }
}
