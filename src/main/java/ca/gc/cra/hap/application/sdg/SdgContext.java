package ca.gc.cra.hap.application.sdg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Review context the SDG predicates read. Structural fields may back hard stops; the two text fields
 * may only back warnings.
 *
 * @param affectedDomains domains the change touches
 * @param declaredDecisionOwnerScopes domains with a declared decision owner
 * @param frameHashes frame hashes reviewers committed to
 * @param tradeoffMode rollout mode selected in the UI, or {@code null}
 * @param executionPath execution path named in the frame
 * @param decisionFilePresent whether {@code .hap/decision.json} was found
 * @param missingDisclosureFields {@code domain.field} entries missing from the decision file
 * @param objectiveText stated objective (free text)
 * @param diffSummary summary of the diff (free text)
 * @since 0.3.0
 */
public record SdgContext(
    Set<String> affectedDomains,
    Set<String> declaredDecisionOwnerScopes,
    List<String> frameHashes,
    TradeoffMode tradeoffMode,
    String executionPath,
    boolean decisionFilePresent,
    List<String> missingDisclosureFields,
    String objectiveText,
    String diffSummary) {

  public SdgContext {
    affectedDomains = affectedDomains == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(affectedDomains));
    declaredDecisionOwnerScopes = declaredDecisionOwnerScopes == null
        ? Set.of()
        : Collections.unmodifiableSet(new TreeSet<>(declaredDecisionOwnerScopes));
    frameHashes = frameHashes == null ? List.of() : List.copyOf(frameHashes);
    missingDisclosureFields = missingDisclosureFields == null ? List.of() : List.copyOf(missingDisclosureFields);
    objectiveText = objectiveText == null ? "" : objectiveText;
    diffSummary = diffSummary == null ? "" : diffSummary;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Derives affected domains from changed file paths. Every change affects engineering; paths naming
   * auth/security, billing/payment, or deploy/infra add security, finance, or infrastructure.
   *
   * @param changedPaths repository-relative paths
   * @return affected domains, sorted
   */
  public static Set<String> affectedDomainsFromPaths(Collection<String> changedPaths) {
    Set<String> domains = new TreeSet<>();
    domains.add("engineering");
    for (String path : changedPaths) {
      String lower = path.toLowerCase(Locale.ROOT);
      if (lower.contains("auth") || lower.contains("security")) {
        domains.add("security");
      }
      if (lower.contains("billing") || lower.contains("payment")) {
        domains.add("finance");
      }
      if (lower.contains("deploy") || lower.contains("infra")) {
        domains.add("infrastructure");
      }
    }
    return domains;
  }

  /** Fluent builder; unset collections default to empty. */
  public static final class Builder {
    private Set<String> affectedDomains = Set.of();
    private Set<String> declaredDecisionOwnerScopes = Set.of();
    private final List<String> frameHashes = new ArrayList<>();
    private TradeoffMode tradeoffMode;
    private String executionPath;
    private boolean decisionFilePresent = true;
    private List<String> missingDisclosureFields = List.of();
    private String objectiveText;
    private String diffSummary;

    private Builder() {}

    public Builder affectedDomains(Collection<String> value) {
      this.affectedDomains = Set.copyOf(value);
      return this;
    }

    public Builder declaredDecisionOwnerScopes(Collection<String> value) {
      this.declaredDecisionOwnerScopes = Set.copyOf(value);
      return this;
    }

    public Builder frameHashes(Collection<String> value) {
      this.frameHashes.clear();
      this.frameHashes.addAll(value);
      return this;
    }

    public Builder tradeoffMode(TradeoffMode value) {
      this.tradeoffMode = value;
      return this;
    }

    public Builder executionPath(String value) {
      this.executionPath = value;
      return this;
    }

    public Builder decisionFilePresent(boolean value) {
      this.decisionFilePresent = value;
      return this;
    }

    public Builder missingDisclosureFields(Collection<String> value) {
      this.missingDisclosureFields = List.copyOf(value);
      return this;
    }

    public Builder objectiveText(String value) {
      this.objectiveText = value;
      return this;
    }

    public Builder diffSummary(String value) {
      this.diffSummary = value;
      return this;
    }

    public SdgContext build() {
      return new SdgContext(
          affectedDomains,
          declaredDecisionOwnerScopes,
          frameHashes,
          tradeoffMode,
          executionPath,
          decisionFilePresent,
          missingDisclosureFields,
          objectiveText,
          diffSummary);
    }
  }
}
