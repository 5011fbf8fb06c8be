package ca.gc.cra.hap.domain.profile;

import static ca.gc.cra.hap.domain.profile.DisclosureFieldDefinition.list;
import static ca.gc.cra.hap.domain.profile.DisclosureFieldDefinition.text;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in deploy-gate profile definitions.
 *
 * @since 0.3.0
 */
public final class DeployGateProfiles {
  public static final String V02_ID = "deploy-gate@0.2";
  public static final String V03_ID = "deploy-gate@0.3";

  public static final String CANARY = "deploy-prod-canary";
  public static final String FULL = "deploy-prod-full";
  public static final String USER_FACING = "deploy-prod-user-facing";
  public static final String SECURITY = "deploy-prod-security";

  private static final TtlPolicy TTL = new TtlPolicy(3600, 86400);
  private static final List<ScopeSubstitution> SUBSTITUTIONS =
      List.of(new ScopeSubstitution("security", "release_management"));

  private DeployGateProfiles() {
    // Utility
  }

  /**
   * Builds the {@code deploy-gate@0.2} profile.
   *
   * @return v0.2 profile
   */
  public static Profile v02() {
    Map<String, Map<String, DisclosureFieldDefinition>> domains = new LinkedHashMap<>();
    domains.put("engineering", rationale(
        "What technical problem does this change solve?",
        "What outcome are you approving from an engineering perspective?",
        "What technical risks or costs are you accepting?"));
    domains.put("release_management", rationale(
        "What release/operational problem does this address?",
        "What outcome are you approving from a release perspective?",
        "What operational risks or costs are you accepting?"));

    Map<String, DisclosureFieldDefinition> shared = new LinkedHashMap<>();
    shared.put("repo", text("Repository being deployed"));
    shared.put("sha", text("Commit SHA being deployed"));
    shared.put("changed_paths", list("Files changed in this commit"));
    shared.put("risk_flags", list("Detected risk indicators"));

    Map<String, ExecutionPath> paths = new LinkedHashMap<>();
    putPath(paths, CANARY, "Canary deployment to production (limited rollout)", "engineering");
    putPath(paths, FULL, "Full deployment to production (immediate rollout)",
        "engineering", "release_management");

    return new Profile(
        V02_ID,
        ProtocolVersion.V0_2,
        List.of("frame", "problem", "objective", "tradeoff", "commitment", "decision_owner"),
        frameSchema(true),
        new DisclosureSchema(shared, domains),
        paths,
        SUBSTITUTIONS,
        TTL,
        List.of(
            "deploy/missing_decision_owner@1.0",
            "deploy/commitment_mismatch@1.0",
            "deploy/tradeoff_execution_mismatch@1.0",
            "deploy/objective_diff_mismatch@1.0"));
  }

  /**
   * Builds the {@code deploy-gate@0.3} profile.
   *
   * @return v0.3 profile
   */
  public static Profile v03() {
    Map<String, Map<String, DisclosureFieldDefinition>> domains = new LinkedHashMap<>();

    Map<String, DisclosureFieldDefinition> engineering = new LinkedHashMap<>();
    engineering.put("diff_summary", text("Summary of the changes being deployed", 10, 1000));
    engineering.put("changed_paths", list("List of files changed in this commit"));
    engineering.put("test_status", text("Status of automated tests", 10, 500));
    engineering.put("rollback_strategy", text("How to revert if issues are discovered", 10, 500));
    domains.put("engineering", engineering);

    Map<String, DisclosureFieldDefinition> release = new LinkedHashMap<>();
    release.put("deployment_window", text("When this deployment should occur", 5, 200));
    release.put("rollback_plan", text("Operational rollback procedure", 10, 500));
    release.put("monitoring_dashboards", text("Links to monitoring dashboards", 3, 500));
    domains.put("release_management", release);

    Map<String, DisclosureFieldDefinition> marketing = new LinkedHashMap<>();
    marketing.put("behavior_change_summary", text("How user-visible behavior changes", 10, 1000));
    marketing.put("demo_url", text("Preview URL to see the changes", 5, 500));
    marketing.put("rollout_plan", text("How the change will be rolled out to users", 10, 500));
    domains.put("marketing", marketing);

    Map<String, DisclosureFieldDefinition> security = new LinkedHashMap<>();
    security.put("affected_surfaces", list("Security surfaces affected by this change"));
    security.put("threat_category", text("Category of security concern", 5, 200));
    security.put("mitigation_path", text("How security risks are mitigated", 10, 500));
    domains.put("security", security);

    Map<String, DisclosureFieldDefinition> shared = new LinkedHashMap<>();
    shared.put("repo", text("Repository being deployed"));
    shared.put("sha", text("Commit SHA being deployed"));

    Map<String, ExecutionPath> paths = new LinkedHashMap<>();
    putPath(paths, CANARY, "Canary deployment to production (limited rollout)", "engineering");
    putPath(paths, FULL, "Full deployment to production (immediate rollout)",
        "engineering", "release_management");
    putPath(paths, USER_FACING, "User-facing feature deployment", "engineering", "marketing");
    putPath(paths, SECURITY, "Security-sensitive deployment", "engineering", "security");

    return new Profile(
        V03_ID,
        ProtocolVersion.V0_3,
        List.of("frame", "decision_owner", "disclosure_review", "commitment"),
        frameSchema(false),
        new DisclosureSchema(shared, domains),
        paths,
        SUBSTITUTIONS,
        TTL,
        List.of(
            "deploy/missing_decision_owner@1.0",
            "deploy/commitment_mismatch@1.0",
            "deploy/decision_file_missing@1.0",
            "deploy/disclosure_incomplete@1.0"));
  }

  private static FrameSchema frameSchema(boolean withDisclosureHash) {
    Map<String, FrameFieldDefinition> fields = new LinkedHashMap<>();
    fields.put(FrameKeys.REPO, FrameFieldDefinition.required(
        "Repository slug (owner/name)", "^[a-z0-9_.-]+/[a-z0-9_.-]+$"));
    fields.put(FrameKeys.SHA, FrameFieldDefinition.required(
        "Git commit SHA (40 hex characters)", "^[a-f0-9]{40}$"));
    fields.put(FrameKeys.ENV, FrameFieldDefinition.required(
        "Deployment environment", "^(prod|staging)$", List.of("prod", "staging")));
    fields.put(FrameKeys.PROFILE, FrameFieldDefinition.required(
        "Profile identifier with version", "^[a-z0-9_-]+@[0-9]+\\.[0-9]+$"));
    fields.put(FrameKeys.PATH, FrameFieldDefinition.required(
        "Execution path identifier", "^[a-z0-9_-]+$"));
    if (withDisclosureHash) {
      fields.put(FrameKeys.DISCLOSURE_HASH, FrameFieldDefinition.required(
          "SHA-256 hash of the disclosure content", "^sha256:[a-f0-9]{64}$"));
    }
    return new FrameSchema(List.copyOf(fields.keySet()), fields);
  }

  private static Map<String, DisclosureFieldDefinition> rationale(
      String problem, String objective, String tradeoffs) {
    Map<String, DisclosureFieldDefinition> fields = new LinkedHashMap<>();
    fields.put("problem", text(problem, 20, 500));
    fields.put("objective", text(objective, 20, 500));
    fields.put("tradeoffs", text(tradeoffs, 20, 500));
    return fields;
  }

  private static void putPath(
      Map<String, ExecutionPath> paths, String id, String description, String... domains) {
    List<ScopeRequirement> scopes = new ArrayList<>();
    for (String domain : domains) {
      scopes.add(new ScopeRequirement(domain, "prod"));
    }
    paths.put(id, new ExecutionPath(id, description, scopes));
  }
}
