package ca.gc.cra.hap.application.sdg;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a review context from YAML.
 *
 * <pre>
 * changed_paths: [src/auth/login.ts]        # used when affected_domains is absent
 * affected_domains: [engineering, security]
 * declared_decision_owner_scopes: [engineering]
 * frame_hashes: [sha256:..., sha256:...]
 * tradeoff_mode: canary
 * execution_path: deploy-prod-canary
 * decision_file_present: true
 * missing_disclosure_fields: []
 * objective_text: ...
 * diff_summary: ...
 * </pre>
 *
 * @since 0.3.0
 */
public final class SdgContextLoader {

  /**
   * Loads a context.
   *
   * @param path YAML file
   * @return builder pre-filled from the file, so callers can add derived facts
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the file is malformed
   */
  public SdgContext.Builder load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("SDG context file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object rootObj = new Yaml().load(reader);
      SdgContext.Builder builder = SdgContext.builder();
      if (rootObj == null) {
        return builder;
      }
      if (!(rootObj instanceof Map<?, ?> root)) {
        throw new IllegalArgumentException("SDG context must be a mapping");
      }
      List<String> affected = strings(root.get("affected_domains"), "affected_domains");
      if (root.containsKey("affected_domains")) {
        builder.affectedDomains(affected);
      } else if (root.containsKey("changed_paths")) {
        builder.affectedDomains(
            SdgContext.affectedDomainsFromPaths(strings(root.get("changed_paths"), "changed_paths")));
      }
      builder.declaredDecisionOwnerScopes(
          strings(root.get("declared_decision_owner_scopes"), "declared_decision_owner_scopes"));
      builder.frameHashes(strings(root.get("frame_hashes"), "frame_hashes"));
      Object mode = root.get("tradeoff_mode");
      if (mode != null) {
        builder.tradeoffMode(TradeoffMode.parse(mode.toString()));
      }
      builder.executionPath(text(root.get("execution_path")));
      Object present = root.get("decision_file_present");
      if (present != null) {
        builder.decisionFilePresent(toBoolean(present, "decision_file_present"));
      }
      builder.missingDisclosureFields(strings(root.get("missing_disclosure_fields"), "missing_disclosure_fields"));
      builder.objectiveText(text(root.get("objective_text")));
      builder.diffSummary(text(root.get("diff_summary")));
      return builder;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML SDG context at " + path, ex);
    }
  }

  private static List<String> strings(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof Iterable<?> iterable)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> values = new ArrayList<>();
    for (Object item : iterable) {
      if (item != null) {
        values.add(item.toString());
      }
    }
    return values;
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }

  private static boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      return Boolean.parseBoolean(str.trim());
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }
}
