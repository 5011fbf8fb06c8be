package ca.gc.cra.hap.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {
  private static final Set<String> EXPORTERS = Set.of("none", "otlp");

  private ConfigMerger() {}

  /**
   * Builds the effective settings for a command.
   *
   * @param command active command
   * @param yaml settings from {@code hap.yaml}, if any
   * @param cli {@code key=value} overrides
   * @param defaults embedded defaults
   * @param warn receives a note for every CLI key that overrides YAML
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String exporter = trim(effective.get(HapConfig.METRICS_EXPORTER)).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !EXPORTERS.contains(exporter)) {
      throw new IllegalArgumentException("metrics.exporter must be none or otlp (was " + exporter + ")");
    }
    boolean hasPrivate = !trim(effective.get(HapConfig.SIGNER_PRIVATE_KEY)).isEmpty();
    boolean hasPublic = !trim(effective.get(HapConfig.SIGNER_PUBLIC_KEY)).isEmpty();
    if (hasPrivate && !hasPublic) {
      throw new IllegalArgumentException("signer.publicKeyHex is required when signer.privateKeyHex is set");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
