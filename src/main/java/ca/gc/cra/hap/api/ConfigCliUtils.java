package ca.gc.cra.hap.api;

import java.util.Map;

/**
 * Helpers for mixing CLI arguments with YAML configuration.
 */
final class ConfigCliUtils {
  static final String DEFAULT_CONFIG = "hap.yaml";

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return explicit config path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
