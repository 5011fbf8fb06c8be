package ca.gc.cra.hap.api;

import ca.gc.cra.hap.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effective options for one command: merged {@code key=value} settings plus CLI flags.
 *
 * @param values merged settings
 * @param flags normalized flags
 */
record CommandOptions(Map<String, String> values, Set<String> flags) {

  CommandOptions {
    values = Map.copyOf(values);
    flags = Set.copyOf(flags);
  }

  String get(String key) {
    String value = values.get(key);
    return value == null || value.isBlank() ? null : value.trim();
  }

  String getOrDefault(String key, String fallback) {
    String value = get(key);
    return value == null ? fallback : value;
  }

  String require(String key) {
    String value = get(key);
    if (value == null) {
      throw new IllegalArgumentException("missing required argument: " + key);
    }
    return Strings.requireNonBlank(key, value);
  }

  Long optionalLong(String key) {
    String value = get(key);
    if (value == null) {
      return null;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  List<String> list(String key) {
    return Strings.splitList(key, get(key));
  }

  boolean hasFlag(String flag) {
    return flags.contains(flag);
  }

  /**
   * Resolves a blob from {@code blob=TEXT} or {@code <key>File=PATH}.
   *
   * @param key option name, e.g. {@code blob}
   * @return blob text, trimmed
   * @throws IOException when the file cannot be read
   */
  String blob(String key) throws IOException {
    String inline = get(key);
    if (inline != null) {
      return inline;
    }
    String file = get(key + "File");
    if (file == null) {
      throw new IllegalArgumentException("missing required argument: " + key + " or " + key + "File");
    }
    return Files.readString(Path.of(file), StandardCharsets.UTF_8).trim();
  }
}
