package ca.gc.cra.hap.application.sdg;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads guard definitions from YAML files.
 *
 * <pre>
 * version: 1
 * sdgs:
 *   - id: deploy/commitment_mismatch@1.0
 *     signal_intent: commitment_mismatch
 *     description: ...
 *     observable_structures: [frame_hashes]
 *     detection_rules: ["count(unique(frame_hashes)) > 1"]
 *     stop_trigger: true
 *     user_prompt: ...
 * </pre>
 *
 * @since 0.3.0
 */
public final class SdgCatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(SdgCatalogLoader.class);

  /**
   * Loads and compiles every file, in order.
   *
   * @param sources YAML files
   * @return compiled catalogue
   * @throws IOException when a file is missing or unreadable
   * @throws IllegalArgumentException when a file is malformed or a definition is invalid
   */
  public SdgCatalog load(List<Path> sources) throws IOException {
    Objects.requireNonNull(sources, "sources");
    List<SdgDefinition> definitions = new ArrayList<>();
    Set<String> ids = new LinkedHashSet<>();
    for (Path path : sources) {
      for (SdgDefinition definition : parseDocument(path)) {
        if (!ids.add(definition.id())) {
          throw new IllegalArgumentException("Duplicate SDG id detected: " + definition.id());
        }
        definitions.add(definition);
      }
    }
    SdgCatalog catalog = new SdgCatalog(SdgRuleSet.compile(definitions));
    log.info("Loaded {} SDG definitions from {} file(s)", definitions.size(), sources.size());
    return catalog;
  }

  private List<SdgDefinition> parseDocument(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("SDG file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        return List.of();
      }
      Map<String, Object> root = asMap(rootObj, "root");
      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported SDG version " + version + " in " + path);
      }
      List<SdgDefinition> definitions = new ArrayList<>();
      Object sdgsNode = root.get("sdgs");
      if (sdgsNode instanceof Iterable<?> iterable) {
        for (Object node : iterable) {
          definitions.add(parseDefinition(asMap(node, "sdg")));
        }
      } else if (sdgsNode != null) {
        throw new IllegalArgumentException("sdgs must be a list in " + path);
      }
      return definitions;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML SDGs at " + path, ex);
    }
  }

  private SdgDefinition parseDefinition(Map<String, Object> map) {
    String id = requireString(map, "id");
    Object stop = map.get("stop_trigger");
    return new SdgDefinition(
        id,
        toString(map.get("signal_intent")),
        toString(map.get("description")),
        toStringList(map.get("observable_structures"), "observable_structures"),
        toStringList(map.get("detection_rules"), "detection_rules"),
        stop != null && toBoolean(stop, "stop_trigger"),
        toString(map.get("user_prompt")));
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (node instanceof String single) {
      return List.of(single);
    }
    if (!(node instanceof Iterable<?> iterable)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> values = new ArrayList<>();
    for (Object item : iterable) {
      values.add(toString(item));
    }
    return values;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return toString(value);
  }

  private String toString(Object value) {
    return value == null ? "" : value.toString();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }

  private boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      return Boolean.parseBoolean(str.trim());
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }
}
