package ca.gc.cra.hap.domain.disclosure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * v0.3 disclosure content for a single domain. Values are either {@link String} or
 * {@code List<String>}; anything else is rejected on construction.
 *
 * @param domain domain name, e.g. {@code engineering}
 * @param fields field name to value
 * @since 0.3.0
 */
public record DomainDisclosure(String domain, Map<String, Object> fields) {

  public DomainDisclosure {
    Objects.requireNonNull(domain, "domain");
    Map<String, Object> copy = new LinkedHashMap<>();
    Objects.requireNonNull(fields, "fields").forEach((key, value) -> {
      Objects.requireNonNull(key, "field name");
      copy.put(key, copyValue(key, value));
    });
    fields = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns a text field.
   *
   * @param name field name
   * @return value, or {@code null} when absent or not text
   */
  public String text(String name) {
    return fields.get(name) instanceof String value ? value : null;
  }

  private static Object copyValue(String key, Object value) {
    if (value instanceof String) {
      return value;
    }
    if (value instanceof List<?> list) {
      for (Object element : list) {
        if (!(element instanceof String)) {
          throw new IllegalArgumentException("field " + key + " must contain only strings");
        }
      }
      return List.copyOf(list);
    }
    throw new IllegalArgumentException("field " + key + " must be a string or a list of strings");
  }
}
