package ca.gc.cra.hap.domain.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered frame layout for a profile. The key order fixes the canonical form.
 *
 * @param keyOrder canonical key order
 * @param fields per-key validation rules
 * @since 0.3.0
 */
public record FrameSchema(List<String> keyOrder, Map<String, FrameFieldDefinition> fields) {

  public FrameSchema {
    keyOrder = List.copyOf(Objects.requireNonNull(keyOrder, "keyOrder"));
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    for (String key : keyOrder) {
      if (!fields.containsKey(key)) {
        throw new IllegalArgumentException("frame key without definition: " + key);
      }
    }
    if (fields.size() != keyOrder.size()) {
      throw new IllegalArgumentException("frame definitions not listed in key order");
    }
  }

  /**
   * Reports whether the schema binds a disclosure hash into the frame.
   *
   * @return {@code true} when {@code disclosure_hash} is a frame key
   */
  public boolean bindsDisclosureHash() {
    return fields.containsKey(FrameKeys.DISCLOSURE_HASH);
  }
}
