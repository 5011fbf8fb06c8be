package ca.gc.cra.hap.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesObjectsInDocumentOrder() {
    Map<String, Object> parsed = json.parseObject("""
        { "b": 1, "a": [true, null, "x"], "c": { "d": 2.5 } }
        """);

    assertEquals(List.of("b", "a", "c"), List.copyOf(parsed.keySet()));
    assertEquals(1, ((Number) parsed.get("b")).intValue());
    assertEquals(Arrays.asList(true, null, "x"), parsed.get("a"));
  }

  @Test
  void writesCompactlyWithOptionalKeySorting() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("z", "last");
    value.put("a", Map.of("n", 1L));
    value.put("m", List.of("q", "p"));

    assertEquals("{\"z\":\"last\",\"a\":{\"n\":1},\"m\":[\"q\",\"p\"]}", json.write(value, false));
    assertEquals("{\"a\":{\"n\":1},\"m\":[\"q\",\"p\"],\"z\":\"last\"}", json.write(value, true));
  }

  @Test
  void rawMembersKeepVerbatimNestedText() {
    Map<String, String> members = json.rawMembers("{\"payload\":{\"b\":1, \"a\":\"\\u0041\"},\"signature\":\"c2ln\"}");

    assertEquals("{\"b\":1, \"a\":\"\\u0041\"}", members.get("payload"));
    assertEquals("\"c2ln\"", members.get("signature"));
  }

  @Test
  void rejectsDuplicatesTrailingContentAndNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("{\"a\":1,\"a\":2}"));
    assertThrows(IllegalArgumentException.class, () -> json.rawMembers("{\"a\":1,\"a\":2}"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1]"));
    assertThrows(IllegalArgumentException.class, () -> json.parse(""));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
  }

  @Test
  void writeObjectEmitsMembersInCallOrder() {
    String text = json.writeObject(generator -> {
      generator.writeStringField("typ", "HAP-attestation");
      generator.writeNumberField("n", 3);
    });

    assertEquals("{\"typ\":\"HAP-attestation\",\"n\":3}", text);
  }
}
