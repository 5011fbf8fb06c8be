package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.application.json.JsonSupport;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;
import ca.gc.cra.hap.domain.attestation.AttestationPayloadV02;
import ca.gc.cra.hap.domain.attestation.AttestationPayloadV03;
import ca.gc.cra.hap.domain.attestation.DecisionOwnerScope;
import ca.gc.cra.hap.domain.attestation.ResolvedDomain;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Payload JSON in the fixed member order that is signed.
 *
 * <p>Reading throws {@link IllegalArgumentException} for any structural problem; callers map that to
 * a malformed-attestation failure.</p>
 *
 * @since 0.3.0
 */
public final class AttestationPayloadCodec {
  private final JsonSupport json;

  public AttestationPayloadCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Serializes a payload as compact JSON.
   *
   * @param payload payload to write
   * @return exact text to sign
   */
  public String write(AttestationPayload payload) {
    return json.writeObject(generator -> {
      generator.writeStringField("attestation_id", payload.attestationId());
      generator.writeStringField("version", payload.version().wire());
      generator.writeStringField("profile_id", payload.profileId());
      generator.writeStringField("frame_hash", payload.frameHash());
      if (payload instanceof AttestationPayloadV02 v02) {
        writeStrings(generator, "resolved_gates", v02.resolvedGates());
        writeStrings(generator, "decision_owners", v02.decisionOwners());
        generator.writeArrayFieldStart("decision_owner_scopes");
        for (DecisionOwnerScope scope : v02.decisionOwnerScopes()) {
          generator.writeStartObject();
          if (scope.did() != null) {
            generator.writeStringField("did", scope.did());
          }
          generator.writeStringField("domain", scope.domain());
          generator.writeStringField("env", scope.env());
          generator.writeEndObject();
        }
        generator.writeEndArray();
      } else if (payload instanceof AttestationPayloadV03 v03) {
        generator.writeArrayFieldStart("resolved_domains");
        for (ResolvedDomain domain : v03.resolvedDomains()) {
          generator.writeStartObject();
          generator.writeStringField("domain", domain.domain());
          generator.writeStringField("did", domain.did());
          generator.writeStringField("env", domain.env());
          generator.writeStringField("disclosure_hash", domain.disclosureHash());
          generator.writeEndObject();
        }
        generator.writeEndArray();
      }
      generator.writeNumberField("issued_at", payload.issuedAt());
      generator.writeNumberField("expires_at", payload.expiresAt());
    });
  }

  /**
   * Parses payload JSON.
   *
   * @param payloadJson payload text
   * @return typed payload
   * @throws IllegalArgumentException when members are missing, mistyped, or the version is unknown
   */
  public AttestationPayload read(String payloadJson) {
    Map<String, Object> members = json.parseObject(payloadJson);
    String version = string(members, "version");
    ProtocolVersion protocol = switch (version) {
      case "0.2" -> ProtocolVersion.V0_2;
      case "0.3" -> ProtocolVersion.V0_3;
      default -> throw new IllegalArgumentException("unsupported payload version " + version);
    };
    String attestationId = string(members, "attestation_id");
    String profileId = string(members, "profile_id");
    String frameHash = string(members, "frame_hash");
    long issuedAt = number(members, "issued_at");
    long expiresAt = number(members, "expires_at");
    return switch (protocol) {
      case V0_2 -> new AttestationPayloadV02(
          attestationId,
          profileId,
          frameHash,
          strings(members, "resolved_gates"),
          strings(members, "decision_owners"),
          objects(members, "decision_owner_scopes").stream()
              .map(scope -> new DecisionOwnerScope(
                  optionalString(scope, "did"), string(scope, "domain"), string(scope, "env")))
              .toList(),
          issuedAt,
          expiresAt);
      case V0_3 -> new AttestationPayloadV03(
          attestationId,
          profileId,
          frameHash,
          objects(members, "resolved_domains").stream()
              .map(domain -> new ResolvedDomain(
                  string(domain, "domain"),
                  string(domain, "did"),
                  string(domain, "env"),
                  string(domain, "disclosure_hash")))
              .toList(),
          issuedAt,
          expiresAt);
    };
  }

  private static void writeStrings(JsonGenerator generator, String name, List<String> values) throws IOException {
    generator.writeArrayFieldStart(name);
    for (String value : values) {
      generator.writeString(value);
    }
    generator.writeEndArray();
  }

  private static String string(Map<String, Object> members, String name) {
    if (members.get(name) instanceof String value) {
      return value;
    }
    throw new IllegalArgumentException("payload member " + name + " must be a string");
  }

  private static String optionalString(Map<String, Object> members, String name) {
    Object value = members.get(name);
    if (value == null) {
      return null;
    }
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException("payload member " + name + " must be a string");
  }

  private static long number(Map<String, Object> members, String name) {
    Object value = members.get(name);
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    throw new IllegalArgumentException("payload member " + name + " must be an integer");
  }

  private static List<String> strings(Map<String, Object> members, String name) {
    if (!(members.get(name) instanceof List<?> list)) {
      throw new IllegalArgumentException("payload member " + name + " must be an array");
    }
    List<String> values = new ArrayList<>();
    for (Object item : list) {
      if (!(item instanceof String text)) {
        throw new IllegalArgumentException("payload member " + name + " must hold strings");
      }
      values.add(text);
    }
    return values;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> objects(Map<String, Object> members, String name) {
    if (!(members.get(name) instanceof List<?> list)) {
      throw new IllegalArgumentException("payload member " + name + " must be an array");
    }
    List<Map<String, Object>> values = new ArrayList<>();
    for (Object item : list) {
      if (!(item instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException("payload member " + name + " must hold objects");
      }
      values.add((Map<String, Object>) map);
    }
    return values;
  }
}
