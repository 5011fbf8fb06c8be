package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.application.canonical.ContentHasher;
import ca.gc.cra.hap.application.json.JsonSupport;
import ca.gc.cra.hap.domain.attestation.Attestation;
import ca.gc.cra.hap.domain.attestation.AttestationHeader;
import ca.gc.cra.hap.domain.attestation.AttestationPayload;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque blob form of an attestation: compact JSON {@code {header, payload, signature}} encoded as
 * URL-safe base64 without padding.
 *
 * @since 0.3.0
 */
public final class AttestationBlobCodec {
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final JsonSupport json;
  private final AttestationPayloadCodec payloads;

  public AttestationBlobCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
    this.payloads = new AttestationPayloadCodec(json);
  }

  public AttestationPayloadCodec payloads() {
    return payloads;
  }

  /**
   * Encodes an attestation. The payload is embedded verbatim from {@link Attestation#payloadJson()}.
   *
   * @param attestation signed attestation
   * @return blob text
   */
  public String encode(Attestation attestation) {
    AttestationHeader header = attestation.header();
    String document = json.writeObject(generator -> {
      generator.writeObjectFieldStart("header");
      generator.writeStringField("typ", header.typ());
      generator.writeStringField("alg", header.alg());
      generator.writeStringField("kid", header.kid());
      generator.writeEndObject();
      generator.writeFieldName("payload");
      generator.writeRawValue(attestation.payloadJson());
      generator.writeStringField("signature", attestation.signature());
    });
    return ENCODER.encodeToString(document.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decodes a blob without checking its signature.
   *
   * @param blob blob text
   * @return decoded attestation retaining the exact payload text
   * @throws ProtocolException {@link ErrorCode#MALFORMED_ATTESTATION} on any decoding failure
   */
  public Attestation decode(String blob) {
    if (blob == null || blob.isBlank()) {
      throw malformed("blob is empty", null);
    }
    try {
      String document = new String(DECODER.decode(blob.trim()), StandardCharsets.UTF_8);
      Map<String, String> members = json.rawMembers(document);
      String headerJson = require(members, "header");
      String payloadJson = require(members, "payload");
      String signatureJson = require(members, "signature");

      Map<String, Object> headerMembers = json.parseObject(headerJson);
      AttestationHeader header = new AttestationHeader(
          text(headerMembers.get("typ"), "header.typ"),
          text(headerMembers.get("alg"), "header.alg"),
          text(headerMembers.get("kid"), "header.kid"));
      if (!AttestationHeader.TYPE.equals(header.typ())) {
        throw malformed("unexpected token type " + header.typ(), null);
      }
      if (!AttestationHeader.ALGORITHM.equals(header.alg())) {
        throw malformed("unsupported algorithm " + header.alg(), null);
      }
      String signature = text(json.parse(signatureJson), "signature");
      AttestationPayload payload = payloads.read(payloadJson);
      return new Attestation(header, payload, signature, payloadJson);
    } catch (IllegalArgumentException ex) {
      throw malformed(ex.getMessage(), ex);
    }
  }

  /**
   * Computes the attestation identifier used by executors: the content hash of the blob text.
   *
   * @param blob blob text
   * @return {@code sha256:} prefixed hash
   */
  public static String attestationId(String blob) {
    return ContentHasher.hash(blob.trim());
  }

  private static String require(Map<String, String> members, String name) {
    String value = members.get(name);
    if (value == null) {
      throw new IllegalArgumentException("missing member " + name);
    }
    return value;
  }

  private static String text(Object value, String name) {
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException(name + " must be a string");
  }

  private static ProtocolException malformed(String detail, Throwable cause) {
    return new ProtocolException(ErrorCode.MALFORMED_ATTESTATION, "malformed attestation: " + detail, cause);
  }
}
