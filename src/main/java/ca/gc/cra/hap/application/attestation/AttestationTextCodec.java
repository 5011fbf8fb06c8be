package ca.gc.cra.hap.application.attestation;

import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fenced plaintext form of an attestation for pull-request comments.
 *
 * <pre>
 * ---BEGIN HAP_ATTESTATION v=1---
 * profile=deploy-gate@0.3
 * domain=engineering
 * ...
 * blob=&lt;base64url&gt;
 * ---END HAP_ATTESTATION---
 * </pre>
 *
 * <p>Decoding never throws: anything not shaped like a complete block yields empty. Comments are
 * untrusted input.</p>
 *
 * @since 0.3.0
 */
public final class AttestationTextCodec {
  public static final String BEGIN = "---BEGIN HAP_ATTESTATION v=1---";
  public static final String END = "---END HAP_ATTESTATION---";

  private static final Logger log = LoggerFactory.getLogger(AttestationTextCodec.class);

  private static final List<String> V02_KEYS =
      List.of("profile", "role", "env", "path", "sha", "frame_hash", "disclosure_hash", "blob");
  private static final List<String> V03_KEYS =
      List.of("profile", "domain", "env", "path", "sha", "frame_hash", "domain_disclosure_hash", "blob");

  /**
   * Renders a block in the fixed key order of its version.
   *
   * @param block block to render
   * @return fenced text without a trailing newline
   */
  public String encode(AttestationBlock block) {
    boolean v03 = block.version() == ProtocolVersion.V0_3;
    List<String> values = List.of(
        block.profile(), block.domain(), block.env(), block.path(), block.sha(),
        block.frameHash(), block.disclosureHash(), block.blob());
    List<String> keys = v03 ? V03_KEYS : V02_KEYS;
    StringBuilder out = new StringBuilder(BEGIN).append('\n');
    for (int i = 0; i < keys.size(); i++) {
      out.append(keys.get(i)).append('=').append(values.get(i)).append('\n');
    }
    return out.append(END).toString();
  }

  /**
   * Extracts the first block from a comment body.
   *
   * @param comment comment text; may be {@code null}
   * @return parsed block, or empty when absent or invalid
   */
  public Optional<AttestationBlock> decode(String comment) {
    if (comment == null) {
      return Optional.empty();
    }
    int begin = comment.indexOf(BEGIN);
    if (begin < 0) {
      return Optional.empty();
    }
    int end = comment.indexOf(END, begin + BEGIN.length());
    if (end < 0) {
      return Optional.empty();
    }
    String body = comment.substring(begin + BEGIN.length(), end);
    Map<String, String> data = new HashMap<>();
    for (String rawLine : body.split("\n")) {
      String line = rawLine.trim();
      if (line.isEmpty()) {
        continue;
      }
      int eq = line.indexOf('=');
      if (eq < 0) {
        log.debug("Rejecting attestation block: line without '='");
        return Optional.empty();
      }
      String key = line.substring(0, eq);
      if (data.put(key, line.substring(eq + 1)) != null) {
        log.debug("Rejecting attestation block: duplicate key {}", key);
        return Optional.empty();
      }
    }

    ProtocolVersion version;
    if (data.containsKey("domain") && data.containsKey("domain_disclosure_hash")) {
      version = ProtocolVersion.V0_3;
    } else if (data.containsKey("role") && data.containsKey("disclosure_hash")) {
      version = ProtocolVersion.V0_2;
    } else {
      return Optional.empty();
    }
    List<String> keys = version == ProtocolVersion.V0_3 ? V03_KEYS : V02_KEYS;
    for (String key : keys) {
      String value = data.get(key);
      if (value == null || value.isEmpty()) {
        log.debug("Rejecting attestation block: missing {}", key);
        return Optional.empty();
      }
    }
    return Optional.of(new AttestationBlock(
        version,
        data.get("profile"),
        data.get(keys.get(1)),
        data.get("env"),
        data.get("path"),
        data.get("sha"),
        data.get("frame_hash"),
        data.get(keys.get(6)),
        data.get("blob")));
  }

  /**
   * Collects every valid block from a list of comments.
   *
   * @param comments comment bodies
   * @return valid blocks in comment order
   */
  public List<AttestationBlock> decodeAll(List<String> comments) {
    List<AttestationBlock> blocks = new ArrayList<>();
    for (String comment : comments) {
      decode(comment).ifPresent(blocks::add);
    }
    return blocks;
  }
}
