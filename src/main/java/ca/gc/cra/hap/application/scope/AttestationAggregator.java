package ca.gc.cra.hap.application.scope;

import ca.gc.cra.hap.application.attestation.AttestationTextCodec;
import ca.gc.cra.hap.application.attestation.AttestationVerifier;
import ca.gc.cra.hap.application.attestation.VerifiedAttestation;
import ca.gc.cra.hap.application.canonical.FrameCanonicalizer;
import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.attestation.AttestedScope;
import ca.gc.cra.hap.domain.error.ProtocolException;
import ca.gc.cra.hap.domain.frame.Frame;
import ca.gc.cra.hap.domain.profile.FrameKeys;
import ca.gc.cra.hap.domain.profile.Profile;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Collects attestation blocks posted as comments on one commit and computes
 * multi-party coverage.
 * <p><strong>Filtering:</strong> the expected frame hash is recomputed from the commit's frame. A block
 * counts only when its sha, profile, path, and declared frame hash match, and, with a verifier
 * configured, its blob verifies against the recomputed frame hash. Verified blocks contribute the
 * scopes from their signed payload rather than the plaintext keys, so a blob signed for another
 * frame never counts however its block is labelled.</p>
 * <p><strong>Determinism:</strong> the result depends on the set of blocks, never their order.</p>
 *
 * @since 0.3.0
 */
public final class AttestationAggregator {
  private static final Logger log = LoggerFactory.getLogger(AttestationAggregator.class);
  private static final Comparator<AttestedScope> SCOPE_ORDER = Comparator
      .comparing(AttestedScope::domain)
      .thenComparing(AttestedScope::env)
      .thenComparing(scope -> scope.did() == null ? "" : scope.did());

  private final AttestationTextCodec textCodec;
  private final AttestationVerifier verifier;

  /**
   * Creates an aggregator.
   *
   * @param textCodec block parser
   * @param verifier blob verifier, or {@code null} to trust plaintext blocks
   */
  public AttestationAggregator(AttestationTextCodec textCodec, AttestationVerifier verifier) {
    this.textCodec = Objects.requireNonNull(textCodec, "textCodec");
    this.verifier = verifier;
  }

  /**
   * Aggregates coverage for one commit.
   *
   * @param frame frame of the commit being deployed; supplies sha and path
   * @param profile governing profile
   * @param comments comment bodies
   * @return coverage plus the blocks and frame hashes considered
   * @throws ca.gc.cra.hap.domain.error.ValidationException when the frame is invalid for the profile
   */
  public AggregatedCoverage aggregate(Frame frame, Profile profile, List<String> comments) {
    String expectedFrameHash = FrameCanonicalizer.frameHash(frame, profile);
    String sha = frame.get(FrameKeys.SHA);
    String pathId = frame.get(FrameKeys.PATH);
    profile.executionPath(pathId);
    List<AttestationBlock> blocks = textCodec.decodeAll(comments);
    TreeSet<String> frameHashes = new TreeSet<>();
    TreeMap<String, AttestationBlock> accepted = new TreeMap<>();
    TreeSet<AttestedScope> scopes = new TreeSet<>(SCOPE_ORDER);
    int rejected = 0;
    for (AttestationBlock block : blocks) {
      if (!block.sha().equals(sha) || !block.profile().equals(profile.id())) {
        rejected++;
        continue;
      }
      frameHashes.add(block.frameHash());
      if (!block.path().equals(pathId) || !block.frameHash().equals(expectedFrameHash)) {
        rejected++;
        continue;
      }
      List<AttestedScope> blockScopes = scopesOf(block, profile, expectedFrameHash);
      if (blockScopes.isEmpty()) {
        rejected++;
        continue;
      }
      scopes.addAll(blockScopes);
      accepted.putIfAbsent(block.blob(), block);
    }
    TreeSet<String> domains = new TreeSet<>();
    scopes.forEach(scope -> domains.add(scope.domain()));
    CoverageResult coverage = ScopeSatisfier.check(profile, pathId, new ArrayList<>(scopes));
    log.debug("Aggregated {} blocks for sha={} path={} frame={}: domains={} satisfied={}",
        blocks.size(), sha, pathId, expectedFrameHash, domains, coverage.satisfied());
    return new AggregatedCoverage(
        coverage, expectedFrameHash, domains, frameHashes, new ArrayList<>(accepted.values()), rejected);
  }

  private List<AttestedScope> scopesOf(AttestationBlock block, Profile profile, String expectedFrameHash) {
    if (verifier == null) {
      return List.of(new AttestedScope(block.domain(), block.env(), null));
    }
    try {
      VerifiedAttestation verified = verifier.verify(block.blob(), expectedFrameHash);
      if (!verified.payload().profileId().equals(profile.id())) {
        log.info("Skipping block for domain={}: payload profile {} differs", block.domain(),
            verified.payload().profileId());
        return List.of();
      }
      return verified.payload().scopes();
    } catch (ProtocolException ex) {
      log.info("Skipping block for domain={}: {}", block.domain(), ex.code());
      return List.of();
    }
  }
}
