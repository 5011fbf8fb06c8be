package ca.gc.cra.hap.application.scope;

import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Coverage computed from every attestation posted for one commit.
 *
 * @param coverage scope coverage for the requested path
 * @param frameHash frame hash recomputed for the commit; every accepted block is bound to it
 * @param domains attested domains that contributed, sorted
 * @param frameHashes distinct declared frame hashes seen for the commit and profile, sorted
 * @param accepted blocks that contributed
 * @param rejected number of blocks dropped for mismatch or failed verification
 * @since 0.3.0
 */
public record AggregatedCoverage(
    CoverageResult coverage,
    String frameHash,
    SortedSet<String> domains,
    SortedSet<String> frameHashes,
    List<AttestationBlock> accepted,
    int rejected) {

  public AggregatedCoverage {
    domains = Collections.unmodifiableSortedSet(new TreeSet<>(domains));
    frameHashes = Collections.unmodifiableSortedSet(new TreeSet<>(frameHashes));
    accepted = List.copyOf(accepted);
  }

  public boolean satisfied() {
    return coverage.satisfied();
  }
}
