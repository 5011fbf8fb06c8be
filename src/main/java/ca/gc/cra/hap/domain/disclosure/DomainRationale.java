package ca.gc.cra.hap.domain.disclosure;

/**
 * Free-text rationale one domain owner writes for a v0.2 disclosure. Only ever hashed.
 *
 * @param problem what problem the change solves
 * @param objective outcome being approved
 * @param tradeoffs risks or costs being accepted
 * @since 0.3.0
 */
public record DomainRationale(String problem, String objective, String tradeoffs) {}
