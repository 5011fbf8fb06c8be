package ca.gc.cra.hap.domain.profile;

import java.util.Objects;

/**
 * One-way rule letting an attestation from {@code substitute} satisfy a requirement for
 * {@code standsInFor} in the same environment.
 *
 * @param substitute domain whose attestation is accepted
 * @param standsInFor domain whose requirement it satisfies
 * @since 0.3.0
 */
public record ScopeSubstitution(String substitute, String standsInFor) {

  public ScopeSubstitution {
    Objects.requireNonNull(substitute, "substitute");
    Objects.requireNonNull(standsInFor, "standsInFor");
    if (substitute.equals(standsInFor)) {
      throw new IllegalArgumentException("substitution must name two different domains");
    }
  }
}
