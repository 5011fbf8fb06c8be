package ca.gc.cra.hap.domain.profile;

import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ProtocolException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of profiles by id.
 *
 * @since 0.3.0
 */
public final class ProfileRegistry {
  private static final ProfileRegistry DEFAULT = createDefault();

  private final Map<String, Profile> profiles;
  private final String latestId;

  /**
   * Creates a registry.
   *
   * @param profiles profiles keyed by id
   * @param latestId id returned by {@link #latest()}; must be registered
   */
  public ProfileRegistry(Map<String, Profile> profiles, String latestId) {
    Map<String, Profile> copy = new LinkedHashMap<>();
    Objects.requireNonNull(profiles, "profiles").forEach((id, profile) -> {
      if (!id.equals(profile.id())) {
        throw new IllegalArgumentException("profile registered under foreign id: " + id);
      }
      copy.put(id, profile);
    });
    if (!copy.containsKey(latestId)) {
      throw new IllegalArgumentException("latest profile not registered: " + latestId);
    }
    this.profiles = Collections.unmodifiableMap(copy);
    this.latestId = latestId;
  }

  private static ProfileRegistry createDefault() {
    Map<String, Profile> builtIn = new LinkedHashMap<>();
    builtIn.put(DeployGateProfiles.V02_ID, DeployGateProfiles.v02());
    builtIn.put(DeployGateProfiles.V03_ID, DeployGateProfiles.v03());
    return new ProfileRegistry(builtIn, DeployGateProfiles.V03_ID);
  }

  /**
   * Returns the registry holding the built-in deploy-gate profiles.
   *
   * @return shared default registry
   */
  public static ProfileRegistry defaults() {
    return DEFAULT;
  }

  public Optional<Profile> get(String id) {
    return Optional.ofNullable(id == null ? null : profiles.get(id));
  }

  /**
   * Resolves a profile or fails.
   *
   * @param id profile identifier
   * @return the profile
   * @throws ProtocolException {@link ErrorCode#UNKNOWN_PROFILE} when not registered
   */
  public Profile require(String id) {
    return get(id).orElseThrow(
        () -> new ProtocolException(ErrorCode.UNKNOWN_PROFILE, "unknown profile: " + id));
  }

  public Profile latest() {
    return profiles.get(latestId);
  }

  public Set<String> ids() {
    return profiles.keySet();
  }
}
