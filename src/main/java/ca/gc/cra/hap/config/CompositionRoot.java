package ca.gc.cra.hap.config;

import ca.gc.cra.hap.application.attestation.AttestationBlobCodec;
import ca.gc.cra.hap.application.attestation.AttestationSigner;
import ca.gc.cra.hap.application.attestation.AttestationTextCodec;
import ca.gc.cra.hap.application.attestation.AttestationVerifier;
import ca.gc.cra.hap.application.executor.ExecutorAuthorizer;
import ca.gc.cra.hap.application.json.JsonSupport;
import ca.gc.cra.hap.application.port.ClockPort;
import ca.gc.cra.hap.application.port.MetricsPort;
import ca.gc.cra.hap.application.port.PublicKeyDirectory;
import ca.gc.cra.hap.application.scope.AttestationAggregator;
import ca.gc.cra.hap.application.sdg.SdgCatalog;
import ca.gc.cra.hap.application.sdg.SdgCatalogLoader;
import ca.gc.cra.hap.domain.profile.Profile;
import ca.gc.cra.hap.domain.profile.ProfileRegistry;
import ca.gc.cra.hap.infrastructure.crypto.Ed25519SigningKeyProvider;
import ca.gc.cra.hap.infrastructure.crypto.StaticPublicKeyDirectory;
import ca.gc.cra.hap.infrastructure.decision.DecisionFileReader;
import ca.gc.cra.hap.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.hap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.hap.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires protocol services to their adapters from a {@link HapConfig}.
 * <p><strong>Keys:</strong> signing uses the configured key pair or an ephemeral one. Verification
 * uses the configured public key when one is given, so a verifier or executor needs no private key.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts down metrics export.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @since 0.3.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final HapConfig config;
  private final ProfileRegistry profiles;
  private final JsonSupport json = new JsonSupport();
  private final AttestationBlobCodec blobs = new AttestationBlobCodec(json);
  private final AttestationTextCodec textCodec = new AttestationTextCodec();
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Ed25519SigningKeyProvider signingKeys;

  public CompositionRoot(HapConfig config) {
    this(config, ProfileRegistry.defaults(), new SystemClockAdapter(), createMetrics(config));
  }

  CompositionRoot(HapConfig config, ProfileRegistry profiles, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.signingKeys = new Ed25519SigningKeyProvider(config.keyId(), config.privateKeyHex(), config.publicKeyHex());
  }

  private static MetricsPort createMetrics(HapConfig config) {
    if ("none".equals(config.metricsExporter())) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter());
  }

  public HapConfig config() {
    return config;
  }

  public ProfileRegistry profiles() {
    return profiles;
  }

  /**
   * Resolves a profile, falling back to the configured one and then the latest.
   *
   * @param requested profile id from the command line, or {@code null}
   * @return profile
   */
  public Profile profile(String requested) {
    if (requested != null && !requested.isBlank()) {
      return profiles.require(requested.trim());
    }
    return config.profileId() == null ? profiles.latest() : profiles.require(config.profileId());
  }

  public JsonSupport json() {
    return json;
  }

  public AttestationTextCodec textCodec() {
    return textCodec;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public Ed25519SigningKeyProvider signingKeys() {
    return signingKeys;
  }

  public AttestationSigner signer() {
    return new AttestationSigner(profiles, signingKeys, clock, metrics, blobs);
  }

  public PublicKeyDirectory publicKeys() {
    if (config.publicKeyHex() != null) {
      try {
        return StaticPublicKeyDirectory.ofHex(config.keyId(), config.publicKeyHex());
      } catch (IllegalArgumentException ex) {
        throw new IllegalStateException("signer.publicKeyHex is unusable", ex);
      }
    }
    return signingKeys;
  }

  public AttestationVerifier verifier() {
    return new AttestationVerifier(blobs, publicKeys(), clock, metrics);
  }

  public AttestationAggregator aggregator(boolean verifyBlobs) {
    return new AttestationAggregator(textCodec, verifyBlobs ? verifier() : null);
  }

  /**
   * Builds an authorizer pinned to a profile.
   *
   * @param expectedProfileId profile the executor accepts, or {@code null} to use the configured one
   * @return authorizer
   */
  public ExecutorAuthorizer authorizer(String expectedProfileId) {
    String expected = expectedProfileId != null ? expectedProfileId : config.profileId();
    return new ExecutorAuthorizer(verifier(), profiles, expected, metrics);
  }

  public DecisionFileReader decisionFiles() {
    return new DecisionFileReader(json);
  }

  /**
   * Returns the configured SDG catalogue, or the built-in one.
   *
   * @return catalogue
   * @throws IOException when the configured file cannot be read
   */
  public SdgCatalog sdgCatalog() throws IOException {
    if (config.sdgCatalog() == null) {
      return SdgCatalog.builtIn();
    }
    return new SdgCatalogLoader().load(List.of(config.sdgCatalog()));
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.flush();
      otel.close();
    }
  }
}
