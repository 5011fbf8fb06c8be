package ca.gc.cra.hap.config;

import ca.gc.cra.hap.logging.Logs;
import ca.gc.cra.hap.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Effective service-provider settings.
 *
 * @param keyId signing key identifier written to blob headers
 * @param privateKeyHex raw Ed25519 private key seed, or {@code null} for an ephemeral key
 * @param publicKeyHex raw Ed25519 public key, or {@code null}
 * @param profileId profile to use, or {@code null} for the latest registered profile
 * @param sdgCatalog YAML SDG catalogue, or {@code null} for the built-in catalogue
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.3.0
 */
public record HapConfig(
    String keyId,
    String privateKeyHex,
    String publicKeyHex,
    String profileId,
    Path sdgCatalog,
    String metricsExporter) {

  public static final String SIGNER_KEY_ID = "signer.keyId";
  public static final String SIGNER_PRIVATE_KEY = "signer.privateKeyHex";
  public static final String SIGNER_PUBLIC_KEY = "signer.publicKeyHex";
  public static final String PROFILE = "profile";
  public static final String SDG_CATALOG = "sdg.catalog";
  public static final String METRICS_EXPORTER = "metrics.exporter";

  static final String ENV_PRIVATE_KEY = "HAP_SP_PRIVATE_KEY";
  static final String ENV_PUBLIC_KEY = "HAP_SP_PUBLIC_KEY";
  static final String DEFAULT_KEY_ID = "sp-demo-v1";
  static final String DEFAULT_EXPORTER = "none";

  public HapConfig {
    Objects.requireNonNull(keyId, "keyId");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
  }

  public static HapConfig defaults() {
    return new HapConfig(DEFAULT_KEY_ID, null, null, null, null, DEFAULT_EXPORTER);
  }

  /**
   * Embedded defaults in flat form, for merging.
   *
   * @return default settings
   */
  public static Map<String, String> defaultsMap() {
    return Map.of(SIGNER_KEY_ID, DEFAULT_KEY_ID, METRICS_EXPORTER, DEFAULT_EXPORTER);
  }

  /**
   * Builds settings from a merged map, reading key material from the process environment when the
   * map omits it.
   *
   * @param options merged settings
   * @return config
   */
  public static HapConfig fromMap(Map<String, String> options) {
    return fromMap(options, System::getenv);
  }

  /**
   * Builds settings from a merged map.
   *
   * @param options merged settings
   * @param env environment lookup for key material fallbacks
   * @return config
   * @throws IllegalArgumentException when a value is malformed
   */
  public static HapConfig fromMap(Map<String, String> options, Function<String, String> env) {
    Objects.requireNonNull(options, "options");
    String keyId = blankToNull(options.get(SIGNER_KEY_ID));
    keyId = keyId == null ? DEFAULT_KEY_ID : Strings.requirePrintableAscii(SIGNER_KEY_ID, keyId, 128);
    String privateKey = firstNonBlank(options.get(SIGNER_PRIVATE_KEY), env.apply(ENV_PRIVATE_KEY));
    String publicKey = firstNonBlank(options.get(SIGNER_PUBLIC_KEY), env.apply(ENV_PUBLIC_KEY));
    String profile = blankToNull(options.get(PROFILE));
    if (profile != null) {
      profile = Strings.requireNonBlank(PROFILE, profile);
    }
    String catalog = blankToNull(options.get(SDG_CATALOG));
    String exporter = blankToNull(options.get(METRICS_EXPORTER));
    return new HapConfig(
        keyId,
        privateKey,
        publicKey,
        profile,
        catalog == null ? null : Path.of(catalog),
        exporter == null ? DEFAULT_EXPORTER : exporter.toLowerCase(Locale.ROOT));
  }

  /** Key material is never rendered. */
  @Override
  public String toString() {
    return "HapConfig[keyId=" + keyId
        + ", privateKey=" + (privateKeyHex == null ? "<ephemeral>" : Logs.redact(privateKeyHex))
        + ", publicKeyHex=" + publicKeyHex
        + ", profileId=" + profileId
        + ", sdgCatalog=" + sdgCatalog
        + ", metricsExporter=" + metricsExporter + "]";
  }

  private static String firstNonBlank(String first, String second) {
    String value = blankToNull(first);
    return value != null ? value : blankToNull(second);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
