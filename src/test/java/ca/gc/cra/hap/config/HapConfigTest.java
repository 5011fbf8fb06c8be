package ca.gc.cra.hap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HapConfigTest {
  private static final String PRIVATE = "11".repeat(32);
  private static final String PUBLIC = "22".repeat(32);

  @Test
  void defaultsApplyWhenMapIsEmpty() {
    HapConfig config = HapConfig.fromMap(Map.of(), name -> null);

    assertEquals(HapConfig.defaults(), config);
    assertEquals("sp-demo-v1", config.keyId());
    assertNull(config.privateKeyHex());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void keyMaterialFallsBackToEnvironment() {
    Map<String, String> env = Map.of("HAP_SP_PRIVATE_KEY", PRIVATE, "HAP_SP_PUBLIC_KEY", PUBLIC);

    HapConfig config = HapConfig.fromMap(Map.of("signer.publicKeyHex", "33".repeat(32)), env::get);

    assertEquals(PRIVATE, config.privateKeyHex());
    assertEquals("33".repeat(32), config.publicKeyHex());
  }

  @Test
  void readsEveryOption() {
    HapConfig config = HapConfig.fromMap(Map.of(
        "signer.keyId", " sp-prod-2 ",
        "profile", "deploy-gate@0.2",
        "sdg.catalog", "guards/sdgs.yaml",
        "metrics.exporter", "OTLP"), name -> null);

    assertEquals("sp-prod-2", config.keyId());
    assertEquals("deploy-gate@0.2", config.profileId());
    assertEquals(Path.of("guards/sdgs.yaml"), config.sdgCatalog());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void rejectsNonPrintableKeyId() {
    assertThrows(IllegalArgumentException.class,
        () -> HapConfig.fromMap(Map.of("signer.keyId", "sp\u00e9"), name -> null));
  }

  @Test
  void toStringNeverRendersPrivateKey() {
    HapConfig config = HapConfig.fromMap(
        Map.of("signer.privateKeyHex", PRIVATE, "signer.publicKeyHex", PUBLIC), name -> null);

    String rendered = config.toString();

    assertFalse(rendered.contains(PRIVATE));
    assertTrue(rendered.contains("[REDACTED]"));
    assertTrue(HapConfig.defaults().toString().contains("<ephemeral>"));
  }
}
