package ca.gc.cra.hap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "attest",
        Optional.of(Map.of("signer.keyId", "sp-yaml", "profile", "deploy-gate@0.2")),
        Map.of("profile", "deploy-gate@0.3"),
        HapConfig.defaultsMap(),
        warnings::add);

    assertEquals("sp-yaml", merged.get("signer.keyId"));
    assertEquals("deploy-gate@0.3", merged.get("profile"));
    assertEquals("none", merged.get("metrics.exporter"));
    assertEquals(List.of("CLI overrides YAML for key: profile"), warnings);
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "verify", Optional.empty(), Map.of("metrics.exporter", "statsd"), HapConfig.defaultsMap(), msg -> {}));
  }

  @Test
  void privateKeyRequiresPublicKey() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "attest",
        Optional.of(Map.of("signer.privateKeyHex", "00".repeat(32))),
        Map.of(),
        HapConfig.defaultsMap(),
        msg -> {}));
  }
}
