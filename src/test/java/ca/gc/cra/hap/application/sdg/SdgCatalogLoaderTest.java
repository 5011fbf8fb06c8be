package ca.gc.cra.hap.application.sdg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SdgCatalogLoaderTest {
  @TempDir
  Path tempDir;

  private final SdgCatalogLoader loader = new SdgCatalogLoader();

  @Test
  void loadsDefinitionsInFileOrder() throws IOException {
    Path file = tempDir.resolve("sdgs.yaml");
    Files.writeString(file, """
        version: 1
        sdgs:
          - id: team/commitment@2.0
            signal_intent: commitment
            observable_structures: [frame_hashes]
            detection_rules: ["count(unique(frame_hashes)) > 1"]
            stop_trigger: true
            user_prompt: Reviewers disagree on the frame.
          - id: team/drift@1.0
            detection_rules: "semantic_distance(objective_text, diff_summary) > threshold"
            user_prompt: Check the objective.
        """);

    SdgCatalog catalog = loader.load(List.of(file));

    assertEquals(List.of("team/commitment@2.0", "team/drift@1.0"),
        catalog.definitions().stream().map(SdgDefinition::id).toList());
    SdgDefinition drift = catalog.get("team/drift@1.0").orElseThrow();
    assertEquals(false, drift.stopTrigger());
    assertEquals(List.of(DetectionPredicate.OBJECTIVE_DIFF_DISTANCE.expression()), drift.detectionRules());
  }

  @Test
  void rejectsDuplicatesAcrossFiles() throws IOException {
    String body = """
        version: 1
        sdgs:
          - id: team/dup@1.0
            detection_rules: ["decision_file_present=false"]
        """;
    Path first = Files.writeString(tempDir.resolve("a.yaml"), body);
    Path second = Files.writeString(tempDir.resolve("b.yaml"), body);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.load(List.of(first, second)));

    assertTrue(ex.getMessage().contains("team/dup@1.0"));
  }

  @Test
  void rejectsSemanticHardStop() throws IOException {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), """
        version: 1
        sdgs:
          - id: team/drift@1.0
            detection_rules: ["semantic_distance(objective_text, diff_summary) > threshold"]
            stop_trigger: true
        """);

    assertThrows(IllegalArgumentException.class, () -> loader.load(List.of(file)));
  }

  @Test
  void rejectsWrongVersionAndMissingFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("v2.yaml"), "version: 2\nsdgs: []\n");

    assertThrows(IllegalArgumentException.class, () -> loader.load(List.of(file)));
    assertThrows(IOException.class, () -> loader.load(List.of(tempDir.resolve("absent.yaml"))));
  }
}
