package ca.gc.cra.hap.infrastructure.decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.application.json.JsonSupport;
import ca.gc.cra.hap.domain.disclosure.DecisionFile;
import ca.gc.cra.hap.domain.disclosure.Disclosure;
import ca.gc.cra.hap.domain.error.ErrorCode;
import ca.gc.cra.hap.domain.error.ValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DecisionFileReaderTest {
  @TempDir
  Path tempDir;

  private final DecisionFileReader reader = new DecisionFileReader(new JsonSupport());

  @Test
  void readsDecisionFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("decision.json"), """
        {
          "profile": "deploy-gate@0.3",
          "execution_path": "deploy-prod-canary",
          "disclosure": {
            "engineering": {
              "diff_summary": "Caches cart totals",
              "changed_paths": ["src/cart.ts", "src/cache.ts"]
            }
          }
        }
        """);

    DecisionFile decision = reader.read(file);

    assertEquals("deploy-gate@0.3", decision.profile());
    assertEquals("deploy-prod-canary", decision.executionPath());
    assertEquals("Caches cart totals", decision.domain("engineering").orElseThrow().text("diff_summary"));
    assertEquals(List.of("src/cart.ts", "src/cache.ts"),
        decision.domain("engineering").orElseThrow().fields().get("changed_paths"));
    assertTrue(decision.domain("marketing").isEmpty());
  }

  @Test
  void collectsEveryStructuralProblem() {
    ValidationException ex = assertThrows(ValidationException.class, () -> reader.parse("""
        {
          "profile": "",
          "disclosure": { "engineering": { "diff_summary": 5 }, "security": "none" }
        }
        """));

    assertEquals(ErrorCode.VALIDATION_ERROR, ex.code());
    assertEquals(4, ex.violations().size());
    assertTrue(ex.violations().contains("execution_path must be a non-empty string"));
  }

  @Test
  void rejectsNonJson() {
    ValidationException ex = assertThrows(ValidationException.class, () -> reader.parse("not json"));

    assertTrue(ex.violations().get(0).startsWith("not a JSON object"));
  }

  @Test
  void missingFileIsEmpty() throws IOException {
    assertTrue(reader.readIfPresent(tempDir.resolve(".hap/decision.json")).isEmpty());
  }

  @Test
  void parsesV02Disclosure() {
    Disclosure disclosure = reader.parseDisclosure("""
        {
          "repo": "acme/app",
          "sha": "0123456789abcdef0123456789abcdef01234567",
          "changed_paths": ["b.ts", "a.ts"],
          "risk_flags": ["schema_change"],
          "domains": {
            "engineering": {
              "problem": "Checkout is slow under load",
              "objective": "Cut p95 latency in half",
              "tradeoffs": "Extra cache memory per node"
            }
          }
        }
        """);

    assertEquals("acme/app", disclosure.repo());
    assertEquals(Set.of("a.ts", "b.ts"), disclosure.changedPaths());
    assertEquals("Cut p95 latency in half", disclosure.domains().get("engineering").objective());
  }

  @Test
  void v02DisclosureRejectsBadLists() {
    ValidationException ex = assertThrows(ValidationException.class, () -> reader.parseDisclosure("""
        {"repo": "acme/app", "sha": "abc", "changed_paths": "a.ts", "domains": []}
        """));

    assertEquals(List.of("changed_paths must be a list of strings", "domains must be an object"), ex.violations());
  }
}
