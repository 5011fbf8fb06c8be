package ca.gc.cra.hap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.domain.profile.DeployGateProfiles;
import ca.gc.cra.hap.fixtures.ProtocolFixtures;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: hap <frame-hash|"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"deploy"}));
    assertTrue(buffer.toString().contains("usage: hap"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String out = buffer.toString();
    assertTrue(out.contains("HAP command dispatcher"));
    assertTrue(out.contains("authorize"));
  }

  @Test
  void subcommandHelpSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"attest", "--help"}));
    assertTrue(buffer.toString().contains("HAP attest"));
  }

  @Test
  void frameHashMatchesLibraryComputation() {
    String path = DeployGateProfiles.FULL;
    ExitCode code = Main.run(new String[] {
        "frame-hash",
        "repo=" + ProtocolFixtures.REPO,
        "sha=" + ProtocolFixtures.SHA,
        "env=" + ProtocolFixtures.ENV,
        "path=" + path,
        "profile=" + DeployGateProfiles.V03_ID});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("repo=" + ProtocolFixtures.REPO));
    assertTrue(out.contains("frame_hash=" + ProtocolFixtures.v03FrameHash(path)), out);
  }

  @Test
  void frameHashRejectsInvalidSha() {
    ExitCode code = Main.run(new String[] {
        "frame-hash", "repo=acme/app", "sha=not-a-sha", "env=prod", "path=" + DeployGateProfiles.CANARY});

    assertEquals(ExitCode.REJECTED, code);
    assertTrue(buffer.toString().contains("error=validation_error"));
  }

  @Test
  void missingRequiredArgumentIsInvalid() {
    ExitCode code = Main.run(new String[] {"frame-hash", "repo=acme/app"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: hap frame-hash"));
  }

  @Test
  void unknownProfileIsRejected() {
    ExitCode code = Main.run(new String[] {
        "frame-hash", "repo=acme/app", "sha=" + ProtocolFixtures.SHA, "env=prod",
        "path=" + DeployGateProfiles.CANARY, "profile=deploy-gate@9.9"});

    assertEquals(ExitCode.REJECTED, code);
    assertTrue(buffer.toString().contains("error=unknown_profile"));
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = Main.run(new String[] {"pubkey", "config=/nonexistent/hap.yaml"});
    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void pubkeyPrintsEphemeralKey() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"pubkey"}));
    String out = buffer.toString();
    assertTrue(out.contains("kid=sp-demo-v1"));
    assertTrue(out.contains("alg=Ed25519"));
    assertTrue(out.matches("(?s).*public_key=[0-9a-f]{64}\\R.*"), out);
  }
}
