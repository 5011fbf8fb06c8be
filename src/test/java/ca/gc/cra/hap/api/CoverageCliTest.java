package ca.gc.cra.hap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hap.application.attestation.AttestationTextCodec;
import ca.gc.cra.hap.domain.attestation.AttestationBlock;
import ca.gc.cra.hap.domain.profile.DeployGateProfiles;
import ca.gc.cra.hap.domain.profile.ProtocolVersion;
import ca.gc.cra.hap.fixtures.ProtocolFixtures;
import ca.gc.cra.hap.fixtures.ProtocolFixtures.Authority;
import ca.gc.cra.hap.infrastructure.crypto.Ed25519Keys;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoverageCliTest {
  private static final String FULL = DeployGateProfiles.FULL;

  @TempDir Path tempDir;

  private final AttestationTextCodec textCodec = new AttestationTextCodec();
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
  void plaintextBlocksReportMissingDomain() throws IOException {
    Path comments = writeComments(plainBlock("engineering", FULL), "LGTM, no block here.");

    ExitCode code = Main.run(new String[] {
        "coverage", "comments=" + comments, "repo=" + ProtocolFixtures.REPO, "sha=" + ProtocolFixtures.SHA,
        "env=" + ProtocolFixtures.ENV, "path=" + FULL, "--no-verify"});

    String out = buffer.toString();
    assertEquals(ExitCode.REJECTED, code, out);
    assertTrue(out.contains("satisfied=false"));
    assertTrue(out.contains("domains=engineering"));
    assertTrue(out.contains("missing=release_management"));
  }

  @Test
  void securityStandsInForReleaseManagement() throws IOException {
    Path comments = writeComments(plainBlock("engineering", FULL), plainBlock("security", FULL));

    ExitCode code = Main.run(new String[] {
        "coverage", "comments=" + comments, "repo=" + ProtocolFixtures.REPO, "sha=" + ProtocolFixtures.SHA,
        "env=" + ProtocolFixtures.ENV, "path=" + FULL, "--no-verify"});

    String out = buffer.toString();
    assertEquals(ExitCode.SUCCESS, code, out);
    assertTrue(out.contains("satisfied=true"));
    assertTrue(out.contains("substitution=security->release_management"));
  }

  @Test
  void otherCommitsAreIgnored() throws IOException {
    AttestationBlock stale = new AttestationBlock(ProtocolVersion.V0_3, DeployGateProfiles.V03_ID, "release_management",
        "prod", FULL, ProtocolFixtures.OTHER_SHA, ProtocolFixtures.v03FrameHash(FULL),
        ProtocolFixtures.DISCLOSURE_HASH, "blob");
    Path comments = writeComments(plainBlock("engineering", FULL), textCodec.encode(stale));

    ExitCode code = Main.run(new String[] {
        "coverage", "comments=" + comments, "repo=" + ProtocolFixtures.REPO, "sha=" + ProtocolFixtures.SHA,
        "env=" + ProtocolFixtures.ENV, "path=" + FULL, "--no-verify"});

    assertEquals(ExitCode.REJECTED, code);
    assertTrue(buffer.toString().contains("ignored=1"));
  }

  @Test
  void verifiedBlocksNeedValidSignatures() throws IOException {
    Authority authority = new Authority();
    authority.clock().set(System.currentTimeMillis() / 1000L);
    String engineering = authority.signer().sign(ProtocolFixtures.v03Request(FULL, "engineering")).blob();
    String release = authority.signer().sign(ProtocolFixtures.v03Request(FULL, "release_management")).blob();
    Path comments = writeComments(
        signedBlock("engineering", engineering), signedBlock("release_management", release));
    String[] args = {
        "coverage", "comments=" + comments, "repo=" + ProtocolFixtures.REPO, "sha=" + ProtocolFixtures.SHA,
        "env=" + ProtocolFixtures.ENV, "path=" + FULL,
        "signer.keyId=" + ProtocolFixtures.KID,
        "signer.publicKeyHex=" + Ed25519Keys.toHex(authority.pair().getPublic())};

    assertEquals(ExitCode.SUCCESS, Main.run(args), buffer.toString());
    assertTrue(buffer.toString().contains("domains=engineering,release_management"));

    buffer.getBuffer().setLength(0);
    String[] wrongKey = args.clone();
    wrongKey[wrongKey.length - 1] = "signer.publicKeyHex=" + Ed25519Keys.toHex(Ed25519Keys.generate().getPublic());

    assertEquals(ExitCode.REJECTED, Main.run(wrongKey));
    assertTrue(buffer.toString().contains("ignored=2"), buffer.toString());
  }

  @Test
  void blocksForAnotherFrameAreIgnored() throws IOException {
    Path comments = writeComments(plainBlock("engineering", FULL), plainBlock("release_management", FULL));

    ExitCode code = Main.run(new String[] {
        "coverage", "comments=" + comments, "repo=" + ProtocolFixtures.REPO, "sha=" + ProtocolFixtures.SHA,
        "env=staging", "path=" + FULL, "--no-verify"});

    String out = buffer.toString();
    assertEquals(ExitCode.REJECTED, code, out);
    assertTrue(out.contains("satisfied=false"), out);
    assertTrue(out.contains("ignored=2"), out);
  }

  @Test
  void splitsOnSeparatorLinesOnly() {
    List<String> comments = CoverageCli.splitComments("first\n---8<---\n\n---8<---  \nsecond ---8<--- inline\n");

    assertEquals(List.of("first", "second ---8<--- inline"), comments);
  }

  private String plainBlock(String domain, String path) {
    return signedBlock(domain, "unverified-" + domain, path);
  }

  private String signedBlock(String domain, String blob) {
    return signedBlock(domain, blob, FULL);
  }

  private String signedBlock(String domain, String blob, String path) {
    return "Approved for " + domain + ".\n" + textCodec.encode(new AttestationBlock(
        ProtocolVersion.V0_3, DeployGateProfiles.V03_ID, domain, "prod", path, ProtocolFixtures.SHA,
        ProtocolFixtures.v03FrameHash(path), ProtocolFixtures.DISCLOSURE_HASH, blob));
  }

  private Path writeComments(String... bodies) throws IOException {
    return Files.writeString(tempDir.resolve("comments.txt"),
        String.join("\n" + CoverageCli.COMMENT_SEPARATOR + "\n", bodies) + "\n");
  }
}
