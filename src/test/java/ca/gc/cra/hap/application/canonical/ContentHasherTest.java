package ca.gc.cra.hap.application.canonical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashesUtf8BytesWithPrefix() {
    assertEquals(
        "sha256:e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        ContentHasher.hash(""));
    assertEquals(
        "sha256:ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        ContentHasher.hash("abc"));
  }

  @Test
  void recognisesContentHashShape() {
    assertTrue(ContentHasher.isContentHash(ContentHasher.hash("x")));
    assertFalse(ContentHasher.isContentHash("sha256:ABC"));
    assertFalse(ContentHasher.isContentHash(null));
    assertFalse(ContentHasher.isContentHash("md5:" + "0".repeat(64)));
  }
}
