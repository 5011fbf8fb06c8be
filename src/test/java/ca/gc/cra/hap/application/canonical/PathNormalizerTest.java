package ca.gc.cra.hap.application.canonical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.hap.domain.error.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathNormalizerTest {

  @Test
  void collapsesSeparatorsAndStripsPrefixes() {
    assertEquals("src/app/main.ts", PathNormalizer.normalize("./src//app///main.ts"));
    assertEquals("src/app", PathNormalizer.normalize("././src/app/"));
  }

  @Test
  void normalizationIsIdempotent() {
    String once = PathNormalizer.normalize(".//docs//guide/");
    assertEquals(once, PathNormalizer.normalize(once));
  }

  @Test
  void rejectsTraversalBlankAndNul() {
    assertThrows(ValidationException.class, () -> PathNormalizer.normalize("src/../secrets"));
    assertThrows(ValidationException.class, () -> PathNormalizer.normalize("  "));
    assertThrows(ValidationException.class, () -> PathNormalizer.normalize("a\0b"));
    assertThrows(ValidationException.class, () -> PathNormalizer.normalize("./"));
  }

  @Test
  void rejectsBareRoot() {
    ValidationException ex = assertThrows(ValidationException.class, () -> PathNormalizer.normalize("/"));
    assertEquals(List.of("path must name a file: '/'"), ex.violations());
    assertThrows(ValidationException.class, () -> PathNormalizer.normalize("///"));
  }

  @Test
  void dotsInsideNamesAreAllowed() {
    assertEquals("a/..b/c..", PathNormalizer.normalize("a/..b/c.."));
  }

  @Test
  void normalizeAllSortsAndDeduplicates() {
    assertEquals(List.of("a.txt", "b/c.txt"),
        PathNormalizer.normalizeAll(List.of("b//c.txt", "./a.txt", "a.txt")));
  }

  @Test
  void normalizeAllReportsEveryInvalidPath() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> PathNormalizer.normalizeAll(List.of("../x", "ok.txt", "y/../z")));
    assertEquals(2, ex.violations().size());
  }
}
