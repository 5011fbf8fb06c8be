package ca.gc.cra.hap.application.canonical;

import ca.gc.cra.hap.domain.error.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Normalizes repository-relative file paths before they are hashed.
 *
 * <p>Repeated separators collapse to one, leading {@code ./} prefixes and a trailing separator are
 * removed. Blank paths, the bare root {@code /}, paths containing NUL, and paths with a {@code ..}
 * segment are rejected.
 * Normalization is idempotent.</p>
 *
 * @since 0.3.0
 */
public final class PathNormalizer {

  private PathNormalizer() {
    // Utility
  }

  /**
   * Normalizes a single path.
   *
   * @param path raw path
   * @return normalized path
   * @throws ValidationException when the path is blank, contains NUL, or traverses upward
   */
  public static String normalize(String path) {
    if (path == null || path.isBlank()) {
      throw invalid(path, "path must not be blank");
    }
    if (path.indexOf('\0') >= 0) {
      throw invalid(path, "path must not contain NUL");
    }
    String result = path.replaceAll("/{2,}", "/");
    while (result.startsWith("./")) {
      result = result.substring(2);
    }
    if (result.length() > 1 && result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    if (result.isEmpty() || result.equals(".") || result.equals("/")) {
      throw invalid(path, "path must name a file");
    }
    for (String segment : result.split("/", -1)) {
      if (segment.equals("..")) {
        throw invalid(path, "path must not contain '..' segments");
      }
    }
    return result;
  }

  /**
   * Normalizes, de-duplicates, and sorts a path collection. Every invalid path is reported.
   *
   * @param paths raw paths
   * @return sorted distinct normalized paths
   * @throws ValidationException when any path is invalid
   */
  public static List<String> normalizeAll(Collection<String> paths) {
    TreeSet<String> normalized = new TreeSet<>();
    List<String> violations = new ArrayList<>();
    for (String path : paths) {
      try {
        normalized.add(normalize(path));
      } catch (ValidationException ex) {
        violations.addAll(ex.violations());
      }
    }
    if (!violations.isEmpty()) {
      throw new ValidationException("changed_paths", violations);
    }
    return List.copyOf(normalized);
  }

  private static ValidationException invalid(String path, String reason) {
    return new ValidationException("path", List.of(reason + ": '" + path + "'"));
  }
}
