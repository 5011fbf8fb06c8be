package ca.gc.cra.hap.application.sdg;

import java.util.Locale;

/**
 * Rollout mode a reviewer selected in the review UI.
 *
 * @since 0.3.0
 */
public enum TradeoffMode {
  CANARY,
  FULL;

  /**
   * Parses {@code canary} or {@code full}, case-insensitively.
   *
   * @param value text form
   * @return mode
   * @throws IllegalArgumentException for any other value
   */
  public static TradeoffMode parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("tradeoff_mode is required");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "canary" -> CANARY;
      case "full" -> FULL;
      default -> throw new IllegalArgumentException("tradeoff_mode must be canary or full: " + value);
    };
  }
}
