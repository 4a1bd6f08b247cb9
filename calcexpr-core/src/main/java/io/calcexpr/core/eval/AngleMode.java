package io.calcexpr.core.eval;

import java.util.Locale;

/** How trigonometric arguments and results are interpreted. */
public enum AngleMode {
  DEGREES,
  RADIANS;

  /** Converts an angle in this mode to radians. */
  public double toRadians(double angle) {
    return this == DEGREES ? Math.toRadians(angle) : angle;
  }

  /** Converts an angle in radians to this mode. */
  public double fromRadians(double radians) {
    return this == DEGREES ? Math.toDegrees(radians) : radians;
  }

  /**
   * Parses a mode name such as {@code deg}, {@code degrees} or {@code RAD}.
   *
   * @throws IllegalArgumentException for any other text
   */
  public static AngleMode fromString(String s) {
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "deg", "degree", "degrees" -> DEGREES;
      case "rad", "radian", "radians" -> RADIANS;
      default -> throw new IllegalArgumentException("Unknown angle mode: " + s);
    };
  }
}
