package io.calcexpr.core.expr;

import java.util.Locale;
import java.util.Optional;

/** Named mathematical constants recognized in expressions. */
public enum MathConstant {
  PI(Math.PI, "π"),
  E(Math.E, "e"),
  /** Golden ratio. */
  PHI((1 + Math.sqrt(5)) / 2, "φ");

  private final double value;
  private final String label;

  MathConstant(double value, String label) {
    this.value = value;
    this.label = label;
  }

  public double value() {
    return value;
  }

  /** Display label, e.g. the Greek letter for pi. */
  public String label() {
    return label;
  }

  /**
   * Looks up a constant by name, ignoring case.
   *
   * @param name identifier text such as {@code pi} or {@code PHI}
   * @return the constant, or empty if the name is not a constant
   */
  public static Optional<MathConstant> lookup(String name) {
    return switch (name.toUpperCase(Locale.ROOT)) {
      case "PI" -> Optional.of(PI);
      case "E" -> Optional.of(E);
      case "PHI" -> Optional.of(PHI);
      default -> Optional.empty();
    };
  }
}
