package io.calcexpr.core.format;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Turns evaluation results into canonical, unlocalized display strings.
 *
 * <ul>
 *   <li>NaN renders as {@code Error}, infinities as {@code Infinity} / {@code -Infinity}
 *   <li>Non-zero magnitudes below 1e-15 render as {@code 0}
 *   <li>Magnitudes of at least 1e10, or non-zero magnitudes below 1e-6, use scientific notation
 *       such as {@code 1.2345678900e+10}
 *   <li>Everything else is rounded to the significant-digit budget and printed plainly, without
 *       trailing zeros
 * </ul>
 */
public final class ResultFormatter {

  public static final int DEFAULT_DISPLAY_DIGITS = 15;

  /** Digits of the budget left for the exponent suffix in scientific notation. */
  private static final int EXPONENT_RESERVE = 5;

  private static final double NOISE_THRESHOLD = 1e-15;
  private static final double SCIENTIFIC_UPPER = 1e10;
  private static final double SCIENTIFIC_LOWER = 1e-6;

  private final int displayDigits;
  private final MathContext plainContext;

  public ResultFormatter() {
    this(DEFAULT_DISPLAY_DIGITS);
  }

  /**
   * Creates a formatter.
   *
   * @param displayDigits total significant digits shown, must exceed the exponent reserve of 5
   */
  public ResultFormatter(int displayDigits) {
    if (displayDigits <= EXPONENT_RESERVE) {
      throw new IllegalArgumentException(
          "displayDigits must be greater than " + EXPONENT_RESERVE + ": " + displayDigits);
    }
    this.displayDigits = displayDigits;
    this.plainContext = new MathContext(displayDigits, RoundingMode.HALF_UP);
  }

  public int displayDigits() {
    return displayDigits;
  }

  public String format(double value) {
    if (Double.isNaN(value)) {
      return "Error";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    double magnitude = Math.abs(value);
    if (value == 0 || magnitude < NOISE_THRESHOLD) {
      return "0";
    }
    if (magnitude >= SCIENTIFIC_UPPER || magnitude < SCIENTIFIC_LOWER) {
      return scientific(value);
    }
    BigDecimal rounded = new BigDecimal(value).round(plainContext);
    if (rounded.signum() == 0) {
      return "0";
    }
    return rounded.stripTrailingZeros().toPlainString();
  }

  // %e pads the exponent to two digits; the display form uses the shortest exponent.
  private String scientific(double value) {
    int fractionDigits = displayDigits - EXPONENT_RESERVE;
    String formatted = String.format(Locale.ROOT, "%." + fractionDigits + "e", value);
    int e = formatted.indexOf('e');
    String mantissa = formatted.substring(0, e);
    char sign = formatted.charAt(e + 1);
    String digits = formatted.substring(e + 2).replaceFirst("^0+(?=\\d)", "");
    return mantissa + "e" + sign + digits;
  }
}
