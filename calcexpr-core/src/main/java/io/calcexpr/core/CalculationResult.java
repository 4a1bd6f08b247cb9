package io.calcexpr.core;

import io.calcexpr.core.ExpressionException.ErrorType;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Result of {@link ExpressionEngine#evaluate}.
 *
 * @param ok whether the expression evaluated successfully
 * @param value the numeric result; {@code NaN} when not ok
 * @param formatted the display string for {@code value}; null when not ok
 * @param error short user-facing error message; null when ok
 * @param errorType category of the error; null when ok
 */
public record CalculationResult(
    boolean ok, double value, String formatted, String error, ErrorType errorType) {

  public static CalculationResult success(double value, String formatted) {
    return new CalculationResult(true, value, Objects.requireNonNull(formatted), null, null);
  }

  public static CalculationResult failure(String error, ErrorType errorType) {
    return new CalculationResult(
        false, Double.NaN, null, Objects.requireNonNull(error), Objects.requireNonNull(errorType));
  }

  /** The value if evaluation succeeded. */
  public OptionalDouble valueIfOk() {
    return ok ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  @Override
  public String toString() {
    return ok ? "ok: " + formatted : "error: " + error;
  }
}
