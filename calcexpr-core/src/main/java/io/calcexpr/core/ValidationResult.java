package io.calcexpr.core;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link ExpressionEngine#validate}: syntax problems found without evaluating.
 *
 * @param valid true when no errors were found
 * @param errors the errors in the order they were found
 * @param warnings non-fatal notes such as skipped characters; empty when there are none
 */
public record ValidationResult(boolean valid, List<Issue> errors, List<String> warnings) {

  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public static ValidationResult of(List<Issue> errors, List<String> warnings) {
    return new ValidationResult(errors.isEmpty(), errors, warnings);
  }

  /**
   * A single validation error.
   *
   * @param message user-facing message
   * @param position raw input position, or {@link ExpressionException#NO_POSITION}
   */
  public record Issue(String message, int position) {
    public Issue {
      Objects.requireNonNull(message, "message");
    }

    public static Issue at(String message, int position) {
      return new Issue(message, position);
    }

    public static Issue of(String message) {
      return new Issue(message, ExpressionException.NO_POSITION);
    }

    public boolean hasPosition() {
      return position != ExpressionException.NO_POSITION;
    }
  }
}
