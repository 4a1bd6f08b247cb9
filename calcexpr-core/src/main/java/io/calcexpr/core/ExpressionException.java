package io.calcexpr.core;

/**
 * Exception raised while tokenizing, parsing or evaluating an expression. Each instance carries an
 * {@link ErrorType} so the stage boundaries can turn it into a typed outcome and callers can tell a
 * typo from a mathematically undefined operation.
 *
 * <p>These exceptions never leave {@link ExpressionEngine}; they are converted into {@link
 * CalculationResult} or {@link ValidationResult} values there.
 */
public class ExpressionException extends RuntimeException {

  /** Position value used when an error is not tied to a location in the input. */
  public static final int NO_POSITION = -1;

  /** The category of an expression error. */
  public enum ErrorType {
    /** Unknown identifier or, in strict mode, an unrecognized character. */
    LEXICAL,
    /** Unexpected token, unbalanced parenthesis, empty input or malformed function call. */
    SYNTAX,
    /** Parenthesis or function nesting exceeded the configured maximum. */
    RECURSION_LIMIT,
    /** Mathematically undefined or disallowed operation for the given inputs. */
    DOMAIN,
    /** Unknown node, operator or function reached the evaluator. */
    INTERNAL
  }

  private final ErrorType type;
  private final int position;

  /**
   * Creates a new expression exception that is not tied to an input position.
   *
   * @param type the error type
   * @param message the user-facing message
   */
  public ExpressionException(ErrorType type, String message) {
    this(type, message, NO_POSITION);
  }

  /**
   * Creates a new expression exception.
   *
   * @param type the error type
   * @param message the user-facing message
   * @param position offset into the raw input, or {@link #NO_POSITION}
   */
  public ExpressionException(ErrorType type, String message, int position) {
    super(message);
    this.type = type;
    this.position = position;
  }

  /**
   * Gets the error type.
   *
   * @return the error type
   */
  public ErrorType getType() {
    return type;
  }

  /**
   * Gets the offset into the raw input where the error was detected.
   *
   * @return the position, or {@link #NO_POSITION}
   */
  public int getPosition() {
    return position;
  }

  /**
   * Checks whether this error carries an input position.
   *
   * @return true if {@link #getPosition()} is meaningful
   */
  public boolean hasPosition() {
    return position != NO_POSITION;
  }
}
