package io.calcexpr.core.expr;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in functions callable from expressions, with their arity and display labels.
 *
 * <p>Every function except {@link #POW} takes exactly one argument. Names are matched
 * case-insensitively.
 */
public enum MathFunction {
  // Trigonometric
  SIN("sin", "sin", 1),
  COS("cos", "cos", 1),
  TAN("tan", "tan", 1),
  ASIN("asin", "sin⁻¹", 1),
  ACOS("acos", "cos⁻¹", 1),
  ATAN("atan", "tan⁻¹", 1),
  // Hyperbolic
  SINH("sinh", "sinh", 1),
  COSH("cosh", "cosh", 1),
  TANH("tanh", "tanh", 1),
  // Logarithmic
  LOG("log", "log", 1),
  LN("ln", "ln", 1),
  LOG2("log2", "log₂", 1),
  // Roots and powers
  SQRT("sqrt", "√", 1),
  CBRT("cbrt", "∛", 1),
  POW("pow", "pow", 2),
  EXP("exp", "e^x", 1),
  POW10("pow10", "10^x", 1),
  // Other
  ABS("abs", "|x|", 1),
  FLOOR("floor", "⌊⌋", 1),
  CEIL("ceil", "⌈⌉", 1),
  ROUND("round", "round", 1),
  FACTORIAL("factorial", "n!", 1);

  private static final Map<String, MathFunction> BY_NAME =
      Stream.of(values()).collect(Collectors.toUnmodifiableMap(f -> f.name, Function.identity()));

  private final String name;
  private final String label;
  private final int arity;

  MathFunction(String name, String label, int arity) {
    this.name = name;
    this.label = label;
    this.arity = arity;
  }

  /** Lower-case name as written in expressions. */
  public String functionName() {
    return name;
  }

  public String label() {
    return label;
  }

  /** Exact number of arguments this function accepts. */
  public int arity() {
    return arity;
  }

  /**
   * Checks an argument count against this function's arity.
   *
   * @param count number of arguments supplied
   * @return an error message, or empty if the count is acceptable
   */
  public Optional<String> checkArity(int count) {
    if (count == arity) {
      return Optional.empty();
    }
    return Optional.of(
        String.format(
            "%s() requires %d argument%s but got %d", name, arity, arity == 1 ? "" : "s", count));
  }

  /**
   * Looks up a function by name, ignoring case.
   *
   * @param name identifier text such as {@code SIN} or {@code log2}
   * @return the function, or empty if the name is not a known function
   */
  public static Optional<MathFunction> lookup(String name) {
    return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
  }
}
