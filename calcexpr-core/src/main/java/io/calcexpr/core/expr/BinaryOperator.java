package io.calcexpr.core.expr;

/**
 * Binary operators with their precedence (higher binds tighter) and associativity.
 *
 * <p>{@link #MOD} has no token of its own; it is only produced by callers that build trees
 * directly.
 */
public enum BinaryOperator {
  ADD("+", "+", 1, false),
  SUB("-", "−", 1, false),
  MUL("*", "×", 2, false),
  DIV("/", "÷", 2, false),
  MOD("mod", "mod", 2, false),
  POW("^", "^", 3, true);

  private final String symbol;
  private final String displaySymbol;
  private final int precedence;
  private final boolean rightAssociative;

  BinaryOperator(String symbol, String displaySymbol, int precedence, boolean rightAssociative) {
    this.symbol = symbol;
    this.displaySymbol = displaySymbol;
    this.precedence = precedence;
    this.rightAssociative = rightAssociative;
  }

  public String symbol() {
    return symbol;
  }

  public String displaySymbol() {
    return displaySymbol;
  }

  public int precedence() {
    return precedence;
  }

  public boolean isRightAssociative() {
    return rightAssociative;
  }

  public static BinaryOperator fromSymbol(String s) {
    return switch (s) {
      case "+" -> ADD;
      case "-" -> SUB;
      case "*" -> MUL;
      case "/" -> DIV;
      case "^" -> POW;
      case "mod", "MOD" -> MOD;
      default -> throw new IllegalArgumentException("Unknown binary operator: " + s);
    };
  }
}
