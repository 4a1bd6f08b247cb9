package io.calcexpr.core.expr;

/** Unary operators: prefix negation and the postfix factorial and percent markers. */
public enum UnaryOperator {
  NEGATE("-", false),
  FACTORIAL("!", true),
  PERCENT("%", true);

  private final String symbol;
  private final boolean postfix;

  UnaryOperator(String symbol, boolean postfix) {
    this.symbol = symbol;
    this.postfix = postfix;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isPostfix() {
    return postfix;
  }
}
