package io.calcexpr.core.expr;

/** Numeric literal value. */
public record NumberNode(double value) implements ExprNode {

  @Override
  public int depth() {
    return 1;
  }

  @Override
  public String toString() {
    if (value == (long) value) {
      return String.valueOf((long) value);
    }
    return String.valueOf(value);
  }
}
