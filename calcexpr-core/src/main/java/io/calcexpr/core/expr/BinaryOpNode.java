package io.calcexpr.core.expr;

import java.util.Objects;

/** Binary operation combining two sub-expressions. */
public record BinaryOpNode(BinaryOperator op, ExprNode left, ExprNode right) implements ExprNode {

  public BinaryOpNode {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public int depth() {
    return 1 + Math.max(left.depth(), right.depth());
  }

  @Override
  public String toString() {
    return "(" + left + " " + op.symbol() + " " + right + ")";
  }
}
