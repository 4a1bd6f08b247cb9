package io.calcexpr.core.expr;

import java.util.Objects;

/** Prefix negation or a postfix factorial/percent applied to one operand. */
public record UnaryOpNode(UnaryOperator op, ExprNode operand) implements ExprNode {

  public UnaryOpNode {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public int depth() {
    return 1 + operand.depth();
  }

  @Override
  public String toString() {
    if (op.isPostfix()) {
      return "(" + operand + op.symbol() + ")";
    }
    return "(" + op.symbol() + operand + ")";
  }
}
