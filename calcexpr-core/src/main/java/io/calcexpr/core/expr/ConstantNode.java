package io.calcexpr.core.expr;

import java.util.Objects;

/** Reference to a named constant such as pi. */
public record ConstantNode(MathConstant constant) implements ExprNode {

  public ConstantNode {
    Objects.requireNonNull(constant, "constant");
  }

  @Override
  public int depth() {
    return 1;
  }

  @Override
  public String toString() {
    return constant.name();
  }
}
