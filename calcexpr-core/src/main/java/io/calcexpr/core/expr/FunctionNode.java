package io.calcexpr.core.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Call of a built-in function with one or more arguments. */
public record FunctionNode(MathFunction function, List<ExprNode> arguments) implements ExprNode {

  public FunctionNode {
    Objects.requireNonNull(function, "function");
    arguments = List.copyOf(arguments);
    if (arguments.isEmpty()) {
      throw new IllegalArgumentException(function.functionName() + "() needs an argument");
    }
  }

  @Override
  public int depth() {
    int deepest = 0;
    for (ExprNode arg : arguments) {
      deepest = Math.max(deepest, arg.depth());
    }
    return 1 + deepest;
  }

  @Override
  public String toString() {
    return function.functionName()
        + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
  }
}
