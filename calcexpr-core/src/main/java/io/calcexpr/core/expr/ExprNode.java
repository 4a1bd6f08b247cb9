package io.calcexpr.core.expr;

/**
 * Expression AST produced by the parser and walked by the evaluator.
 *
 * <p>The hierarchy is closed: every tree is made of the five record variants below, each owning
 * its children exclusively. Nodes are immutable and validate their components on construction, so
 * a tree that exists is well-formed.
 *
 * <p>Example usage:
 *
 * <pre>
 * // 2 + sin(pi)
 * ExprNode expr = new BinaryOpNode(
 *     BinaryOperator.ADD,
 *     new NumberNode(2),
 *     new FunctionNode(MathFunction.SIN, List.of(new ConstantNode(MathConstant.PI))));
 * </pre>
 */
public sealed interface ExprNode
    permits NumberNode, ConstantNode, BinaryOpNode, UnaryOpNode, FunctionNode {

  /**
   * Returns the nesting depth of this subtree; a leaf has depth 1.
   *
   * @return the depth of the deepest path from this node to a leaf
   */
  int depth();
}
