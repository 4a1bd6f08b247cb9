package io.calcexpr.core.eval;

import io.calcexpr.core.ExpressionException;
import io.calcexpr.core.ExpressionException.ErrorType;
import io.calcexpr.core.expr.BinaryOpNode;
import io.calcexpr.core.expr.BinaryOperator;
import io.calcexpr.core.expr.ConstantNode;
import io.calcexpr.core.expr.ExprNode;
import io.calcexpr.core.expr.FunctionNode;
import io.calcexpr.core.expr.MathFunction;
import io.calcexpr.core.expr.NumberNode;
import io.calcexpr.core.expr.UnaryOpNode;
import io.calcexpr.core.expr.UnaryOperator;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Evaluates expression trees to a {@code double}.
 *
 * <p>Every operation checks its domain before calling into {@link Math}: division and modulo by
 * zero, logarithms of non-positive numbers, square roots of negatives, inverse sine and cosine
 * outside [-1, 1], tangent at its asymptotes, factorials outside 0..170 and negative bases raised to
 * fractional powers are all reported as {@link ErrorType#DOMAIN} errors. Any operation that still
 * produces NaN is reported as "Undefined result".
 *
 * <p>Trigonometric functions honour the {@link AngleMode} passed to {@link #evaluate}; hyperbolic
 * functions always work in radians. The tree is never modified.
 */
public final class ExpressionEvaluator {

  private static final double TAN_ASYMPTOTE_EPSILON = 1e-10;

  private final FactorialTable factorials;

  public ExpressionEvaluator() {
    this(new FactorialTable(true));
  }

  public ExpressionEvaluator(FactorialTable factorials) {
    this.factorials = factorials;
  }

  /**
   * Evaluates an expression tree.
   *
   * @param expr the tree to evaluate
   * @param mode angle mode for trigonometric functions
   * @return the value, or the first error encountered
   */
  public EvalOutcome evaluate(ExprNode expr, AngleMode mode) {
    try {
      return new EvalOutcome.Ok(eval(expr, mode));
    } catch (ExpressionException e) {
      return new EvalOutcome.Err(e.getMessage(), e.getType());
    } catch (StackOverflowError e) {
      return new EvalOutcome.Err("Expression too deeply nested", ErrorType.RECURSION_LIMIT);
    }
  }

  private double eval(ExprNode node, AngleMode mode) {
    if (node instanceof NumberNode n) {
      return n.value();
    }
    if (node instanceof ConstantNode c) {
      return c.constant().value();
    }
    if (node instanceof BinaryOpNode b) {
      return evalBinary(b, mode);
    }
    if (node instanceof UnaryOpNode u) {
      return evalUnary(u, mode);
    }
    if (node instanceof FunctionNode f) {
      return evalFunction(f, mode);
    }
    throw new ExpressionException(ErrorType.INTERNAL, "Unknown node type: " + node);
  }

  // Left-associative chains such as 1+2+3+... are walked iteratively, so flat input of any length
  // evaluates without deep recursion.
  private double evalBinary(BinaryOpNode node, AngleMode mode) {
    if (node.op().isRightAssociative()) {
      return apply(node.op(), eval(node.left(), mode), eval(node.right(), mode));
    }
    Deque<BinaryOpNode> spine = new ArrayDeque<>();
    ExprNode current = node;
    while (current instanceof BinaryOpNode b && !b.op().isRightAssociative()) {
      spine.push(b);
      current = b.left();
    }
    double acc = eval(current, mode);
    while (!spine.isEmpty()) {
      BinaryOpNode b = spine.pop();
      acc = apply(b.op(), acc, eval(b.right(), mode));
    }
    return acc;
  }

  private static double apply(BinaryOperator op, double l, double r) {
    double result =
        switch (op) {
          case ADD -> l + r;
          case SUB -> l - r;
          case MUL -> l * r;
          case DIV -> {
            if (r == 0) {
              throw domain("Division by zero");
            }
            yield l / r;
          }
          case MOD -> {
            if (r == 0) {
              throw domain("Modulo by zero");
            }
            yield l % r;
          }
          case POW -> power(l, r);
        };
    return checkDefined(result);
  }

  // Stacked prefix and postfix operators are applied innermost first.
  private double evalUnary(UnaryOpNode node, AngleMode mode) {
    Deque<UnaryOperator> ops = new ArrayDeque<>();
    ExprNode current = node;
    while (current instanceof UnaryOpNode u) {
      ops.push(u.op());
      current = u.operand();
    }
    double value = eval(current, mode);
    while (!ops.isEmpty()) {
      value =
          switch (ops.pop()) {
            case NEGATE -> -value;
            case FACTORIAL -> factorials.factorial(value);
            case PERCENT -> value / 100;
          };
    }
    return value;
  }

  private double evalFunction(FunctionNode node, AngleMode mode) {
    MathFunction function = node.function();
    List<ExprNode> arguments = node.arguments();
    double[] args = new double[arguments.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = eval(arguments.get(i), mode);
    }
    if (function == MathFunction.POW) {
      if (args.length != 2) {
        throw domain("pow() requires two arguments: base and exponent");
      }
      return checkDefined(power(args[0], args[1]));
    }
    if (args.length != 1) {
      throw new ExpressionException(
          ErrorType.INTERNAL,
          function.checkArity(args.length).orElse("Bad argument count for " + function));
    }

    double x = args[0];
    double result =
        switch (function) {
          case SIN -> Math.sin(mode.toRadians(x));
          case COS -> Math.cos(mode.toRadians(x));
          case TAN -> {
            double radians = mode.toRadians(x);
            if (Math.abs(Math.cos(radians)) < TAN_ASYMPTOTE_EPSILON) {
              throw domain("Tangent undefined at this angle");
            }
            yield Math.tan(radians);
          }
          case ASIN -> {
            requireUnitRange(function, x);
            yield mode.fromRadians(Math.asin(x));
          }
          case ACOS -> {
            requireUnitRange(function, x);
            yield mode.fromRadians(Math.acos(x));
          }
          case ATAN -> mode.fromRadians(Math.atan(x));
          case SINH -> Math.sinh(x);
          case COSH -> Math.cosh(x);
          case TANH -> Math.tanh(x);
          case LOG -> Math.log10(requirePositive(x));
          case LN -> Math.log(requirePositive(x));
          case LOG2 -> log2(requirePositive(x));
          case SQRT -> {
            if (x < 0) {
              throw domain("Square root of negative number");
            }
            yield Math.sqrt(x);
          }
          case CBRT -> Math.cbrt(x);
          case EXP -> Math.exp(x);
          case POW10 -> Math.pow(10, x);
          case ABS -> Math.abs(x);
          case FLOOR -> Math.floor(x);
          case CEIL -> Math.ceil(x);
          case ROUND -> roundHalfUp(x);
          case FACTORIAL -> factorials.factorial(x);
          case POW -> throw new ExpressionException(ErrorType.INTERNAL, "pow handled above");
        };
    return checkDefined(result);
  }

  private static double power(double base, double exponent) {
    if (base < 0 && !isInteger(exponent)) {
      throw domain("Cannot raise negative number to fractional power");
    }
    return Math.pow(base, exponent);
  }

  private static void requireUnitRange(MathFunction function, double x) {
    if (x < -1 || x > 1) {
      throw domain(function.functionName() + " domain error: input must be between -1 and 1");
    }
  }

  private static double requirePositive(double x) {
    if (x <= 0) {
      throw domain("Logarithm of non-positive number");
    }
    return x;
  }

  // Exact for powers of two, where log(x) / log(2) can be off in the last place.
  private static double log2(double x) {
    if (!Double.isInfinite(x)) {
      int exponent = Math.getExponent(x);
      if (x == Math.scalb(1.0, exponent)) {
        return exponent;
      }
    }
    return Math.log(x) / Math.log(2);
  }

  // Halves round towards positive infinity; NaN, infinities and large values pass through.
  private static double roundHalfUp(double x) {
    if (Double.isNaN(x) || Double.isInfinite(x) || Math.abs(x) >= 0x1p52) {
      return x;
    }
    double floor = Math.floor(x);
    return x - floor >= 0.5 ? floor + 1 : floor;
  }

  private static boolean isInteger(double x) {
    return !Double.isNaN(x) && Math.rint(x) == x;
  }

  private static double checkDefined(double result) {
    if (Double.isNaN(result)) {
      throw domain("Undefined result");
    }
    return result;
  }

  private static ExpressionException domain(String message) {
    return new ExpressionException(ErrorType.DOMAIN, message);
  }
}
