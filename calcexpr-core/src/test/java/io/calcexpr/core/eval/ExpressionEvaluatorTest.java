package io.calcexpr.core.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.calcexpr.core.ExpressionException.ErrorType;
import io.calcexpr.core.expr.BinaryOpNode;
import io.calcexpr.core.expr.BinaryOperator;
import io.calcexpr.core.expr.ExprNode;
import io.calcexpr.core.expr.FunctionNode;
import io.calcexpr.core.expr.MathFunction;
import io.calcexpr.core.expr.NumberNode;
import io.calcexpr.core.expr.UnaryOpNode;
import io.calcexpr.core.expr.UnaryOperator;
import io.calcexpr.core.lexer.ExpressionTokenizer;
import io.calcexpr.core.parser.ExpressionParser;
import io.calcexpr.core.parser.ParseOutcome;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for ExpressionEvaluator: arithmetic, angle modes, and the domain checks of every function.
 */
class ExpressionEvaluatorTest {

  private static final double EPS = 1e-12;

  private ExpressionEvaluator evaluator;
  private ExpressionTokenizer tokenizer;

  @BeforeEach
  void setUp() {
    evaluator = new ExpressionEvaluator();
    tokenizer = new ExpressionTokenizer();
  }

  private ExprNode parse(String input) {
    ParseOutcome outcome = ExpressionParser.parse(tokenizer.tokenize(input));
    assertTrue(outcome.isOk(), () -> "Parse failed for " + input + ": " + outcome);
    return ((ParseOutcome.Ok) outcome).expr();
  }

  private double value(String input, AngleMode mode) {
    EvalOutcome outcome = evaluator.evaluate(parse(input), mode);
    assertInstanceOf(EvalOutcome.Ok.class, outcome, () -> input + " -> " + outcome);
    return ((EvalOutcome.Ok) outcome).value();
  }

  private double value(String input) {
    return value(input, AngleMode.RADIANS);
  }

  private EvalOutcome.Err error(ExprNode expr) {
    EvalOutcome outcome = evaluator.evaluate(expr, AngleMode.RADIANS);
    assertInstanceOf(EvalOutcome.Err.class, outcome, () -> expr + " -> " + outcome);
    return (EvalOutcome.Err) outcome;
  }

  private String errorMessage(String input, AngleMode mode) {
    EvalOutcome outcome = evaluator.evaluate(parse(input), mode);
    assertInstanceOf(EvalOutcome.Err.class, outcome, () -> input + " -> " + outcome);
    EvalOutcome.Err err = (EvalOutcome.Err) outcome;
    assertEquals(ErrorType.DOMAIN, err.type());
    return err.message();
  }

  private String errorMessage(String input) {
    return errorMessage(input, AngleMode.RADIANS);
  }

  // ==================== Arithmetic ====================

  @ParameterizedTest
  @CsvSource({
    "2+3, 5",
    "3+2, 5",
    "(2+3)*4, 20",
    "2+3*4, 14",
    "3+4*2, 11",
    "10-4-3, 3",
    "2^3^2, 512",
    "-2^2, -4",
    "2^-2, 0.25",
    "2^10, 1024",
    "(-2)^2, 4",
    "--5, 5",
    "50%, 0.5",
    "200*10%, 20",
    "5!, 120",
    "3!!, 720",
    "-1!, -1",
    "1.5e3/3, 500"
  })
  void arithmetic(String input, double expected) {
    assertEquals(expected, value(input), EPS);
  }

  @Test
  void divisionByZero() {
    assertEquals("Division by zero", errorMessage("1/0"));
    assertEquals("Division by zero", errorMessage("10/(5-5)"));
  }

  @Test
  void modulo() {
    ExprNode mod = new BinaryOpNode(BinaryOperator.MOD, new NumberNode(7), new NumberNode(3));
    assertEquals(new EvalOutcome.Ok(1), evaluator.evaluate(mod, AngleMode.RADIANS));

    ExprNode negative =
        new BinaryOpNode(BinaryOperator.MOD, new NumberNode(-7), new NumberNode(3));
    assertEquals(new EvalOutcome.Ok(-1), evaluator.evaluate(negative, AngleMode.RADIANS));
  }

  @Test
  void moduloByZero() {
    ExprNode mod = new BinaryOpNode(BinaryOperator.MOD, new NumberNode(7), new NumberNode(0));
    assertEquals("Modulo by zero", error(mod).message());
  }

  @Test
  void negativeBaseWithFractionalExponent() {
    assertEquals("Cannot raise negative number to fractional power", errorMessage("(-8)^(1/3)"));
    assertEquals(-8, value("(-2)^3"), EPS);
  }

  @Test
  void zeroToNegativePowerIsInfinite() {
    assertEquals(Double.POSITIVE_INFINITY, value("0^-1"));
  }

  @Test
  void notANumberIsUndefined() {
    assertEquals("Undefined result", errorMessage("1e400-1e400"));
    assertEquals("Undefined result", errorMessage("sin(1e400)"));
  }

  // ==================== Factorial ====================

  @Test
  void factorialDomain() {
    assertEquals(1, value("0!"));
    assertEquals(120, value("factorial(5)"));
    assertTrue(Double.isFinite(value("170!")));
    assertEquals("Factorial overflow", errorMessage("171!"));
    assertEquals("Factorial requires integer", errorMessage("5.5!"));
    assertEquals("Factorial of negative number", errorMessage("(-1)!"));
  }

  // ==================== Trigonometry ====================

  @Test
  void sineInBothModes() {
    assertEquals(1, value("sin(90)", AngleMode.DEGREES), EPS);
    assertEquals(1, value("sin(PI/2)", AngleMode.RADIANS), EPS);
    assertEquals(0.5, value("sin(30)", AngleMode.DEGREES), EPS);
  }

  @Test
  void cosineAndTangent() {
    assertEquals(0.5, value("cos(60)", AngleMode.DEGREES), EPS);
    assertEquals(1, value("tan(45)", AngleMode.DEGREES), EPS);
    assertEquals(Math.tan(1), value("tan(1)"), EPS);
  }

  @Test
  void tangentAtAsymptote() {
    assertEquals("Tangent undefined at this angle", errorMessage("tan(90)", AngleMode.DEGREES));
    assertEquals("Tangent undefined at this angle", errorMessage("tan(270)", AngleMode.DEGREES));
    assertEquals("Tangent undefined at this angle", errorMessage("tan(PI/2)"));
  }

  @Test
  void inverseFunctionsConvertTheirResult() {
    assertEquals(90, value("asin(1)", AngleMode.DEGREES), EPS);
    assertEquals(Math.PI / 2, value("asin(1)", AngleMode.RADIANS), EPS);
    assertEquals(60, value("acos(0.5)", AngleMode.DEGREES), 1e-9);
    assertEquals(45, value("atan(1)", AngleMode.DEGREES), EPS);
  }

  @Test
  void inverseFunctionDomain() {
    assertEquals("asin domain error: input must be between -1 and 1", errorMessage("asin(2)"));
    assertEquals("acos domain error: input must be between -1 and 1", errorMessage("acos(-1.5)"));
  }

  @Test
  void hyperbolicFunctionsIgnoreAngleMode() {
    assertEquals(Math.sinh(1), value("sinh(1)", AngleMode.DEGREES), EPS);
    assertEquals(Math.cosh(1), value("cosh(1)", AngleMode.DEGREES), EPS);
    assertEquals(Math.tanh(1), value("tanh(1)", AngleMode.DEGREES), EPS);
  }

  // ==================== Logarithms, roots, powers ====================

  @Test
  void logarithms() {
    assertEquals(2, value("log(100)"));
    assertEquals(1, value("ln(E)"), EPS);
    assertEquals(3, value("log2(8)"));
    assertEquals(Math.log(10) / Math.log(2), value("log2(10)"), EPS);
  }

  @Test
  void logarithmDomain() {
    assertEquals("Logarithm of non-positive number", errorMessage("log(0)"));
    assertEquals("Logarithm of non-positive number", errorMessage("ln(-1)"));
    assertEquals("Logarithm of non-positive number", errorMessage("log2(-8)"));
  }

  @Test
  void roots() {
    assertEquals(4, value("sqrt(16)"));
    assertEquals(-3, value("cbrt(-27)"), EPS);
    assertEquals("Square root of negative number", errorMessage("sqrt(-1)"));
  }

  @Test
  void powerFunctions() {
    assertEquals(1024, value("pow(2, 10)"));
    assertEquals(-8, value("pow(-2, 3)"));
    assertEquals("Cannot raise negative number to fractional power", errorMessage("pow(-8, 0.5)"));
    assertEquals(1, value("exp(0)"));
    assertEquals(1000, value("pow10(3)"), EPS);
  }

  @Test
  void powArityIsCheckedForBuiltTrees() {
    ExprNode pow = new FunctionNode(MathFunction.POW, List.of(new NumberNode(2)));
    assertEquals("pow() requires two arguments: base and exponent", error(pow).message());
  }

  @Test
  void wrongArityOnBuiltTreeIsInternal() {
    ExprNode sin =
        new FunctionNode(MathFunction.SIN, List.of(new NumberNode(1), new NumberNode(2)));
    EvalOutcome.Err err = error(sin);
    assertEquals(ErrorType.INTERNAL, err.type());
    assertEquals("sin() requires 1 argument but got 2", err.message());
  }

  // ==================== Rounding ====================

  @ParameterizedTest
  @CsvSource({
    "abs(-3), 3",
    "floor(-2.5), -3",
    "ceil(2.1), 3",
    "round(2.5), 3",
    "round(-2.5), -2",
    "round(2.4), 2",
    "round(0.49999999999999994), 0"
  })
  void roundingFunctions(String input, double expected) {
    assertEquals(expected, value(input));
  }

  // ==================== Misc ====================

  @Test
  void constants() {
    assertEquals(Math.PI, value("pi"));
    assertEquals(Math.E, value("e"));
    assertEquals((1 + Math.sqrt(5)) / 2, value("phi"));
  }

  @Test
  void treeIsNotModified() {
    ExprNode tree = parse("sin(30)+2^3");
    String before = tree.toString();
    evaluator.evaluate(tree, AngleMode.DEGREES);
    evaluator.evaluate(tree, AngleMode.RADIANS);
    assertEquals(before, tree.toString());
  }

  @Test
  void longSumEvaluates() {
    assertEquals(1001, value("1" + "+1".repeat(1000)));
  }

  // ==================== Long chains ====================

  @Test
  void veryLongFlatSumEvaluates() {
    assertEquals(20001, value("1" + "+1".repeat(20000)));
  }

  @Test
  void veryLongMixedChainEvaluates() {
    assertEquals(0, value("1" + "*2/2-1+1".repeat(10000) + "-1"), EPS);
  }

  @Test
  void errorInsideLongChainIsReported() {
    assertEquals("Division by zero", errorMessage("1" + "+1".repeat(10000) + "/0"));
  }

  @Test
  void powerInsideLongChainKeepsPrecedence() {
    assertEquals(10 + 8 * 5000, value("10" + "+2^3".repeat(5000)));
  }

  @Test
  void deeplyStackedUnaryOperatorsEvaluate() {
    ExprNode node = new NumberNode(3);
    for (int i = 0; i < 50000; i++) {
      node = new UnaryOpNode(UnaryOperator.NEGATE, node);
    }
    node = new UnaryOpNode(UnaryOperator.FACTORIAL, node);
    assertEquals(new EvalOutcome.Ok(6), evaluator.evaluate(node, AngleMode.RADIANS));
  }

  @Test
  void deeplyBuiltLeftSpineEvaluates() {
    ExprNode node = new NumberNode(0);
    for (int i = 0; i < 50000; i++) {
      node = new BinaryOpNode(BinaryOperator.SUB, node, new NumberNode(1));
    }
    assertEquals(new EvalOutcome.Ok(-50000), evaluator.evaluate(node, AngleMode.RADIANS));
  }
}
