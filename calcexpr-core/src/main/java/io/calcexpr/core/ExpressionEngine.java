package io.calcexpr.core;

import io.calcexpr.core.ExpressionException.ErrorType;
import io.calcexpr.core.eval.AngleMode;
import io.calcexpr.core.eval.EvalOutcome;
import io.calcexpr.core.eval.ExpressionEvaluator;
import io.calcexpr.core.eval.FactorialTable;
import io.calcexpr.core.format.ResultFormatter;
import io.calcexpr.core.lexer.ExpressionTokenizer;
import io.calcexpr.core.lexer.Token;
import io.calcexpr.core.lexer.TokenList;
import io.calcexpr.core.parser.ExpressionParser;
import io.calcexpr.core.parser.ParseOutcome;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the expression engine.
 *
 * <p>{@link #evaluate} runs the whole pipeline: raw string, tokens, tree, number, display string.
 * {@link #validate} checks syntax only and is cheap enough to call on every keystroke. Neither
 * method throws; every failure is reported in the returned value.
 *
 * <p>An engine holds no per-call state and may be shared between threads.
 */
public final class ExpressionEngine {

  private static final Logger log = LoggerFactory.getLogger(ExpressionEngine.class);

  private final EngineConfig config;
  private final ExpressionTokenizer tokenizer;
  private final ExpressionEvaluator evaluator;
  private final ResultFormatter formatter;

  public ExpressionEngine() {
    this(EngineConfig.defaults());
  }

  public ExpressionEngine(EngineConfig config) {
    this.config = config;
    this.tokenizer = new ExpressionTokenizer(config.strictCharacters());
    this.evaluator = new ExpressionEvaluator(new FactorialTable(config.cacheFactorials()));
    this.formatter = new ResultFormatter(config.displayDigits());
  }

  /**
   * Creates an engine configured from {@link EngineConfig#load()}.
   *
   * @return a new engine
   */
  public static ExpressionEngine create() {
    return new ExpressionEngine(EngineConfig.load());
  }

  public EngineConfig config() {
    return config;
  }

  /** Evaluates an expression in radians mode. */
  public CalculationResult evaluate(String expression) {
    return evaluate(expression, AngleMode.RADIANS);
  }

  /**
   * Evaluates an expression.
   *
   * @param expression the expression as typed
   * @param mode angle mode for trigonometric functions
   * @return the value and its display string, or an error message
   */
  public CalculationResult evaluate(String expression, AngleMode mode) {
    try {
      if (expression == null || expression.isBlank()) {
        return CalculationResult.failure("Empty expression", ErrorType.SYNTAX);
      }
      ParseOutcome parsed = parse(expression);
      if (parsed instanceof ParseOutcome.Err err) {
        log.debug("Parse of '{}' failed at {}: {}", expression, err.position(), err.message());
        return CalculationResult.failure(err.message(), err.type());
      }
      EvalOutcome outcome = evaluator.evaluate(((ParseOutcome.Ok) parsed).expr(), mode);
      if (outcome instanceof EvalOutcome.Err err) {
        log.debug("Evaluation of '{}' failed: {}", expression, err.message());
        return CalculationResult.failure(err.message(), err.type());
      }
      double value = ((EvalOutcome.Ok) outcome).value();
      return CalculationResult.success(value, formatter.format(value));
    } catch (RuntimeException e) {
      log.warn("Unexpected failure evaluating '{}'", expression, e);
      return CalculationResult.failure("Calculation error", ErrorType.INTERNAL);
    }
  }

  /**
   * Tokenizes and parses an expression without evaluating it.
   *
   * @param expression the expression as typed
   * @return the tree, or a lexical or syntax error
   */
  public ParseOutcome parse(String expression) {
    TokenList tokens;
    try {
      tokens = tokenizer.tokenize(expression);
    } catch (ExpressionException e) {
      return new ParseOutcome.Err(e.getMessage(), e.getPosition(), e.getType(), false);
    }
    return ExpressionParser.parse(tokens, config.maxDepth());
  }

  /**
   * Checks an expression for syntax errors.
   *
   * <p>A parenthesis balance scan runs first, reporting the first stray {@code )} or the number of
   * missing {@code )}. Then a full tokenize and parse appends any other lexical or syntax error; a
   * parse error describing the same parenthesis problem as the scan is not repeated.
   * Characters the tokenizer skips are listed as warnings.
   *
   * @param expression the expression as typed, possibly incomplete
   * @return the errors and warnings found
   */
  public ValidationResult validate(String expression) {
    if (expression == null || expression.isBlank()) {
      return ValidationResult.of(
          List.of(ValidationResult.Issue.of("Expression is empty")), List.of());
    }
    List<ValidationResult.Issue> balance = checkParentheses(expression);
    List<ValidationResult.Issue> errors = new ArrayList<>(balance);
    List<String> warnings = new ArrayList<>();

    try {
      TokenList tokens = tokenizer.tokenize(expression);
      for (Token skipped : tokens.skipped()) {
        warnings.add(
            "Ignored unrecognized character '"
                + skipped.text()
                + "' at position "
                + skipped.start());
      }
      ParseOutcome parsed = ExpressionParser.parse(tokens, config.maxDepth());
      if (parsed instanceof ParseOutcome.Err err
          && !sameParenthesisError(err, balance, expression.length())) {
        errors.add(new ValidationResult.Issue(err.message(), err.position()));
      }
    } catch (ExpressionException e) {
      errors.add(new ValidationResult.Issue(e.getMessage(), e.getPosition()));
    } catch (RuntimeException e) {
      log.warn("Unexpected failure validating '{}'", expression, e);
      errors.add(ValidationResult.Issue.of("Validation error"));
    }
    return ValidationResult.of(errors, warnings);
  }

  /**
   * Formats a value the way {@link #evaluate} does.
   *
   * @param value any double, including NaN and infinities
   * @return the display string
   */
  public String format(double value) {
    return formatter.format(value);
  }

  // The balance scan reports a stray ')' at its position and missing ones without a position; the
  // parser reports the same facts at that ')' or at the end of input.
  private static boolean sameParenthesisError(
      ParseOutcome.Err err, List<ValidationResult.Issue> balance, int inputLength) {
    if (balance.isEmpty() || !err.unbalancedParenthesis()) {
      return false;
    }
    ValidationResult.Issue reported = balance.get(0);
    int expected = reported.hasPosition() ? reported.position() : inputLength;
    return err.position() == expected;
  }

  static List<ValidationResult.Issue> checkParentheses(String expression) {
    int depth = 0;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth < 0) {
          return List.of(ValidationResult.Issue.at("Unmatched closing parenthesis", i));
        }
      }
    }
    if (depth > 0) {
      return List.of(
          ValidationResult.Issue.of("Missing " + depth + " closing parenthesis(es)"));
    }
    return List.of();
  }
}
