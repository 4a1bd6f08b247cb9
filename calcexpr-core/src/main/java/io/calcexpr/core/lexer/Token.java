package io.calcexpr.core.lexer;

import io.calcexpr.core.expr.MathConstant;
import io.calcexpr.core.expr.MathFunction;

/**
 * A single token of an expression.
 *
 * <p>Positions refer to the raw input as typed by the user, before glyph replacement and
 * whitespace removal, so they can be shown next to the original text.
 *
 * @param type the type of this token
 * @param text the normalized source text of this token
 * @param number the parsed value for {@link TokenType#NUMBER} tokens, {@code NaN} otherwise
 * @param start raw input position where the token starts (inclusive)
 * @param end raw input position where the token ends (exclusive)
 */
public record Token(TokenType type, String text, double number, int start, int end) {

  public static Token of(TokenType type, String text, int start, int end) {
    return new Token(type, text, Double.NaN, start, end);
  }

  public static Token number(String text, double value, int start, int end) {
    return new Token(TokenType.NUMBER, text, value, start, end);
  }

  public boolean is(TokenType expected) {
    return type == expected;
  }

  /** Checks for an {@link TokenType#OPERATOR} token with the given symbol. */
  public boolean isOperator(char symbol) {
    return type == TokenType.OPERATOR && text.length() == 1 && text.charAt(0) == symbol;
  }

  /**
   * Resolves a {@link TokenType#FUNCTION} token to its function.
   *
   * @throws IllegalStateException if this is not a function token
   */
  public MathFunction function() {
    if (type != TokenType.FUNCTION) {
      throw new IllegalStateException("Not a function token: " + this);
    }
    return MathFunction.lookup(text)
        .orElseThrow(() -> new IllegalStateException("Unknown function token: " + text));
  }

  /**
   * Resolves a {@link TokenType#CONSTANT} token to its constant.
   *
   * @throws IllegalStateException if this is not a constant token
   */
  public MathConstant constant() {
    if (type != TokenType.CONSTANT) {
      throw new IllegalStateException("Not a constant token: " + this);
    }
    return MathConstant.lookup(text)
        .orElseThrow(() -> new IllegalStateException("Unknown constant token: " + text));
  }

  /** Text used when reporting this token in an error message. */
  public String describe() {
    return type == TokenType.END ? "end of expression" : text;
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%d-%d", type, text, start, end);
  }
}
