package io.calcexpr.core.lexer;

/** Token types produced by {@link ExpressionTokenizer}. */
public enum TokenType {
  /** Numeric literal: 42, .5, 5., 1.2e-3 */
  NUMBER,

  /** Binary or prefix operator: + - * / ^ */
  OPERATOR,

  /** Known function name: sin, log2, pow, ... */
  FUNCTION,

  /** Known constant name: pi, e, phi */
  CONSTANT,

  /** Opening parenthesis: ( */
  LPAREN,

  /** Closing parenthesis: ) */
  RPAREN,

  /** Argument separator: , */
  COMMA,

  /** Postfix factorial: ! */
  FACTORIAL,

  /** Postfix percent: % */
  PERCENT,

  /** End of input */
  END,

  /** Unrecognized character that was skipped; never part of the token list */
  UNKNOWN
}
