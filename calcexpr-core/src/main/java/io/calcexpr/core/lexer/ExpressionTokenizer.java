package io.calcexpr.core.lexer;

import io.calcexpr.core.ExpressionException;
import io.calcexpr.core.ExpressionException.ErrorType;
import io.calcexpr.core.expr.MathConstant;
import io.calcexpr.core.expr.MathFunction;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for calculator expressions.
 *
 * <p>The input is first normalized by {@link InputNormalizer}, then scanned in a single pass:
 *
 * <ul>
 *   <li>Numbers: {@code 42}, {@code .5}, {@code 5.}, {@code 1.5e-3}
 *   <li>Operators: + - * / ^
 *   <li>Structure: ( ) ,
 *   <li>Postfix markers: ! %
 *   <li>Identifiers: constants (pi, e, phi) and function names, case-insensitive
 * </ul>
 *
 * <p>An identifier that is neither a constant nor a function is a lexical error. Any other
 * character is skipped and recorded in {@link TokenList#skipped()}, unless the tokenizer is strict,
 * in which case it is a lexical error as well.
 */
public final class ExpressionTokenizer {

  private final boolean strict;

  /** Creates a lenient tokenizer that skips unrecognized characters. */
  public ExpressionTokenizer() {
    this(false);
  }

  /**
   * Creates a tokenizer.
   *
   * @param strict whether unrecognized characters are errors instead of being skipped
   */
  public ExpressionTokenizer(boolean strict) {
    this.strict = strict;
  }

  /**
   * Tokenizes an expression.
   *
   * @param raw the expression as typed
   * @return the tokens, ending with an END token
   * @throws ExpressionException of type {@link ErrorType#LEXICAL} for unknown identifiers, and in
   *     strict mode for unrecognized characters
   */
  public TokenList tokenize(String raw) {
    InputNormalizer.Normalized input = InputNormalizer.normalize(raw == null ? "" : raw);
    String line = input.text();
    int len = line.length();
    List<Token> tokens = new ArrayList<>();
    List<Token> skipped = new ArrayList<>();
    int pos = 0;

    while (pos < len) {
      char c = line.charAt(pos);

      if (isDigit(c) || (c == '.' && pos + 1 < len && isDigit(line.charAt(pos + 1)))) {
        pos = readNumber(input, pos, tokens);
        continue;
      }

      TokenType singleCharType = matchSingleChar(c);
      if (singleCharType != null) {
        int rawStart = input.rawOffset(pos);
        tokens.add(
            Token.of(singleCharType, String.valueOf(c), rawStart, input.rawEnd(pos + 1)));
        pos++;
        continue;
      }

      if (isAlpha(c)) {
        pos = readIdentifier(input, pos, tokens);
        continue;
      }

      int rawPos = input.rawOffset(pos);
      if (strict) {
        throw new ExpressionException(
            ErrorType.LEXICAL, "Unexpected character '" + c + "' at position " + rawPos, rawPos);
      }
      skipped.add(Token.of(TokenType.UNKNOWN, String.valueOf(c), rawPos, rawPos + 1));
      pos++;
    }

    tokens.add(Token.of(TokenType.END, "", input.rawLength(), input.rawLength()));
    return new TokenList(tokens, skipped);
  }

  private int readNumber(InputNormalizer.Normalized input, int start, List<Token> tokens) {
    String line = input.text();
    int len = line.length();
    int pos = start;
    while (pos < len && isDigit(line.charAt(pos))) {
      pos++;
    }
    if (pos < len && line.charAt(pos) == '.') {
      pos++;
      while (pos < len && isDigit(line.charAt(pos))) {
        pos++;
      }
    }
    // Exponent suffix only when digits follow the 'e' (optionally after a sign); otherwise the
    // 'e' starts an identifier such as the constant e.
    if (pos < len && (line.charAt(pos) == 'e' || line.charAt(pos) == 'E')) {
      int exp = pos + 1;
      if (exp < len && (line.charAt(exp) == '+' || line.charAt(exp) == '-')) {
        exp++;
      }
      if (exp < len && isDigit(line.charAt(exp))) {
        pos = exp;
        while (pos < len && isDigit(line.charAt(pos))) {
          pos++;
        }
      }
    }

    String text = line.substring(start, pos);
    double value = Double.parseDouble(text);
    tokens.add(Token.number(text, value, input.rawOffset(start), input.rawEnd(pos)));
    return pos;
  }

  private int readIdentifier(InputNormalizer.Normalized input, int start, List<Token> tokens) {
    String line = input.text();
    int pos = start;
    while (pos < line.length() && isAlphaNumeric(line.charAt(pos))) {
      pos++;
    }
    String word = line.substring(start, pos);
    int rawStart = input.rawOffset(start);
    int rawEnd = input.rawEnd(pos);

    var constant = MathConstant.lookup(word);
    if (constant.isPresent()) {
      tokens.add(Token.of(TokenType.CONSTANT, constant.get().name(), rawStart, rawEnd));
      return pos;
    }
    var function = MathFunction.lookup(word);
    if (function.isPresent()) {
      tokens.add(Token.of(TokenType.FUNCTION, function.get().functionName(), rawStart, rawEnd));
      return pos;
    }
    throw new ExpressionException(
        ErrorType.LEXICAL, "Unknown identifier: " + word + " at position " + rawStart, rawStart);
  }

  private static TokenType matchSingleChar(char c) {
    return switch (c) {
      case '+', '-', '*', '/', '^' -> TokenType.OPERATOR;
      case '(' -> TokenType.LPAREN;
      case ')' -> TokenType.RPAREN;
      case ',' -> TokenType.COMMA;
      case '!' -> TokenType.FACTORIAL;
      case '%' -> TokenType.PERCENT;
      default -> null;
    };
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isAlphaNumeric(char c) {
    return isDigit(c) || isAlpha(c);
  }
}
