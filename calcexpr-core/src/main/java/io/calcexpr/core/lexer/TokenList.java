package io.calcexpr.core.lexer;

import java.util.List;

/**
 * Output of one tokenizer run.
 *
 * @param tokens tokens in input order, always terminated by an {@link TokenType#END} token
 * @param skipped unrecognized characters that were dropped, as {@link TokenType#UNKNOWN} tokens
 */
public record TokenList(List<Token> tokens, List<Token> skipped) {

  public TokenList {
    tokens = List.copyOf(tokens);
    skipped = List.copyOf(skipped);
    if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.END)) {
      throw new IllegalArgumentException("Token list must end with an END token");
    }
  }

  /** True when the input held nothing but skipped characters or whitespace. */
  public boolean isEmpty() {
    return tokens.size() == 1;
  }

  public Token get(int index) {
    return tokens.get(index);
  }

  public int size() {
    return tokens.size();
  }
}
