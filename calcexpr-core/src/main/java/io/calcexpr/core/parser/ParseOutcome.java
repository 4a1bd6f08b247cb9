package io.calcexpr.core.parser;

import io.calcexpr.core.ExpressionException;
import io.calcexpr.core.ExpressionException.ErrorType;
import io.calcexpr.core.expr.ExprNode;
import java.util.Objects;

/** Result of parsing a token list: either a tree or a positioned syntax error. */
public sealed interface ParseOutcome permits ParseOutcome.Ok, ParseOutcome.Err {

  boolean isOk();

  /** Successful parse. */
  record Ok(ExprNode expr) implements ParseOutcome {
    public Ok {
      Objects.requireNonNull(expr, "expr");
    }

    @Override
    public boolean isOk() {
      return true;
    }
  }

  /**
   * Failed parse.
   *
   * @param message user-facing message
   * @param position raw input position, or {@link ExpressionException#NO_POSITION}
   * @param type {@link ErrorType#SYNTAX} or {@link ErrorType#RECURSION_LIMIT}
   * @param unbalancedParenthesis whether the failure is a missing or stray parenthesis
   */
  record Err(String message, int position, ErrorType type, boolean unbalancedParenthesis)
      implements ParseOutcome {
    public Err {
      Objects.requireNonNull(message, "message");
      Objects.requireNonNull(type, "type");
    }

    @Override
    public boolean isOk() {
      return false;
    }

    public boolean hasPosition() {
      return position != ExpressionException.NO_POSITION;
    }
  }
}
