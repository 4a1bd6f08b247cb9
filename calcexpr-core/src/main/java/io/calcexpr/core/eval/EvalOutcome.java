package io.calcexpr.core.eval;

import io.calcexpr.core.ExpressionException.ErrorType;
import java.util.Objects;

/** Result of evaluating a tree: a number or a typed error. */
public sealed interface EvalOutcome permits EvalOutcome.Ok, EvalOutcome.Err {

  boolean isOk();

  record Ok(double value) implements EvalOutcome {
    @Override
    public boolean isOk() {
      return true;
    }
  }

  record Err(String message, ErrorType type) implements EvalOutcome {
    public Err {
      Objects.requireNonNull(message, "message");
      Objects.requireNonNull(type, "type");
    }

    @Override
    public boolean isOk() {
      return false;
    }
  }
}
