package io.calcexpr.core.parser;

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
import io.calcexpr.core.lexer.Token;
import io.calcexpr.core.lexer.TokenList;
import io.calcexpr.core.lexer.TokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for calculator expressions.
 *
 * <p>Grammar, lowest to highest precedence:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := postfix ('^' unary)?
 * postfix    := primary ('!' | '%')*
 * primary    := NUMBER | CONSTANT
 *             | FUNCTION '(' expression (',' expression)* ')'
 *             | '(' expression ')'
 * </pre>
 *
 * <p>The exponent goes back through {@code unary}, so {@code -2^2} is {@code -(2^2)} while {@code
 * 2^-2} still parses, and {@code 2^3^2} groups to the right. A run of signs collapses into at most
 * one negation, so {@code --5} is just {@code 5}.
 *
 * <p>Parenthesized groups and argument lists count towards a nesting limit; exceeding it fails
 * with "Expression too deeply nested" rather than exhausting the stack.
 */
public final class ExpressionParser {

  /** Default maximum nesting of parentheses and function calls. */
  public static final int DEFAULT_MAX_DEPTH = 100;

  private final TokenList tokens;
  private final int maxDepth;
  private int pos = 0;
  private int depth = 0;

  private ExpressionParser(TokenList tokens, int maxDepth) {
    this.tokens = tokens;
    this.maxDepth = maxDepth;
  }

  public static ParseOutcome parse(TokenList tokens) {
    return parse(tokens, DEFAULT_MAX_DEPTH);
  }

  /**
   * Parses a token list into an expression tree.
   *
   * @param tokens tokens produced by the tokenizer
   * @param maxDepth maximum nesting of parentheses and function calls
   * @return the tree, or the first syntax error found
   */
  public static ParseOutcome parse(TokenList tokens, int maxDepth) {
    return new ExpressionParser(tokens, maxDepth).parseAll();
  }

  private ParseOutcome parseAll() {
    if (tokens.isEmpty()) {
      return new ParseOutcome.Err(
          "Empty expression", ExpressionException.NO_POSITION, ErrorType.SYNTAX, false);
    }
    try {
      ExprNode expr = parseExpression();
      Token next = current();
      if (!next.is(TokenType.END)) {
        throw unexpected(next);
      }
      return new ParseOutcome.Ok(expr);
    } catch (ExpressionException e) {
      return new ParseOutcome.Err(
          e.getMessage(),
          e.getPosition(),
          e.getType(),
          e instanceof UnbalancedParenthesisException);
    } catch (StackOverflowError e) {
      // Long operator chains recurse without touching the nesting counter
      return new ParseOutcome.Err(
          "Expression too deeply nested", current().start(), ErrorType.RECURSION_LIMIT, false);
    }
  }

  private ExprNode parseExpression() {
    ExprNode left = parseTerm();
    while (current().isOperator('+') || current().isOperator('-')) {
      BinaryOperator op = BinaryOperator.fromSymbol(advance().text());
      left = new BinaryOpNode(op, left, parseTerm());
    }
    return left;
  }

  private ExprNode parseTerm() {
    ExprNode left = parseUnary();
    while (current().isOperator('*') || current().isOperator('/')) {
      BinaryOperator op = BinaryOperator.fromSymbol(advance().text());
      left = new BinaryOpNode(op, left, parseUnary());
    }
    return left;
  }

  private ExprNode parseUnary() {
    int negations = 0;
    while (current().isOperator('-') || current().isOperator('+')) {
      if (advance().isOperator('-')) {
        negations++;
      }
    }
    ExprNode node = parsePower();
    // Only the parity of a run of negations matters
    return negations % 2 == 0 ? node : new UnaryOpNode(UnaryOperator.NEGATE, node);
  }

  private ExprNode parsePower() {
    ExprNode base = parsePostfix();
    if (current().isOperator('^')) {
      advance();
      return new BinaryOpNode(BinaryOperator.POW, base, parseUnary());
    }
    return base;
  }

  private ExprNode parsePostfix() {
    ExprNode node = parsePrimary();
    while (true) {
      if (current().is(TokenType.FACTORIAL)) {
        advance();
        node = new UnaryOpNode(UnaryOperator.FACTORIAL, node);
      } else if (current().is(TokenType.PERCENT)) {
        advance();
        node = new UnaryOpNode(UnaryOperator.PERCENT, node);
      } else {
        return node;
      }
    }
  }

  private ExprNode parsePrimary() {
    Token token = current();
    return switch (token.type()) {
      case NUMBER -> {
        advance();
        yield new NumberNode(token.number());
      }
      case CONSTANT -> {
        advance();
        yield new ConstantNode(token.constant());
      }
      case FUNCTION -> parseFunction();
      case LPAREN -> {
        enter(token);
        advance();
        ExprNode inner = parseExpression();
        expectClosing();
        depth--;
        yield inner;
      }
      default -> throw unexpected(token);
    };
  }

  private ExprNode parseFunction() {
    Token nameToken = advance();
    MathFunction function = nameToken.function();
    enter(nameToken);
    if (!current().is(TokenType.LPAREN)) {
      throw new ExpressionException(
          ErrorType.SYNTAX,
          "Expected opening parenthesis after function name",
          current().start());
    }
    advance();

    if (current().is(TokenType.RPAREN)) {
      throw new ExpressionException(
          ErrorType.SYNTAX,
          function.checkArity(0).orElse("Unexpected token: )"),
          current().start());
    }
    List<ExprNode> args = new ArrayList<>();
    args.add(parseExpression());
    while (current().is(TokenType.COMMA)) {
      advance();
      args.add(parseExpression());
    }
    expectClosing();
    depth--;

    var arityError = function.checkArity(args.size());
    if (arityError.isPresent()) {
      throw new ExpressionException(ErrorType.SYNTAX, arityError.get(), nameToken.start());
    }
    return new FunctionNode(function, args);
  }

  private void enter(Token at) {
    if (++depth > maxDepth) {
      throw new ExpressionException(
          ErrorType.RECURSION_LIMIT, "Expression too deeply nested", at.start());
    }
  }

  private void expectClosing() {
    if (!current().is(TokenType.RPAREN)) {
      Token found = current();
      if (found.is(TokenType.END)) {
        throw new UnbalancedParenthesisException("Expected closing parenthesis", found.start());
      }
      throw new ExpressionException(
          ErrorType.SYNTAX,
          "Expected closing parenthesis but found " + found.describe(),
          found.start());
    }
    advance();
  }

  private ExpressionException unexpected(Token token) {
    String message = "Unexpected token: " + token.describe();
    if (token.is(TokenType.RPAREN)) {
      return new UnbalancedParenthesisException(message, token.start());
    }
    return new ExpressionException(ErrorType.SYNTAX, message, token.start());
  }

  private Token current() {
    return tokens.get(Math.min(pos, tokens.size() - 1));
  }

  private Token advance() {
    Token token = current();
    if (pos < tokens.size() - 1) {
      pos++;
    }
    return token;
  }

  /** Missing or stray parenthesis, reported separately by the balance check in validation. */
  private static final class UnbalancedParenthesisException extends ExpressionException {
    UnbalancedParenthesisException(String message, int position) {
      super(ErrorType.SYNTAX, message, position);
    }
  }
}
