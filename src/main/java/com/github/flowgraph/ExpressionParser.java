package com.github.flowgraph;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive-descent parser for condition expressions, loosest binding first:
 * 
 * <pre>
 * expr       := or
 * or         := and ( "||" and )*
 * and        := equality ( "&amp;&amp;" equality )*
 * equality   := relational ( ("==" | "!=") relational )*
 * relational := unary ( (">" | "<" | ">=" | "<=") unary )*
 * unary      := "!" unary | primary
 * primary    := NUMBER | STRING | IDENT | "(" expr ")"
 * </pre>
 * 
 * Malformed input never raises: a primary that cannot be parsed becomes Number(0), a missing
 * closing parenthesis is tolerated and trailing tokens are ignored. Nesting of {@code (} and
 * {@code !} deeper than {@link #MAX_DEPTH} reads as Number(0) and drops the rest of the input.
 */
public final class ExpressionParser {
  private static final Logger logger =
      LogManager.getLogger(ExpressionParser.class.getSimpleName());

  static final int MAX_DEPTH = 256;

  private final String source;
  private final List<ExpressionToken> tokens;
  private int position;
  private int depth;

  private ExpressionParser(final String source) {
    this.source = source;
    this.tokens = ExpressionTokenizer.tokenize(source);
  }

  static Expression parse(final String source) {
    final ExpressionParser parser = new ExpressionParser(source);
    final Expression expression = parser.parseOr();
    if (parser.position < parser.tokens.size() && logger.isDebugEnabled()) {
      logger.debug(String.format("Ignoring trailing tokens %s in expression '%s'",
          parser.tokens.subList(parser.position, parser.tokens.size()), source));
    }
    return expression;
  }

  /**
   * Parse and evaluate in one go against the given variables.
   */
  public static Value evaluate(final String source, final VariableStore variables) {
    return parse(source).evaluate(variables);
  }

  private Expression parseOr() {
    Expression left = parseAnd();
    while (peek().isOperator("||")) {
      position++;
      left = new Expression.Binary(Expression.Operator.OR, left, parseAnd());
    }
    return left;
  }

  private Expression parseAnd() {
    Expression left = parseEquality();
    while (peek().isOperator("&&")) {
      position++;
      left = new Expression.Binary(Expression.Operator.AND, left, parseEquality());
    }
    return left;
  }

  private Expression parseEquality() {
    Expression left = parseRelational();
    while (true) {
      final ExpressionToken token = peek();
      final Expression.Operator operator;
      if (token.isOperator("==")) {
        operator = Expression.Operator.EQUAL;
      } else if (token.isOperator("!=")) {
        operator = Expression.Operator.NOT_EQUAL;
      } else {
        return left;
      }
      position++;
      left = new Expression.Binary(operator, left, parseRelational());
    }
  }

  private Expression parseRelational() {
    Expression left = parseUnary();
    while (true) {
      final ExpressionToken token = peek();
      final Expression.Operator operator;
      if (token.isOperator(">")) {
        operator = Expression.Operator.GREATER;
      } else if (token.isOperator("<")) {
        operator = Expression.Operator.LESS;
      } else if (token.isOperator(">=")) {
        operator = Expression.Operator.GREATER_EQUAL;
      } else if (token.isOperator("<=")) {
        operator = Expression.Operator.LESS_EQUAL;
      } else {
        return left;
      }
      position++;
      left = new Expression.Binary(operator, left, parseUnary());
    }
  }

  private Expression parseUnary() {
    if (peek().isOperator("!")) {
      if (depth >= MAX_DEPTH) {
        return tooDeep();
      }
      position++;
      depth++;
      final Expression operand = parseUnary();
      depth--;
      return new Expression.Not(operand);
    }
    return parsePrimary();
  }

  private Expression parsePrimary() {
    final ExpressionToken token = peek();
    switch (token.getType()) {
      case NUMBER:
        position++;
        return new Expression.Literal(Value.number(token.getNumber()));
      case STRING:
        position++;
        return new Expression.Literal(Value.string(token.getText()));
      case IDENTIFIER:
        position++;
        return new Expression.Identifier(token.getText());
      case OPERATOR:
        if (token.isOperator("(") && depth >= MAX_DEPTH) {
          return tooDeep();
        }
        position++;
        if (token.isOperator("(")) {
          depth++;
          final Expression inner = parseOr();
          depth--;
          if (peek().isOperator(")")) {
            position++;
          } else {
            degraded("missing ')'");
          }
          return inner;
        }
        degraded("unexpected '" + token.getText() + "'");
        return new Expression.Literal(Value.ZERO);
      default:
        degraded("unexpected end of input");
        return new Expression.Literal(Value.ZERO);
    }
  }

  private Expression tooDeep() {
    degraded("nesting deeper than " + MAX_DEPTH);
    position = tokens.size();
    return new Expression.Literal(Value.ZERO);
  }

  private ExpressionToken peek() {
    return position < tokens.size() ? tokens.get(position) : ExpressionToken.END;
  }

  private void degraded(final String reason) {
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Degrading expression '%s' at token %d: %s", source, position,
          reason));
    }
  }
}
