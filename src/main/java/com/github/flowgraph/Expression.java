package com.github.flowgraph;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parsed condition expression. Evaluation is total: it never throws and only reads the variable
 * store.
 */
abstract class Expression {

  abstract Value evaluate(VariableStore variables);

  static final class Literal extends Expression {
    private final Value value;

    Literal(final Value value) {
      this.value = value;
    }

    @Override
    Value evaluate(final VariableStore variables) {
      return value;
    }

    @Override
    public String toString() {
      return value.getKind() == VariableKind.STRING ? "\"" + value.toText() + "\""
          : value.toText();
    }
  }

  static final class Identifier extends Expression {
    private final String name;

    Identifier(final String name) {
      this.name = name;
    }

    @Override
    Value evaluate(final VariableStore variables) {
      return variables.resolve(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  static final class Not extends Expression {
    private final Expression operand;

    Not(final Expression operand) {
      this.operand = operand;
    }

    @Override
    Value evaluate(final VariableStore variables) {
      return Value.bool(!operand.evaluate(variables).toBool());
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }

  enum Operator {
    OR("||"), AND("&&"), EQUAL("=="), NOT_EQUAL("!="), GREATER(">"), LESS("<"), GREATER_EQUAL(
        ">="), LESS_EQUAL("<=");

    private final String symbol;

    private Operator(final String symbol) {
      this.symbol = symbol;
    }

    String getSymbol() {
      return symbol;
    }
  }

  static final class Binary extends Expression {
    private final Operator operator;
    private final Expression left;
    private final Expression right;

    Binary(final Operator operator, final Expression left, final Expression right) {
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    /**
     * Walks the left spine iteratively, long operator chains parse into left-deep trees.
     */
    @Override
    Value evaluate(final VariableStore variables) {
      final Deque<Binary> spine = new ArrayDeque<>();
      Expression node = this;
      while (node instanceof Binary) {
        spine.push((Binary) node);
        node = ((Binary) node).left;
      }
      Value result = node.evaluate(variables);
      while (!spine.isEmpty()) {
        final Binary binary = spine.pop();
        // both sides always evaluated, && and || do not short-circuit
        result = binary.apply(result, binary.right.evaluate(variables));
      }
      return result;
    }

    private Value apply(final Value lhs, final Value rhs) {
      switch (operator) {
        case OR:
          return Value.bool(lhs.toBool() | rhs.toBool());
        case AND:
          return Value.bool(lhs.toBool() & rhs.toBool());
        case EQUAL:
          return Value.bool(equal(lhs, rhs));
        case NOT_EQUAL:
          return Value.bool(!equal(lhs, rhs));
        case GREATER:
          return Value.bool(lhs.toNumber() > rhs.toNumber());
        case LESS:
          return Value.bool(lhs.toNumber() < rhs.toNumber());
        case GREATER_EQUAL:
          return Value.bool(lhs.toNumber() >= rhs.toNumber());
        case LESS_EQUAL:
          return Value.bool(lhs.toNumber() <= rhs.toNumber());
        default:
          return Value.ZERO;
      }
    }

    private static boolean equal(final Value lhs, final Value rhs) {
      if (lhs.getKind() == VariableKind.STRING || rhs.getKind() == VariableKind.STRING) {
        return lhs.toText().equals(rhs.toText());
      }
      return lhs.toNumber() == rhs.toNumber();
    }

    @Override
    public String toString() {
      return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
  }
}
