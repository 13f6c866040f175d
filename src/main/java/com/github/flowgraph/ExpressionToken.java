package com.github.flowgraph;

/**
 * A lexical token of the condition expression language.
 */
final class ExpressionToken {
  enum Type {
    NUMBER, STRING, IDENTIFIER, OPERATOR, END
  }

  static final ExpressionToken END = new ExpressionToken(Type.END, "", 0.0);

  private final Type type;
  private final String text;
  private final double number;

  ExpressionToken(final Type type, final String text, final double number) {
    this.type = type;
    this.text = text;
    this.number = number;
  }

  Type getType() {
    return type;
  }

  String getText() {
    return text;
  }

  double getNumber() {
    return number;
  }

  boolean isOperator(final String operator) {
    return type == Type.OPERATOR && text.equals(operator);
  }

  @Override
  public String toString() {
    return type + "[" + text + "]";
  }
}
