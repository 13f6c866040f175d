package com.github.flowgraph;

/**
 * Immutable tagged value produced by the expression engine: exactly one of Number, String or
 * Bool. The set of variants is closed, the constructor is private to this file and callers
 * switch over {@link #getKind()}.
 */
public abstract class Value {
  public static final Value ZERO = new NumberValue(0.0);
  public static final Value TRUE = new BoolValue(true);
  public static final Value FALSE = new BoolValue(false);

  private Value() {}

  public static Value number(final double number) {
    return new NumberValue(number);
  }

  public static Value string(final String text) {
    return new StringValue(text == null ? "" : text);
  }

  public static Value bool(final boolean bool) {
    return bool ? TRUE : FALSE;
  }

  public abstract VariableKind getKind();

  /**
   * Bool passes through, a String is true iff non-empty, a Number is true iff non-zero.
   */
  public abstract boolean toBool();

  /**
   * Numeric view used by the relational and numeric equality operators. Strings contribute 0,
   * Bools contribute 1 or 0.
   */
  public abstract double toNumber();

  /**
   * Text view used when either side of an equality is a String.
   */
  public abstract String toText();

  /**
   * Integral finite numbers print without a fraction, everything else uses
   * {@link Double#toString(double)}. Negative zero keeps its sign.
   */
  public static String formatNumber(final double number) {
    if (Double.doubleToRawLongBits(number) == Long.MIN_VALUE) {
      return Double.toString(number);
    }
    if (!Double.isInfinite(number) && !Double.isNaN(number) && number == Math.rint(number)
        && Math.abs(number) < 1e15) {
      return Long.toString((long) number);
    }
    return Double.toString(number);
  }

  private static final class NumberValue extends Value {
    private final double number;

    private NumberValue(final double number) {
      this.number = number;
    }

    @Override
    public VariableKind getKind() {
      return VariableKind.NUMBER;
    }

    @Override
    public boolean toBool() {
      return number != 0.0;
    }

    @Override
    public double toNumber() {
      return number;
    }

    @Override
    public String toText() {
      return formatNumber(number);
    }
  }

  private static final class StringValue extends Value {
    private final String text;

    private StringValue(final String text) {
      this.text = text;
    }

    @Override
    public VariableKind getKind() {
      return VariableKind.STRING;
    }

    @Override
    public boolean toBool() {
      return !text.isEmpty();
    }

    @Override
    public double toNumber() {
      return 0.0;
    }

    @Override
    public String toText() {
      return text;
    }
  }

  private static final class BoolValue extends Value {
    private final boolean bool;

    private BoolValue(final boolean bool) {
      this.bool = bool;
    }

    @Override
    public VariableKind getKind() {
      return VariableKind.BOOL;
    }

    @Override
    public boolean toBool() {
      return bool;
    }

    @Override
    public double toNumber() {
      return bool ? 1.0 : 0.0;
    }

    @Override
    public String toText() {
      return bool ? "true" : "false";
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = prime + getKind().hashCode();
    result = prime * result + toText().hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value)) {
      return false;
    }
    Value other = (Value) obj;
    if (getKind() != other.getKind()) {
      return false;
    }
    if (getKind() == VariableKind.NUMBER) {
      return Double.compare(toNumber(), other.toNumber()) == 0;
    }
    return toText().equals(other.toText());
  }

  @Override
  public String toString() {
    return getKind() + "(" + toText() + ")";
  }
}
