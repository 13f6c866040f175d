package com.github.flowgraph;

import java.util.Objects;

/**
 * A named, typed variable of a flow graph together with its initial value.
 */
public final class Variable {
  private final String name;
  private final VariableKind kind;
  private final Value value;

  public Variable(final String name, final VariableKind kind, final Value value) {
    this.name = name == null ? "" : name;
    this.kind = kind == null ? VariableKind.NUMBER : kind;
    this.value = coerce(this.kind, value);
  }

  public static Variable number(final String name, final double value) {
    return new Variable(name, VariableKind.NUMBER, Value.number(value));
  }

  public static Variable bool(final String name, final boolean value) {
    return new Variable(name, VariableKind.BOOL, Value.bool(value));
  }

  public static Variable string(final String name, final String value) {
    return new Variable(name, VariableKind.STRING, Value.string(value));
  }

  // the stored value always matches the declared kind
  private static Value coerce(final VariableKind kind, final Value value) {
    if (value == null) {
      switch (kind) {
        case BOOL:
          return Value.FALSE;
        case STRING:
          return Value.string("");
        default:
          return Value.ZERO;
      }
    }
    if (value.getKind() == kind) {
      return value;
    }
    switch (kind) {
      case BOOL:
        return Value.bool(value.toBool());
      case STRING:
        return Value.string(value.toText());
      default:
        return Value.number(value.toNumber());
    }
  }

  public String getName() {
    return name;
  }

  public VariableKind getKind() {
    return kind;
  }

  public Value getValue() {
    return value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Variable other = (Variable) obj;
    return name.equals(other.name) && kind == other.kind && value.equals(other.value);
  }

  @Override
  public String toString() {
    return "Variable [name=" + name + ", kind=" + kind + ", value=" + value.toText() + "]";
  }
}
