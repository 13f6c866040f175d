package com.github.flowgraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The three per-type variable tables of a runtime. A name lives in at most one table at a time:
 * every setter evicts the name from the other two. Lookups stay independent per table, there is
 * no central type registry.
 * 
 * Not thread-safe, it is owned by exactly one runtime.
 */
public final class VariableStore {
  private final Map<String, Double> numbers = new LinkedHashMap<>();
  private final Map<String, Boolean> bools = new LinkedHashMap<>();
  private final Map<String, String> strings = new LinkedHashMap<>();

  public void setNumber(final String name, final double value) {
    bools.remove(name);
    strings.remove(name);
    numbers.put(name, value);
  }

  public void setBool(final String name, final boolean value) {
    numbers.remove(name);
    strings.remove(name);
    bools.put(name, value);
  }

  public void setString(final String name, final String value) {
    numbers.remove(name);
    bools.remove(name);
    strings.put(name, value == null ? "" : value);
  }

  public void set(final Variable variable) {
    switch (variable.getKind()) {
      case BOOL:
        setBool(variable.getName(), variable.getValue().toBool());
        break;
      case STRING:
        setString(variable.getName(), variable.getValue().toText());
        break;
      default:
        setNumber(variable.getName(), variable.getValue().toNumber());
        break;
    }
  }

  public boolean remove(final String name) {
    final boolean removed =
        numbers.remove(name) != null | bools.remove(name) != null | strings.remove(name) != null;
    return removed;
  }

  public void clear() {
    numbers.clear();
    bools.clear();
    strings.clear();
  }

  public boolean hasNumber(final String name) {
    return numbers.containsKey(name);
  }

  public boolean hasBool(final String name) {
    return bools.containsKey(name);
  }

  public boolean hasString(final String name) {
    return strings.containsKey(name);
  }

  public double getNumber(final String name) {
    final Double value = numbers.get(name);
    return value == null ? 0.0 : value;
  }

  public boolean getBool(final String name) {
    final Boolean value = bools.get(name);
    return value != null && value;
  }

  public String getString(final String name) {
    final String value = strings.get(name);
    return value == null ? "" : value;
  }

  /**
   * Identifier resolution of the expression engine: string table, then bool table, then number
   * table, and Number(0) when the name is in none of them.
   */
  public Value resolve(final String name) {
    final String text = strings.get(name);
    if (text != null) {
      return Value.string(text);
    }
    final Boolean bool = bools.get(name);
    if (bool != null) {
      return Value.bool(bool);
    }
    final Double number = numbers.get(name);
    if (number != null) {
      return Value.number(number);
    }
    return Value.ZERO;
  }

  /**
   * Current contents as variables, numbers first, then bools, then strings, each in insertion
   * order.
   */
  public List<Variable> toVariables() {
    final List<Variable> variables = new ArrayList<>();
    for (Map.Entry<String, Double> entry : numbers.entrySet()) {
      variables.add(Variable.number(entry.getKey(), entry.getValue()));
    }
    for (Map.Entry<String, Boolean> entry : bools.entrySet()) {
      variables.add(Variable.bool(entry.getKey(), entry.getValue()));
    }
    for (Map.Entry<String, String> entry : strings.entrySet()) {
      variables.add(Variable.string(entry.getKey(), entry.getValue()));
    }
    return variables;
  }

  @Override
  public String toString() {
    return "VariableStore [numbers=" + numbers + ", bools=" + bools + ", strings=" + strings + "]";
  }
}
