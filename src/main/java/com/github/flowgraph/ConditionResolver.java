package com.github.flowgraph;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Decides whether a transition guard holds. Guards containing any expression character go
 * through the full expression engine; anything else is a single name looked up as a registered
 * condition callback, then a bool variable, then a number variable ({@code != 0}), defaulting to
 * false.
 * 
 * Transition guards are parsed once and cached by source text, then re-evaluated on every emit.
 * Ad hoc text passed to {@link #resolveOnce(String)} is parsed on each call and never cached.
 */
final class ConditionResolver {
  private static final String expressionCharacters = "><=!&|()\"";

  private final VariableStore variables;
  private final CallbackRegistry callbacks;
  private final Map<String, Expression> parsed = new HashMap<>();

  ConditionResolver(final VariableStore variables, final CallbackRegistry callbacks) {
    this.variables = variables;
    this.callbacks = callbacks;
  }

  boolean resolve(final String condition) {
    return resolve(condition, true);
  }

  boolean resolveOnce(final String condition) {
    return resolve(condition, false);
  }

  private boolean resolve(final String condition, final boolean cached) {
    if (condition == null || condition.isEmpty()) {
      return true;
    }
    if ("true".equals(condition)) {
      return true;
    }
    if ("false".equals(condition)) {
      return false;
    }
    if (isExpression(condition)) {
      Expression expression = cached ? parsed.get(condition) : null;
      if (expression == null) {
        expression = ExpressionParser.parse(condition);
        if (cached) {
          parsed.put(condition, expression);
        }
      }
      return expression.evaluate(variables).toBool();
    }
    final BooleanSupplier callback = callbacks.findCondition(condition);
    if (callback != null) {
      return callback.getAsBoolean();
    }
    if (variables.hasBool(condition)) {
      return variables.getBool(condition);
    }
    if (variables.hasNumber(condition)) {
      return variables.getNumber(condition) != 0.0;
    }
    return false;
  }

  static boolean isExpression(final String condition) {
    for (int i = 0; i < condition.length(); i++) {
      if (expressionCharacters.indexOf(condition.charAt(i)) >= 0) {
        return true;
      }
    }
    return false;
  }

  int cachedExpressions() {
    return parsed.size();
  }

  void clearCache() {
    parsed.clear();
  }
}
