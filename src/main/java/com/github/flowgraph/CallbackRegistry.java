package com.github.flowgraph;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Name to callback tables of one runtime. Unbound action names are no-ops and unbound condition
 * names report false. Empty names are never bound.
 */
final class CallbackRegistry {
  private final Map<String, FlowAction> actions = new HashMap<>();
  private final Map<String, BooleanSupplier> conditions = new HashMap<>();

  void registerAction(final String name, final FlowAction action) {
    if (name == null || name.isEmpty()) {
      return;
    }
    if (action == null) {
      actions.remove(name);
    } else {
      actions.put(name, action);
    }
  }

  void registerCondition(final String name, final BooleanSupplier condition) {
    if (name == null || name.isEmpty()) {
      return;
    }
    if (condition == null) {
      conditions.remove(name);
    } else {
      conditions.put(name, condition);
    }
  }

  /**
   * Returns true iff a callback was bound and invoked.
   */
  boolean invokeAction(final String name, final double dt) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    final FlowAction action = actions.get(name);
    if (action == null) {
      return false;
    }
    action.run(dt);
    return true;
  }

  BooleanSupplier findCondition(final String name) {
    return conditions.get(name);
  }
}
