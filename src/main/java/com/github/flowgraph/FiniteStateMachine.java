package com.github.flowgraph;

import java.util.List;

/**
 * The event-driven half of a runtime. Transitions are scanned in list order and the first one
 * leaving the current state on the emitted event whose guard holds wins.
 */
final class FiniteStateMachine {
  static final int NOT_STARTED = -1;

  private final List<State> states;
  private final List<Transition> transitions;
  private final CallbackRegistry callbacks;
  private final ConditionResolver resolver;
  private int currentState = NOT_STARTED;

  FiniteStateMachine(final List<State> states, final List<Transition> transitions,
      final CallbackRegistry callbacks, final ConditionResolver resolver) {
    this.states = states;
    this.transitions = transitions;
    this.callbacks = callbacks;
    this.resolver = resolver;
  }

  /**
   * Enter state 0. No-op with no states.
   */
  void start() {
    if (states.isEmpty()) {
      currentState = NOT_STARTED;
      return;
    }
    currentState = 0;
    callbacks.invokeAction(states.get(0).getOnEnterAction(), 0.0);
  }

  void reset() {
    currentState = NOT_STARTED;
  }

  /**
   * Returns the transition that fired, or null when the state is unchanged.
   */
  Transition emit(final String eventName) {
    if (!inRange(currentState)) {
      return null;
    }
    for (Transition transition : transitions) {
      if (transition.getFromState() != currentState
          || !transition.getEventName().equals(eventName) || !inRange(transition.getToState())) {
        continue;
      }
      if (!resolver.resolve(transition.getCondition())) {
        continue;
      }
      callbacks.invokeAction(states.get(currentState).getOnExitAction(), 0.0);
      currentState = transition.getToState();
      callbacks.invokeAction(states.get(currentState).getOnEnterAction(), 0.0);
      return transition;
    }
    return null;
  }

  private boolean inRange(final int index) {
    return index >= 0 && index < states.size();
  }

  int getCurrentState() {
    return currentState;
  }

  State getCurrent() {
    return inRange(currentState) ? states.get(currentState) : null;
  }
}
