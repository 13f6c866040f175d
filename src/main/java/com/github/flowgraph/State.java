package com.github.flowgraph;

/**
 * This object represents immutable metadata about a state. A state is identified by its index in
 * the graph's state list, the name is for display and code generation only. Hook names are empty
 * when unbound.
 */
public final class State {
  private final String name;
  private final String onEnterAction;
  private final String onExitAction;

  public State(final String name, final String onEnterAction, final String onExitAction) {
    this.name = nullToEmpty(name);
    this.onEnterAction = nullToEmpty(onEnterAction);
    this.onExitAction = nullToEmpty(onExitAction);
  }

  public State(final String name) {
    this(name, "", "");
  }

  static String nullToEmpty(final String text) {
    return text == null ? "" : text;
  }

  public String getName() {
    return name;
  }

  public String getOnEnterAction() {
    return onEnterAction;
  }

  public String getOnExitAction() {
    return onExitAction;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + onEnterAction.hashCode();
    result = prime * result + onExitAction.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    return name.equals(other.name) && onEnterAction.equals(other.onEnterAction)
        && onExitAction.equals(other.onExitAction);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", onEnter=" + onEnterAction + ", onExit=" + onExitAction
        + "]";
  }
}
