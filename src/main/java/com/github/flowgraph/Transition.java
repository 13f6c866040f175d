package com.github.flowgraph;

/**
 * An edge of the state machine: leaving {@code fromState} towards {@code toState} when
 * {@code eventName} is emitted and the guard {@code condition} holds. An empty condition always
 * holds.
 * 
 * Indices are not validated here, an out-of-range index is accepted and simply never fires.
 */
public final class Transition {
  private final int fromState;
  private final int toState;
  private final String eventName;
  private final String condition;

  public Transition(final int fromState, final int toState, final String eventName,
      final String condition) {
    this.fromState = fromState;
    this.toState = toState;
    this.eventName = State.nullToEmpty(eventName);
    this.condition = State.nullToEmpty(condition);
  }

  public Transition(final int fromState, final int toState, final String eventName) {
    this(fromState, toState, eventName, "");
  }

  public int getFromState() {
    return fromState;
  }

  public int getToState() {
    return toState;
  }

  public String getEventName() {
    return eventName;
  }

  public String getCondition() {
    return condition;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + fromState;
    result = prime * result + toState;
    result = prime * result + eventName.hashCode();
    result = prime * result + condition.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return fromState == other.fromState && toState == other.toState
        && eventName.equals(other.eventName) && condition.equals(other.condition);
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", toState=" + toState + ", eventName="
        + eventName + ", condition=" + condition + "]";
  }
}
