package com.github.flowgraph;

/**
 * Declarative mapping from a raw input identifier to the event it should emit.
 */
public final class Trigger {
  private final String eventName;
  private final String inputKeyName;

  public Trigger(final String eventName, final String inputKeyName) {
    this.eventName = State.nullToEmpty(eventName);
    this.inputKeyName = State.nullToEmpty(inputKeyName);
  }

  public String getEventName() {
    return eventName;
  }

  public String getInputKeyName() {
    return inputKeyName;
  }

  @Override
  public int hashCode() {
    return 31 * eventName.hashCode() + inputKeyName.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Trigger other = (Trigger) obj;
    return eventName.equals(other.eventName) && inputKeyName.equals(other.inputKeyName);
  }

  @Override
  public String toString() {
    return "Trigger [eventName=" + eventName + ", inputKeyName=" + inputKeyName + "]";
  }
}
