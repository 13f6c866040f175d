package com.github.flowgraph;

/**
 * One entry of the cyclic step sequence. Duration is in seconds and expected to be positive; a
 * step with a non-positive duration ends on the first update after it starts.
 */
public final class Step {
  private final String name;
  private final double duration;
  private final String onStartAction;
  private final String onUpdateAction;
  private final String onEndAction;

  public Step(final String name, final double duration, final String onStartAction,
      final String onUpdateAction, final String onEndAction) {
    this.name = State.nullToEmpty(name);
    this.duration = duration;
    this.onStartAction = State.nullToEmpty(onStartAction);
    this.onUpdateAction = State.nullToEmpty(onUpdateAction);
    this.onEndAction = State.nullToEmpty(onEndAction);
  }

  public Step(final String name, final double duration) {
    this(name, duration, "", "", "");
  }

  public String getName() {
    return name;
  }

  public double getDuration() {
    return duration;
  }

  public String getOnStartAction() {
    return onStartAction;
  }

  public String getOnUpdateAction() {
    return onUpdateAction;
  }

  public String getOnEndAction() {
    return onEndAction;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + Double.hashCode(duration);
    result = prime * result + onStartAction.hashCode();
    result = prime * result + onUpdateAction.hashCode();
    result = prime * result + onEndAction.hashCode();
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
    Step other = (Step) obj;
    return name.equals(other.name) && Double.compare(duration, other.duration) == 0
        && onStartAction.equals(other.onStartAction)
        && onUpdateAction.equals(other.onUpdateAction) && onEndAction.equals(other.onEndAction);
  }

  @Override
  public String toString() {
    return "Step [name=" + name + ", duration=" + duration + ", onStart=" + onStartAction
        + ", onUpdate=" + onUpdateAction + ", onEnd=" + onEndAction + "]";
  }
}
