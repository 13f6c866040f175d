package com.github.flowgraph;

/**
 * Simple statistics holder for a runtime. Counters are reset by {@link FlowRuntime#start()}.
 */
public final class RuntimeStatistics {
  private long startMillis = System.currentTimeMillis();
  long eventsEmitted;
  long transitionsFired;
  long unmatchedEvents;
  long updates;
  long stepsCompleted;

  void reset() {
    startMillis = System.currentTimeMillis();
    eventsEmitted = 0L;
    transitionsFired = 0L;
    unmatchedEvents = 0L;
    updates = 0L;
    stepsCompleted = 0L;
  }

  public long getEventsEmitted() {
    return eventsEmitted;
  }

  public long getTransitionsFired() {
    return transitionsFired;
  }

  /**
   * Events that matched no transition whose guard held, i.e. left the state unchanged.
   */
  public long getUnmatchedEvents() {
    return unmatchedEvents;
  }

  public long getUpdates() {
    return updates;
  }

  public long getStepsCompleted() {
    return stepsCompleted;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "RuntimeStatistics [eventsEmitted=" + eventsEmitted + ", transitionsFired="
        + transitionsFired + ", unmatchedEvents=" + unmatchedEvents + ", updates=" + updates
        + ", stepsCompleted=" + stepsCompleted + ", aliveTimeMillis=" + getAliveTimeMillis()
        + "]";
  }
}
