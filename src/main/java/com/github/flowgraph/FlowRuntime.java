package com.github.flowgraph;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Live runtime of a {@link FlowGraph}: a finite state machine driven by {@link #emit(String)} and
 * an independent step sequencer driven by {@link #update(double)}, sharing one variable store and
 * one set of named callbacks.
 * 
 * Notes for users:<br>
 * 1. this runtime is NOT thread-safe. It is meant to be ticked from one control thread; callers
 * sharing an instance across threads must serialize access themselves<br>
 * 
 * 2. it is designed to not be singleton within a process, create as many as needed. Callback
 * registries belong to the instance<br>
 * 
 * 3. nothing here throws at run time: unbound action names are no-ops, unbound condition names
 * are false, malformed guard expressions evaluate to false and unmatched events leave the state
 * unchanged<br>
 * 
 * 4. there is no terminal state. The host stops calling {@link #update(double)} and
 * {@link #emit(String)} when it is done<br>
 * 
 * 5. the compiled module emitted by {@link FlowCompiler} reproduces exactly these semantics
 * without depending on this library<br>
 */
public interface FlowRuntime {

  ///// Lifecycle /////
  /**
   * Enter state 0 (running its enter action) and step 0 (running its start action). Either half
   * stays inert when the graph has no states or no steps. Resets statistics.
   */
  void start();

  /**
   * Fire the first transition leaving the current state on this event whose guard holds. Returns
   * true iff the state changed.
   */
  boolean emit(final String eventName);

  /**
   * Translate a raw input identifier through the graph's triggers and emit each mapped event in
   * trigger order. Returns the number of transitions fired.
   */
  int emitInput(final String inputKeyName);

  /**
   * Advance the step sequencer by {@code dt} seconds.
   */
  void update(final double dt);

  /**
   * Replace states, transitions, steps, triggers and variables with the given graph. The runtime
   * returns to the not-started state; callbacks stay registered.
   */
  void loadGraph(final FlowGraph graph);

  /**
   * Read a flow file and {@link #loadGraph(FlowGraph)} it. A missing or unreadable file leaves the
   * runtime untouched and reports failure.
   */
  FlowIoResult loadFromFile(final Path path);

  /**
   * The runtime's graph with the variables' current values.
   */
  FlowGraph snapshot();


  ///// Callbacks /////
  void registerAction(final String name, final Runnable action);

  /**
   * Register an action that wants the tick delta, typically bound to a step update hook.
   */
  void registerTimedAction(final String name, final FlowAction action);

  void registerCondition(final String name, final BooleanSupplier condition);


  ///// Variables /////
  void setNumber(final String name, final double value);

  void setBool(final String name, final boolean value);

  void setString(final String name, final String value);

  double getNumber(final String name);

  boolean getBool(final String name);

  String getString(final String name);

  boolean removeVariable(final String name);

  /**
   * Evaluate an expression against the current variables.
   */
  Value evaluate(final String expression);

  /**
   * Resolve a transition guard the way {@link #emit(String)} does. The text is not cached.
   */
  boolean resolveCondition(final String condition);


  ///// Introspection /////
  String getFlowName();

  boolean isStarted();

  /**
   * Index of the current state, -1 before start or with no states.
   */
  int getCurrentState();

  String getCurrentStateName();

  /**
   * Index of the current step, -1 before start or with no steps.
   */
  int getCurrentStep();

  String getCurrentStepName();

  double getStepTimer();

  RuntimeStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build runtimes.
   */
  public final static class FlowRuntimeBuilder {
    private FlowGraph graph;
    private final Map<String, FlowAction> actions = new LinkedHashMap<>();
    private final Map<String, BooleanSupplier> conditions = new LinkedHashMap<>();

    public static FlowRuntimeBuilder newBuilder() {
      return new FlowRuntimeBuilder();
    }

    public FlowRuntimeBuilder graph(final FlowGraph graph) {
      this.graph = graph;
      return this;
    }

    public FlowRuntimeBuilder action(final String name, final Runnable action) {
      this.actions.put(name, action == null ? null : dt -> action.run());
      return this;
    }

    public FlowRuntimeBuilder timedAction(final String name, final FlowAction action) {
      this.actions.put(name, action);
      return this;
    }

    public FlowRuntimeBuilder condition(final String name, final BooleanSupplier condition) {
      this.conditions.put(name, condition);
      return this;
    }

    public FlowRuntime build() {
      final FlowRuntimeImpl runtime =
          new FlowRuntimeImpl(graph == null ? FlowGraph.empty() : graph);
      for (Map.Entry<String, FlowAction> action : actions.entrySet()) {
        runtime.registerTimedAction(action.getKey(), action.getValue());
      }
      for (Map.Entry<String, BooleanSupplier> condition : conditions.entrySet()) {
        runtime.registerCondition(condition.getKey(), condition.getValue());
      }
      return runtime;
    }

    private FlowRuntimeBuilder() {}
  }

}
