package com.github.flowgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The authored behavior model: a state machine (states and transitions), an independent cyclic
 * step sequence, input triggers and typed variables. This is the unit the editor produces and the
 * codec and compiler consume.
 * 
 * Notes for users:<br>
 * 1. instances are immutable, use {@link FlowGraphBuilder} to assemble one<br>
 * 
 * 2. states and steps are addressed by index; transitions refer to states by index and the
 * sequence order is the list order<br>
 * 
 * 3. referential integrity is not enforced, see {@link GraphValidator} for a report<br>
 */
public final class FlowGraph {
  public static final String DEFAULT_FLOW_NAME = "Flow";

  private final String flowName;
  private final List<State> states;
  private final List<Transition> transitions;
  private final List<Step> steps;
  private final List<Trigger> triggers;
  private final List<Variable> variables;

  private FlowGraph(final String flowName, final List<State> states,
      final List<Transition> transitions, final List<Step> steps, final List<Trigger> triggers,
      final List<Variable> variables) {
    this.flowName = flowName;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    this.triggers = Collections.unmodifiableList(new ArrayList<>(triggers));
    this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
  }

  public static FlowGraph empty() {
    return FlowGraphBuilder.newBuilder().build();
  }

  public String getFlowName() {
    return flowName;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public List<Step> getSteps() {
    return steps;
  }

  public List<Trigger> getTriggers() {
    return triggers;
  }

  public List<Variable> getVariables() {
    return variables;
  }

  /**
   * Start a builder pre-populated with this graph's contents.
   */
  public FlowGraphBuilder toBuilder() {
    final FlowGraphBuilder builder = FlowGraphBuilder.newBuilder().flowName(flowName);
    builder.states.addAll(states);
    builder.transitions.addAll(transitions);
    builder.steps.addAll(steps);
    builder.triggers.addAll(triggers);
    builder.variables.addAll(variables);
    return builder;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + flowName.hashCode();
    result = prime * result + states.hashCode();
    result = prime * result + transitions.hashCode();
    result = prime * result + steps.hashCode();
    result = prime * result + triggers.hashCode();
    result = prime * result + variables.hashCode();
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
    FlowGraph other = (FlowGraph) obj;
    return flowName.equals(other.flowName) && states.equals(other.states)
        && transitions.equals(other.transitions) && steps.equals(other.steps)
        && triggers.equals(other.triggers) && variables.equals(other.variables);
  }

  @Override
  public String toString() {
    return "FlowGraph [flowName=" + flowName + ", states=" + states.size() + ", transitions="
        + transitions.size() + ", steps=" + steps.size() + ", triggers=" + triggers.size()
        + ", variables=" + variables.size() + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build graphs.
   */
  public final static class FlowGraphBuilder {
    private String flowName = DEFAULT_FLOW_NAME;
    private final List<State> states = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<Step> steps = new ArrayList<>();
    private final List<Trigger> triggers = new ArrayList<>();
    private final List<Variable> variables = new ArrayList<>();

    public static FlowGraphBuilder newBuilder() {
      return new FlowGraphBuilder();
    }

    public FlowGraphBuilder flowName(final String flowName) {
      this.flowName = flowName == null ? DEFAULT_FLOW_NAME : flowName;
      return this;
    }

    public FlowGraphBuilder state(final State state) {
      if (state != null) {
        states.add(state);
      }
      return this;
    }

    public FlowGraphBuilder state(final String name, final String onEnter, final String onExit) {
      return state(new State(name, onEnter, onExit));
    }

    public FlowGraphBuilder transition(final Transition transition) {
      if (transition != null) {
        transitions.add(transition);
      }
      return this;
    }

    public FlowGraphBuilder transition(final int fromState, final int toState,
        final String eventName, final String condition) {
      return transition(new Transition(fromState, toState, eventName, condition));
    }

    public FlowGraphBuilder step(final Step step) {
      if (step != null) {
        steps.add(step);
      }
      return this;
    }

    public FlowGraphBuilder step(final String name, final double duration, final String onStart,
        final String onUpdate, final String onEnd) {
      return step(new Step(name, duration, onStart, onUpdate, onEnd));
    }

    public FlowGraphBuilder trigger(final String eventName, final String inputKeyName) {
      triggers.add(new Trigger(eventName, inputKeyName));
      return this;
    }

    public FlowGraphBuilder variable(final Variable variable) {
      if (variable != null) {
        variables.add(variable);
      }
      return this;
    }

    public FlowGraph build() {
      return new FlowGraph(flowName, states, transitions, steps, triggers, variables);
    }

    private FlowGraphBuilder() {}
  }
}
