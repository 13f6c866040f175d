package com.github.flowgraph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-process runtime used for live preview. See {@link FlowRuntime} for the contract.
 * 
 * The runtime owns its own copies of the graph's lists plus the mutable cursors and the variable
 * tables. The state machine and the sequencer hold references to those lists, so a reload
 * refills them in place.
 */
public final class FlowRuntimeImpl implements FlowRuntime {
  private static final Logger logger = LogManager.getLogger(FlowRuntimeImpl.class.getSimpleName());

  private final List<State> states = new ArrayList<>();
  private final List<Transition> transitions = new ArrayList<>();
  private final List<Step> steps = new ArrayList<>();
  private final List<Trigger> triggers = new ArrayList<>();
  private final List<String> declaredVariables = new ArrayList<>();

  private final VariableStore variables = new VariableStore();
  private final CallbackRegistry callbacks = new CallbackRegistry();
  private final ConditionResolver resolver = new ConditionResolver(variables, callbacks);
  private final FiniteStateMachine stateMachine =
      new FiniteStateMachine(states, transitions, callbacks, resolver);
  private final StepSequencer sequencer = new StepSequencer(steps, callbacks);
  private final RuntimeStatistics statistics = new RuntimeStatistics();

  private String flowName = FlowGraph.DEFAULT_FLOW_NAME;
  private boolean started;

  public FlowRuntimeImpl(final FlowGraph graph) {
    loadGraph(graph);
  }

  @Override
  public void start() {
    statistics.reset();
    started = true;
    stateMachine.start();
    sequencer.start();
    logInfo(flowName, String.format("Started at state %s, step %s", getCurrentStateName(),
        getCurrentStepName()));
  }

  @Override
  public boolean emit(final String eventName) {
    statistics.eventsEmitted++;
    final State from = stateMachine.getCurrent();
    final Transition fired = stateMachine.emit(eventName);
    if (fired == null) {
      statistics.unmatchedEvents++;
      if (logger.isDebugEnabled()) {
        logDebug(flowName, String.format("Event %s left state %s unchanged", eventName,
            from == null ? null : from.getName()));
      }
      return false;
    }
    statistics.transitionsFired++;
    if (logger.isDebugEnabled()) {
      logDebug(flowName, String.format("Event %s moved %s->%s", eventName, from.getName(),
          getCurrentStateName()));
    }
    return true;
  }

  @Override
  public int emitInput(final String inputKeyName) {
    int fired = 0;
    for (Trigger trigger : new ArrayList<>(triggers)) {
      if (trigger.getInputKeyName().equals(inputKeyName) && emit(trigger.getEventName())) {
        fired++;
      }
    }
    return fired;
  }

  @Override
  public void update(final double dt) {
    statistics.updates++;
    final Step before = sequencer.getCurrent();
    if (sequencer.update(dt)) {
      statistics.stepsCompleted++;
      if (logger.isDebugEnabled()) {
        logDebug(flowName, String.format("Step %s ended, now at step %s", before.getName(),
            getCurrentStepName()));
      }
    }
  }

  @Override
  public void loadGraph(final FlowGraph graph) {
    final FlowGraph source = graph == null ? FlowGraph.empty() : graph;
    flowName = source.getFlowName();
    states.clear();
    states.addAll(source.getStates());
    transitions.clear();
    transitions.addAll(source.getTransitions());
    steps.clear();
    steps.addAll(source.getSteps());
    triggers.clear();
    triggers.addAll(source.getTriggers());
    variables.clear();
    declaredVariables.clear();
    for (Variable variable : source.getVariables()) {
      variables.set(variable);
      declaredVariables.add(variable.getName());
    }
    resolver.clearCache();
    stateMachine.reset();
    sequencer.reset();
    started = false;
    logInfo(flowName, "Loaded " + source);
    final List<String> findings = GraphValidator.validate(source);
    for (String finding : findings) {
      logWarning(flowName, finding);
    }
  }

  @Override
  public FlowIoResult loadFromFile(final Path path) {
    final FlowGraphCodec.LoadOutcome outcome = FlowGraphCodec.load(path);
    if (outcome.getResult().isSuccessful()) {
      loadGraph(outcome.getGraph());
    } else {
      logWarning(flowName, outcome.getResult().getDescription());
    }
    return outcome.getResult();
  }

  @Override
  public FlowGraph snapshot() {
    final Map<String, Variable> current = new LinkedHashMap<>();
    for (Variable variable : variables.toVariables()) {
      current.put(variable.getName(), variable);
    }
    final FlowGraph.FlowGraphBuilder builder = FlowGraph.FlowGraphBuilder.newBuilder()
        .flowName(flowName);
    for (State state : states) {
      builder.state(state);
    }
    for (Transition transition : transitions) {
      builder.transition(transition);
    }
    for (Step step : steps) {
      builder.step(step);
    }
    for (Trigger trigger : triggers) {
      builder.trigger(trigger.getEventName(), trigger.getInputKeyName());
    }
    for (String name : declaredVariables) {
      final Variable variable = current.remove(name);
      if (variable != null) {
        builder.variable(variable);
      }
    }
    for (Variable variable : current.values()) {
      builder.variable(variable);
    }
    return builder.build();
  }

  @Override
  public void registerAction(final String name, final Runnable action) {
    callbacks.registerAction(name, action == null ? null : dt -> action.run());
  }

  @Override
  public void registerTimedAction(final String name, final FlowAction action) {
    callbacks.registerAction(name, action);
  }

  @Override
  public void registerCondition(final String name, final BooleanSupplier condition) {
    callbacks.registerCondition(name, condition);
  }

  @Override
  public void setNumber(final String name, final double value) {
    variables.setNumber(name, value);
  }

  @Override
  public void setBool(final String name, final boolean value) {
    variables.setBool(name, value);
  }

  @Override
  public void setString(final String name, final String value) {
    variables.setString(name, value);
  }

  @Override
  public double getNumber(final String name) {
    return variables.getNumber(name);
  }

  @Override
  public boolean getBool(final String name) {
    return variables.getBool(name);
  }

  @Override
  public String getString(final String name) {
    return variables.getString(name);
  }

  @Override
  public boolean removeVariable(final String name) {
    return variables.remove(name);
  }

  @Override
  public Value evaluate(final String expression) {
    return ExpressionParser.evaluate(expression, variables);
  }

  @Override
  public boolean resolveCondition(final String condition) {
    return resolver.resolveOnce(condition);
  }

  @Override
  public String getFlowName() {
    return flowName;
  }

  @Override
  public boolean isStarted() {
    return started;
  }

  @Override
  public int getCurrentState() {
    return stateMachine.getCurrentState();
  }

  @Override
  public String getCurrentStateName() {
    final State state = stateMachine.getCurrent();
    return state == null ? null : state.getName();
  }

  @Override
  public int getCurrentStep() {
    return sequencer.getCurrentStep();
  }

  @Override
  public String getCurrentStepName() {
    final Step step = sequencer.getCurrent();
    return step == null ? null : step.getName();
  }

  @Override
  public double getStepTimer() {
    return sequencer.getStepTimer();
  }

  @Override
  public RuntimeStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "FlowRuntimeImpl [flowName=" + flowName + ", started=" + started + ", currentState="
        + getCurrentState() + ", currentStep=" + getCurrentStep() + ", stepTimer="
        + getStepTimer() + "]";
  }

  private static void logWarning(final String flowName, final String message) {
    logger.warn(new StringBuilder().append("[f:").append(flowName).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String flowName, final String message) {
    logger.info(new StringBuilder().append("[f:").append(flowName).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String flowName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[f:").append(flowName).append("] ")
          .append(message).toString());
    }
  }
}
