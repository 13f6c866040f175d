package com.github.flowgraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports referential and structural problems of a graph. Nothing here blocks loading, running or
 * compiling; an out-of-range transition simply never fires and an unbound hook never runs. The
 * findings are for humans.
 */
public final class GraphValidator {

  private GraphValidator() {}

  /**
   * Returns an empty list if the graph is clean, otherwise one message per finding.
   */
  public static List<String> validate(final FlowGraph graph) {
    final List<String> findings = new ArrayList<>();
    final int stateCount = graph.getStates().size();

    for (int i = 0; i < graph.getTransitions().size(); i++) {
      final Transition transition = graph.getTransitions().get(i);
      if (transition.getFromState() < 0 || transition.getFromState() >= stateCount) {
        findings.add(String.format("Transition %d: fromState %d is out of range [0,%d)", i,
            transition.getFromState(), stateCount));
      }
      if (transition.getToState() < 0 || transition.getToState() >= stateCount) {
        findings.add(String.format("Transition %d: toState %d is out of range [0,%d)", i,
            transition.getToState(), stateCount));
      }
      if (transition.getEventName().isEmpty()) {
        findings.add(String.format("Transition %d has an empty event name", i));
      }
    }

    for (int i = 0; i < graph.getSteps().size(); i++) {
      final Step step = graph.getSteps().get(i);
      if (!(step.getDuration() > 0.0)) {
        findings.add(String.format("Step %d '%s' has non-positive duration %s", i, step.getName(),
            step.getDuration()));
      }
    }

    final Set<String> names = new HashSet<>();
    for (Variable variable : graph.getVariables()) {
      if (!names.add(variable.getName())) {
        findings.add(String.format("Variable '%s' is declared more than once", variable.getName()));
      }
      if (!variable.getName().equals(Sanitizers.identifier(variable.getName()))) {
        findings.add(String.format(
            "Variable '%s' is not an identifier and cannot be referenced from expressions",
            variable.getName()));
      }
    }

    for (int i = 0; i < graph.getTriggers().size(); i++) {
      final Trigger trigger = graph.getTriggers().get(i);
      if (trigger.getInputKeyName().isEmpty() || trigger.getEventName().isEmpty()) {
        findings.add(String.format("Trigger %d needs both an event and an input key", i));
      }
    }
    return findings;
  }
}
