package com.github.flowgraph;

/**
 * A host callback bound by name to a state or step hook. {@code dt} is the tick delta for step
 * update hooks and 0 for every other hook.
 */
@FunctionalInterface
public interface FlowAction {
  void run(double dt);
}
