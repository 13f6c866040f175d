package com.github.flowgraph;

import java.util.List;

/**
 * The time-driven half of a runtime: an endless cycle over the steps in list order. When a step's
 * timer reaches its duration the step ends, the timer restarts at zero and the overshoot is
 * dropped.
 */
final class StepSequencer {
  static final int NOT_STARTED = -1;

  private final List<Step> steps;
  private final CallbackRegistry callbacks;
  private int currentStep = NOT_STARTED;
  private double stepTimer;

  StepSequencer(final List<Step> steps, final CallbackRegistry callbacks) {
    this.steps = steps;
    this.callbacks = callbacks;
  }

  void start() {
    stepTimer = 0.0;
    if (steps.isEmpty()) {
      currentStep = NOT_STARTED;
      return;
    }
    currentStep = 0;
    callbacks.invokeAction(steps.get(0).getOnStartAction(), 0.0);
  }

  void reset() {
    currentStep = NOT_STARTED;
    stepTimer = 0.0;
  }

  /**
   * Returns true iff the sequence advanced to the next step.
   */
  boolean update(final double dt) {
    if (currentStep < 0 || currentStep >= steps.size()) {
      return false;
    }
    stepTimer += dt;
    final Step step = steps.get(currentStep);
    callbacks.invokeAction(step.getOnUpdateAction(), dt);
    if (stepTimer < step.getDuration()) {
      return false;
    }
    callbacks.invokeAction(step.getOnEndAction(), 0.0);
    currentStep = (currentStep + 1) % steps.size();
    stepTimer = 0.0;
    callbacks.invokeAction(steps.get(currentStep).getOnStartAction(), 0.0);
    return true;
  }

  int getCurrentStep() {
    return currentStep;
  }

  Step getCurrent() {
    return currentStep >= 0 && currentStep < steps.size() ? steps.get(currentStep) : null;
  }

  double getStepTimer() {
    return stepTimer;
  }
}
