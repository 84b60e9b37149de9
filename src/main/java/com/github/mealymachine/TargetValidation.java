package com.github.mealymachine;

/**
 * When the machine checks that a transition's target state id has been registered.
 */
public enum TargetValidation {
  // reject the transition at registration time
  EAGER,
  // allow registration, fail the step that selects the transition
  ON_FIRE;
}
