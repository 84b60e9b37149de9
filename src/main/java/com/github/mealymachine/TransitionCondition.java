package com.github.mealymachine;

/**
 * Decides whether a transition is eligible for the current payload and input. Implementations are
 * expected to be pure.
 */
@FunctionalInterface
public interface TransitionCondition<I, P> {

  /**
   * @param payload the occupied state's payload, null when it carries none
   * @param input the input being processed
   */
  boolean test(final P payload, final I input);
}
