package com.github.mealymachine;

/**
 * Computes the target state's payload and the step's output. Only invoked for the single
 * transition selected on a step. Must not return null.
 */
@FunctionalInterface
public interface TransitionComputation<I, P, O> {

  TransitionResult<P, O> compute(final P payload, final I input);
}
